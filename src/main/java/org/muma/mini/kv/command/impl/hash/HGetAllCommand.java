package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisHash;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

import java.util.Map;

/**
 * HGETALL key
 * 回复格式: [field1, value1, field2, value2, ...]
 */
public class HGetAllCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> redisData = storage.get(key);
            if (redisData == null) {
                return RedisArray.EMPTY;
            }
            if (redisData.getType() != RedisDataType.HASH) {
                return ErrorMessage.wrongType();
            }

            Map<String, byte[]> all = redisData.getValue(RedisHash.class).toMap();
            RedisMessage[] result = new RedisMessage[all.size() * 2];
            int i = 0;
            for (Map.Entry<String, byte[]> entry : all.entrySet()) {
                result[i++] = new BulkString(entry.getKey().getBytes(StorageEngine.KEY_CHARSET));
                result[i++] = new BulkString(entry.getValue());
            }
            return new RedisArray(result);
        });
    }

    @Override
    public int minArgs() {
        return 1;
    }
}
