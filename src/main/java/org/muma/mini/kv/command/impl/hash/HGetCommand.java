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

public class HGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);
        String field = argKey(args, 2);

        return storage.atomically(() -> {
            RedisData<?> redisData = storage.get(key);
            if (redisData == null) return BulkString.NULL;
            if (redisData.getType() != RedisDataType.HASH) {
                return ErrorMessage.wrongType();
            }

            byte[] value = redisData.getValue(RedisHash.class).get(field);
            return value == null ? BulkString.NULL : new BulkString(value);
        });
    }

    @Override
    public int minArgs() {
        return 2;
    }
}
