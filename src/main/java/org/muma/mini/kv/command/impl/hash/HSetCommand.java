package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisHash;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * HSET key field value [field value ...]
 * 返回新建字段的个数
 */
public class HSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        // Key 之后必须是成对的 field-value
        if ((args.size() - 2) % 2 != 0) {
            return errorArgs("hset");
        }

        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> redisData = storage.get(key);
            RedisHash hash;

            if (redisData == null) {
                RedisData<RedisHash> created = RedisData.newHash();
                hash = created.getData();
                redisData = created;
            } else {
                if (redisData.getType() != RedisDataType.HASH) {
                    return ErrorMessage.wrongType();
                }
                hash = redisData.getValue(RedisHash.class);
            }

            int createdCount = 0;
            for (int i = 2; i < args.size(); i += 2) {
                createdCount += hash.put(argKey(args, i), argBytes(args, i + 1));
            }

            storage.put(key, redisData);
            return new RedisInteger(createdCount);
        });
    }

    @Override
    public int minArgs() {
        return 3;
    }

    @Override
    public int maxArgs() {
        return UNBOUNDED;
    }
}
