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
 * HDEL key field [field ...]
 */
public class HDelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> redisData = storage.get(key);
            if (redisData == null) {
                return RedisInteger.ZERO;
            }
            if (redisData.getType() != RedisDataType.HASH) {
                return ErrorMessage.wrongType();
            }

            RedisHash hash = redisData.getValue(RedisHash.class);
            int deletedCount = 0;
            for (int i = 2; i < args.size(); i++) {
                deletedCount += hash.remove(argKey(args, i));
            }

            // Hash 为空了，把整个 Key 从 DB 移除
            if (hash.isEmpty()) {
                storage.remove(key);
            }
            return new RedisInteger(deletedCount);
        });
    }

    @Override
    public int minArgs() {
        return 2;
    }

    @Override
    public int maxArgs() {
        return UNBOUNDED;
    }
}
