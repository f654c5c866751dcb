package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * TTL key: -2 表示不存在，-1 表示没有过期时间，否则返回剩余秒数 (四舍五入)
 */
public class TTLCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        // expireAt 可能被并发的 EXPIRE/PERSIST 修改，两次读取必须在同一个临界区内
        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            if (data == null) {
                return new RedisInteger(-2);
            }
            if (!data.hasExpire()) {
                return new RedisInteger(-1);
            }

            long ttlMs = data.getExpireAt() - storage.now();
            return new RedisInteger(Math.max(0, (ttlMs + 500) / 1000));
        });
    }

    @Override
    public int minArgs() {
        return 1;
    }
}
