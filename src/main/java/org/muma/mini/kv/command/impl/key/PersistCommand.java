package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * PERSIST key: 移除过期时间
 */
public class PersistCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);
        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            if (data == null || !data.hasExpire()) {
                return RedisInteger.ZERO;
            }
            data.setExpireAt(RedisData.NO_EXPIRE);
            return RedisInteger.ONE;
        });
    }

    @Override
    public int minArgs() {
        return 1;
    }
}
