package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisSet;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * SREM key member [member ...]
 * 集合删空后移除整个 Key
 */
public class SRemCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            if (data == null) return RedisInteger.ZERO;
            if (data.getType() != RedisDataType.SET) {
                return ErrorMessage.wrongType();
            }

            RedisSet set = data.getValue(RedisSet.class);
            int removed = 0;
            for (int i = 2; i < args.size(); i++) {
                removed += set.remove(argKey(args, i));
            }

            if (set.isEmpty()) {
                storage.remove(key);
            }
            return new RedisInteger(removed);
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
