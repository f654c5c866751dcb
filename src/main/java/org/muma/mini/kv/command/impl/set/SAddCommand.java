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
 * SADD key member [member ...]，返回新加入的成员数
 */
public class SAddCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            RedisSet set;

            if (data == null) {
                RedisData<RedisSet> created = RedisData.newSet();
                set = created.getData();
                data = created;
            } else {
                if (data.getType() != RedisDataType.SET) {
                    return ErrorMessage.wrongType();
                }
                set = data.getValue(RedisSet.class);
            }

            int addedCount = 0;
            for (int i = 2; i < args.size(); i++) {
                addedCount += set.add(argKey(args, i));
            }

            storage.put(key, data);
            return new RedisInteger(addedCount);
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
