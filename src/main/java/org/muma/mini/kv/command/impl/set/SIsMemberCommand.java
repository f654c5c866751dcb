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

public class SIsMemberCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);
        String member = argKey(args, 2);

        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            if (data == null) return RedisInteger.ZERO;
            if (data.getType() != RedisDataType.SET) {
                return ErrorMessage.wrongType();
            }
            return RedisInteger.of(data.getValue(RedisSet.class).contains(member));
        });
    }

    @Override
    public int minArgs() {
        return 2;
    }
}
