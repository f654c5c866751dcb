package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisList;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * LLEN key
 * <p>
 * Key 不存在返回 0 (不算错误)；类型不符才报 WRONGTYPE
 */
public class LLenCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            if (data == null) return RedisInteger.ZERO;
            if (data.getType() != RedisDataType.LIST) {
                return ErrorMessage.wrongType();
            }
            return new RedisInteger(data.getValue(RedisList.class).size());
        });
    }

    @Override
    public int minArgs() {
        return 1;
    }
}
