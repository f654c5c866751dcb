package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisList;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * LPOP / RPOP 公共逻辑：弹空后删除整个 Key，不保留空列表
 */
public abstract class AbstractPopCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            if (data == null) {
                return BulkString.NULL;
            }
            if (data.getType() != RedisDataType.LIST) {
                return ErrorMessage.wrongType();
            }

            RedisList list = data.getValue(RedisList.class);
            byte[] val = pop(list);

            if (list.isEmpty()) {
                storage.remove(key);
            }
            return val == null ? BulkString.NULL : new BulkString(val);
        });
    }

    protected abstract byte[] pop(RedisList list);

    @Override
    public int minArgs() {
        return 1;
    }
}
