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
 * LPUSH / RPUSH 公共逻辑
 * <p>
 * Key 不存在时自动创建空 List；多个元素按参数顺序依次推入，
 * 所以 LPUSH mylist a b c 的结果是 c, b, a。
 */
public abstract class AbstractPushCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            RedisList list;

            if (data == null) {
                RedisData<RedisList> created = RedisData.newList();
                list = created.getData();
                data = created;
            } else {
                if (data.getType() != RedisDataType.LIST) {
                    return ErrorMessage.wrongType();
                }
                list = data.getValue(RedisList.class);
            }

            for (int i = 2; i < args.size(); i++) {
                push(list, argBytes(args, i));
            }

            storage.put(key, data);
            return new RedisInteger(list.size());
        });
    }

    protected abstract void push(RedisList list, byte[] element);

    @Override
    public int minArgs() {
        return 2;
    }

    @Override
    public int maxArgs() {
        return UNBOUNDED;
    }
}
