package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * SET key value
 * <p>
 * 无条件覆盖：旧值的类型和过期时间一并丢弃
 */
public class SetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        storage.putString(argKey(args, 1), argBytes(args, 2));
        return SimpleString.OK;
    }

    @Override
    public int minArgs() {
        return 2;
    }
}
