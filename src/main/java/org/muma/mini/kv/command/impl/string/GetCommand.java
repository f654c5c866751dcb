package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * GET key
 * <p>
 * Key 不存在、已过期或者不是 String 类型，都返回 nil (不报 WRONGTYPE)
 */
public class GetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        byte[] value = storage.getString(argKey(args, 1));
        return value == null ? BulkString.NULL : new BulkString(value);
    }

    @Override
    public int minArgs() {
        return 1;
    }
}
