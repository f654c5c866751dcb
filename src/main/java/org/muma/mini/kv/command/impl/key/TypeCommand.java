package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * TYPE key
 */
public class TypeCommand implements RedisCommand {

    private static final SimpleString NONE = new SimpleString("none");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisData<?> data = storage.get(argKey(args, 1));
        return data == null ? NONE : new SimpleString(data.getType().getTypeName());
    }

    @Override
    public int minArgs() {
        return 1;
    }
}
