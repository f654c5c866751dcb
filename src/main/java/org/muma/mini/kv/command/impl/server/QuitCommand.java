package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * QUIT: 回复 +OK，写出后由连接处理器关闭连接
 */
public class QuitCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(QuitCommand.class);

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (context.getNettyCtx() != null) {
            log.debug("Client {} sent QUIT", context.getNettyCtx().channel().remoteAddress());
        }
        context.requestClose();
        return SimpleString.OK;
    }

    @Override
    public int minArgs() {
        return 0;
    }
}
