package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.common.RedisList;

/**
 * RPUSH key element [element ...]
 */
public class RPushCommand extends AbstractPushCommand {
    @Override
    protected void push(RedisList list, byte[] element) {
        list.rpush(element);
    }
}
