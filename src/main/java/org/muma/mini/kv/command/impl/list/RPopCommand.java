package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.common.RedisList;

/**
 * RPOP key
 */
public class RPopCommand extends AbstractPopCommand {
    @Override
    protected byte[] pop(RedisList list) {
        return list.rpop();
    }
}
