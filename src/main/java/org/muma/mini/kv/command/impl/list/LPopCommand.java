package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.common.RedisList;

/**
 * LPOP key
 * <p>
 * 【时间复杂度】 O(1)
 */
public class LPopCommand extends AbstractPopCommand {
    @Override
    protected byte[] pop(RedisList list) {
        return list.lpop();
    }
}
