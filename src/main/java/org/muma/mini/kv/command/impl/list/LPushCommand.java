package org.muma.mini.kv.command.impl.list;

import org.muma.mini.kv.common.RedisList;

/**
 * LPUSH key element [element ...]
 * <p>
 * 【时间复杂度】 O(K)，K 是推入元素的数量
 */
public class LPushCommand extends AbstractPushCommand {
    @Override
    protected void push(RedisList list, byte[] element) {
        list.lpush(element);
    }
}
