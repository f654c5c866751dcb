package org.muma.mini.kv.common;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Redis List 封装，底层是 ArrayDeque，两端操作均为 O(1)
 */
public class RedisList {

    private final Deque<byte[]> elements = new ArrayDeque<>();

    /**
     * 头部插入 (LPUSH)
     */
    public void lpush(byte[] element) {
        elements.addFirst(element);
    }

    /**
     * 尾部插入 (RPUSH)
     */
    public void rpush(byte[] element) {
        elements.addLast(element);
    }

    /**
     * 头部弹出 (LPOP)，空列表返回 null
     */
    public byte[] lpop() {
        return elements.pollFirst();
    }

    /**
     * 尾部弹出 (RPOP)，空列表返回 null
     */
    public byte[] rpop() {
        return elements.pollLast();
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    // 从左到右的拷贝
    public List<byte[]> toList() {
        return new ArrayList<>(elements);
    }
}
