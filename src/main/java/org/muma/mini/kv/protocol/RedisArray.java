package org.muma.mini.kv.protocol;

import java.util.Arrays;
import java.util.List;

// 5. 数组 (*) - 支持 null (表示 *-1)，元素可以递归嵌套
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);
    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(elements);
    }

    public static RedisArray of(List<? extends RedisMessage> elements) {
        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[null]" : "RedisArray" + Arrays.toString(elements);
    }
}
