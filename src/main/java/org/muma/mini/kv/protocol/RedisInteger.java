package org.muma.mini.kv.protocol;

// 3. 整数 (:)，有符号 64 位
public record RedisInteger(long value) implements RedisMessage {

    public static final RedisInteger ZERO = new RedisInteger(0);
    public static final RedisInteger ONE = new RedisInteger(1);

    public static RedisInteger of(boolean flag) {
        return flag ? ONE : ZERO;
    }
}
