package org.muma.mini.kv.common;

import lombok.Getter;
import lombok.Setter;

/**
 * 一个 Key 对应的存储值
 * <p>
 * 类型在创建时确定，之后不可变；改变类型的写入必须整体替换 RedisData。
 * 同类型命令可以原地修改载体 (List/Set/Hash)，但只能在存储引擎的互斥区内进行。
 */
@Getter
public class RedisData<T> {

    public static final long NO_EXPIRE = -1;

    // 数据类型
    private final RedisDataType type;

    // 泛型数据载体 (String是byte[], Hash是RedisHash对象, List是RedisList等)
    private final T data;

    // 过期时间 (毫秒时间戳，-1 表示不过期)
    @Setter
    private long expireAt = NO_EXPIRE;

    public RedisData(RedisDataType type, T data) {
        if (type == null || data == null) {
            throw new IllegalArgumentException("type and data must not be null");
        }
        if (!type.getPayloadType().isInstance(data)) {
            throw new IllegalArgumentException("Payload " + data.getClass().getSimpleName()
                    + " does not match type " + type);
        }
        this.type = type;
        this.data = data;
    }

    public static RedisData<byte[]> ofString(byte[] value) {
        return new RedisData<>(RedisDataType.STRING, value);
    }

    public static RedisData<RedisList> newList() {
        return new RedisData<>(RedisDataType.LIST, new RedisList());
    }

    public static RedisData<RedisSet> newSet() {
        return new RedisData<>(RedisDataType.SET, new RedisSet());
    }

    public static RedisData<RedisHash> newHash() {
        return new RedisData<>(RedisDataType.HASH, new RedisHash());
    }

    public static RedisData<RedisZSet> newZSet() {
        return new RedisData<>(RedisDataType.ZSET, new RedisZSet());
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRE && now >= expireAt;
    }

    // 避免外部强制转换时报 Unchecked warning，同时也方便做类型检查
    public <V> V getValue(Class<V> clazz) {
        if (clazz.isInstance(data)) {
            return clazz.cast(data);
        }
        throw new IllegalStateException("Data type mismatch. Expected " + clazz.getSimpleName() + " but found " + data.getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return "RedisData{type=" + type + ", expireAt=" + expireAt + "}";
    }
}
