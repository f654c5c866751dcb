package org.muma.mini.kv.common;

import lombok.Getter;

/**
 * 存储值的类型 (封闭集合)
 * <p>
 * ZSET 目前没有命令会创建，只作为类型占位；新增有序集合命令时再补齐操作。
 */
@Getter
public enum RedisDataType {

    STRING("string", byte[].class),
    LIST("list", RedisList.class),
    SET("set", RedisSet.class),
    HASH("hash", RedisHash.class),
    ZSET("zset", RedisZSet.class);

    // TYPE 命令返回的名字
    private final String typeName;
    private final Class<?> payloadType;

    RedisDataType(String typeName, Class<?> payloadType) {
        this.typeName = typeName;
        this.payloadType = payloadType;
    }
}
