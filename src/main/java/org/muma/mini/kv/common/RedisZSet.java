package org.muma.mini.kv.common;

/**
 * 有序集合载体占位，只用于让 ZSET 类型可以被表示
 * TODO: 等 ZADD/ZRANGE 加入命令表时补上 member -> score 与按分数排序的结构
 */
public final class RedisZSet {
}
