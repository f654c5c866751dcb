package org.muma.mini.kv.protocol;

/**
 * RESP 协议值 (密封接口)
 * <p>
 * 五种形态: SimpleString / ErrorMessage / RedisInteger / BulkString / RedisArray。
 * 只有 BulkString 与 RedisArray 允许 null 形态 ($-1 / *-1)，且 null 与空值不同。
 * 所有实现都是不可变的，每次解码或回复都新建实例。
 */
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {
}
