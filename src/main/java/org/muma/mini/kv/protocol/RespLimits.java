package org.muma.mini.kv.protocol;

/**
 * 解码器的防御性上限，防止恶意对端用超深嵌套或超大长度耗尽栈/内存
 *
 * @param maxDepth       数组最大嵌套层数 (顶层数组算 1 层)
 * @param maxArrayLength 单个数组最多元素数
 * @param maxBulkLength  单个 BulkString 最大字节数
 * @param maxLineLength  单行 (SimpleString / Error / 长度行) 最大字节数
 */
public record RespLimits(int maxDepth, int maxArrayLength, int maxBulkLength, int maxLineLength) {

    // 与 Redis 默认值保持一致: proto-max-bulk-len 512mb, inline 64kb
    public static final RespLimits DEFAULT = new RespLimits(32, 1024 * 1024, 512 * 1024 * 1024, 64 * 1024);

    public RespLimits {
        if (maxDepth <= 0 || maxArrayLength <= 0 || maxBulkLength <= 0 || maxLineLength <= 0) {
            throw new IllegalArgumentException("RESP limits must be positive: depth=" + maxDepth
                    + ", array=" + maxArrayLength + ", bulk=" + maxBulkLength + ", line=" + maxLineLength);
        }
    }
}
