package org.muma.mini.kv.protocol;

import java.util.Objects;

// 2. 错误 (-)，帧格式与 SimpleString 相同，仅类型标识不同
public record ErrorMessage(String content) implements RedisMessage {

    public static final String WRONG_TYPE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public ErrorMessage {
        Objects.requireNonNull(content, "content");
    }

    public static ErrorMessage wrongType() {
        return new ErrorMessage(WRONG_TYPE);
    }
}
