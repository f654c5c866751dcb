package org.muma.mini.kv.protocol;

import java.io.IOException;

/**
 * 协议解码错误 (帧格式非法、长度非数字、超出限制等)
 * <p>
 * 解码器无法在字节流中重新同步，所以对连接来说是致命错误。
 */
public class RespProtocolException extends IOException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
