package org.muma.mini.kv.protocol;

/**
 * 值读到一半流就结束了 (例如声明了长度但字节不够)
 * <p>
 * 阻塞流上是硬错误；Netty 解码器据此判断"半包"，回滚读指针等待更多数据。
 */
public class RespTruncatedException extends RespProtocolException {

    public RespTruncatedException(String message) {
        super(message);
    }
}
