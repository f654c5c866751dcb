package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * 命令接口
 * <p>
 * {@code args.elements()[0]} 是命令名，后面才是参数。进入 execute 之前，
 * 分发器已经保证所有元素都是非 null 的 BulkString，且参数个数满足 {@link #minArgs()}/{@link #maxArgs()}。
 */
public interface RedisCommand {

    int UNBOUNDED = -1;

    // 执行命令，传入存储引擎和参数
    RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context);

    /**
     * 最少参数个数 (不含命令名)
     */
    int minArgs();

    /**
     * 最多参数个数 (不含命令名)，{@link #UNBOUNDED} 表示不限；默认与 minArgs 相同
     */
    default int maxArgs() {
        return minArgs();
    }

    /**
     * 辅助工具：快速构建参数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    /**
     * Key / 成员 / 字段参数，按字节无损解码
     */
    default String argKey(RedisArray args, int index) {
        return new String(argBytes(args, index), StorageEngine.KEY_CHARSET);
    }

    /**
     * 文本参数 (数字等)，按 UTF-8 解码
     */
    default String argString(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).asString();
    }

    default byte[] argBytes(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).content();
    }
}
