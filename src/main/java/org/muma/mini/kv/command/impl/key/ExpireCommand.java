package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;

/**
 * EXPIRE key seconds
 * <p>
 * 秒数 <= 0 时直接删除 Key (与 Redis 一致)，仍然返回 1
 */
public class ExpireCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);
        long seconds;
        try {
            seconds = Long.parseLong(argString(args, 2));
        } catch (NumberFormatException e) {
            return errorInt();
        }

        long newExpire;
        try {
            newExpire = Math.addExact(storage.now(), Math.multiplyExact(seconds, 1000L));
        } catch (ArithmeticException e) {
            return new ErrorMessage("ERR invalid expire time in 'expire' command");
        }

        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            if (data == null) {
                return RedisInteger.ZERO;
            }
            if (seconds <= 0) {
                storage.remove(key);
                return RedisInteger.ONE;
            }
            data.setExpireAt(newExpire);
            return RedisInteger.ONE;
        });
    }

    @Override
    public int minArgs() {
        return 2;
    }
}
