package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.RedisData;
import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisSet;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * SMEMBERS key
 * Time Complexity: O(N)
 */
public class SMembersCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(SMembersCommand.class);

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        String key = argKey(args, 1);

        return storage.atomically(() -> {
            RedisData<?> data = storage.get(key);
            if (data == null) return RedisArray.EMPTY;
            if (data.getType() != RedisDataType.SET) return ErrorMessage.wrongType();

            RedisSet set = data.getValue(RedisSet.class);
            if (set.size() > 10000) {
                log.warn("SMEMBERS called on large set '{}' with {} items.", key, set.size());
            }

            List<String> members = set.getAll();
            RedisMessage[] result = new RedisMessage[members.size()];
            for (int i = 0; i < members.size(); i++) {
                result[i] = new BulkString(members.get(i).getBytes(StorageEngine.KEY_CHARSET));
            }
            return new RedisArray(result);
        });
    }

    @Override
    public int minArgs() {
        return 1;
    }
}
