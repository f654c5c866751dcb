package org.muma.mini.kv.command;

import org.muma.mini.kv.command.impl.hash.HDelCommand;
import org.muma.mini.kv.command.impl.hash.HGetAllCommand;
import org.muma.mini.kv.command.impl.hash.HGetCommand;
import org.muma.mini.kv.command.impl.hash.HSetCommand;
import org.muma.mini.kv.command.impl.key.DelCommand;
import org.muma.mini.kv.command.impl.key.ExpireCommand;
import org.muma.mini.kv.command.impl.key.PersistCommand;
import org.muma.mini.kv.command.impl.key.TTLCommand;
import org.muma.mini.kv.command.impl.key.TypeCommand;
import org.muma.mini.kv.command.impl.list.LLenCommand;
import org.muma.mini.kv.command.impl.list.LPopCommand;
import org.muma.mini.kv.command.impl.list.LPushCommand;
import org.muma.mini.kv.command.impl.list.RPopCommand;
import org.muma.mini.kv.command.impl.list.RPushCommand;
import org.muma.mini.kv.command.impl.server.PingCommand;
import org.muma.mini.kv.command.impl.server.QuitCommand;
import org.muma.mini.kv.command.impl.set.SAddCommand;
import org.muma.mini.kv.command.impl.set.SIsMemberCommand;
import org.muma.mini.kv.command.impl.set.SMembersCommand;
import org.muma.mini.kv.command.impl.set.SRemCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 命令分发器
 * <p>
 * dispatch 是全函数：任何请求都会得到一个回复，异常不会越过这里。
 * 校验顺序: 请求格式 -> 命令名 (区分大小写) -> 参数个数 -> 类型 (由具体命令检查)。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String INVALID_FORMAT = "ERR invalid command format";

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerServerCommands();
        registerKeyCommands();
        registerStringCommands();
        registerListCommands();
        registerSetCommands();
        registerHashCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerServerCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("QUIT", new QuitCommand());
    }

    private void registerKeyCommands() {
        commandMap.put("DEL", new DelCommand());
        commandMap.put("TYPE", new TypeCommand());
        commandMap.put("EXPIRE", new ExpireCommand());
        commandMap.put("TTL", new TTLCommand());
        commandMap.put("PERSIST", new PersistCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerListCommands() {
        commandMap.put("LPUSH", new LPushCommand());
        commandMap.put("RPUSH", new RPushCommand());
        commandMap.put("LPOP", new LPopCommand());
        commandMap.put("RPOP", new RPopCommand());
        commandMap.put("LLEN", new LLenCommand());
    }

    private void registerSetCommands() {
        commandMap.put("SADD", new SAddCommand());
        commandMap.put("SREM", new SRemCommand());
        commandMap.put("SISMEMBER", new SIsMemberCommand());
        commandMap.put("SMEMBERS", new SMembersCommand());
    }

    private void registerHashCommands() {
        commandMap.put("HSET", new HSetCommand());
        commandMap.put("HGET", new HGetCommand());
        commandMap.put("HDEL", new HDelCommand());
        commandMap.put("HGETALL", new HGetAllCommand());
    }

    public Set<String> commandNames() {
        return Collections.unmodifiableSet(commandMap.keySet());
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(RedisMessage request, RedisContext context) {
        // 1. 请求格式: 非 null 且非空的数组
        if (!(request instanceof RedisArray array) || array.isNull() || array.size() == 0) {
            log.warn("Rejected malformed request: {}", request);
            return new ErrorMessage(INVALID_FORMAT);
        }
        RedisArray args = normalize(array);
        if (args == null) {
            log.warn("Rejected request with non-scalar arguments: {}", request);
            return new ErrorMessage(INVALID_FORMAT);
        }

        // 2. 查找命令 (区分大小写)
        String commandName = ((BulkString) args.elements()[0]).asString();
        RedisCommand command = commandMap.get(commandName);
        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command '" + sanitize(commandName) + "'");
        }

        // 3. 参数个数
        int argc = args.size() - 1;
        if (argc < command.minArgs() || (command.maxArgs() != RedisCommand.UNBOUNDED && argc > command.maxArgs())) {
            return command.errorArgs(commandName.toLowerCase(Locale.ROOT));
        }

        // 4. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, args, context);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > 10) {
                log.warn("Slow command detected: {} cost {}ms", commandName, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} argc={} cost {}ms", commandName, argc, duration);
            }
            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误
            log.warn("Command execution failed (Client Error): {} - {}", commandName, e.getMessage());
            return new ErrorMessage("ERR " + sanitize(String.valueOf(e.getMessage())));

        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", commandName, e);
            return new ErrorMessage("ERR internal server error");
        }
    }

    /**
     * 把参数统一转换为 BulkString；含 null 值或嵌套数组时返回 null
     */
    private RedisArray normalize(RedisArray array) {
        RedisMessage[] elements = array.elements();
        RedisMessage[] normalized = new RedisMessage[elements.length];
        for (int i = 0; i < elements.length; i++) {
            RedisMessage element = elements[i];
            if (element instanceof BulkString b && !b.isNull()) {
                normalized[i] = b;
            } else if (element instanceof SimpleString s) {
                normalized[i] = new BulkString(s.content());
            } else if (element instanceof RedisInteger n) {
                normalized[i] = new BulkString(Long.toString(n.value()));
            } else {
                return null;
            }
        }
        return new RedisArray(normalized);
    }

    // 错误行里不能出现 CR/LF，否则会破坏回复帧
    private static String sanitize(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }
}
