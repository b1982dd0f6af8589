package org.muma.mini.resp.command;

import org.muma.mini.resp.command.impl.connection.EchoCommand;
import org.muma.mini.resp.command.impl.connection.PingCommand;
import org.muma.mini.resp.command.impl.string.GetCommand;
import org.muma.mini.resp.command.impl.string.SetCommand;
import org.muma.mini.resp.protocol.BulkString;
import org.muma.mini.resp.protocol.ErrorMessage;
import org.muma.mini.resp.protocol.RedisArray;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * 命令分发：校验请求格式 -> 查找命令 -> 校验参数个数 -> 执行
 * 任何分支都只返回一个回复，不会关闭连接。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final long DEFAULT_SLOW_LOG_THRESHOLD_MS = 10;

    static final ErrorMessage UNKNOWN_COMMAND = new ErrorMessage("ERR unknown command");
    static final ErrorMessage INVALID_COMMAND_FORMAT = new ErrorMessage("ERR invalid command format");
    static final ErrorMessage INVALID_ARGUMENT_TYPE = new ErrorMessage("ERR invalid argument type");
    static final ErrorMessage INTERNAL_ERROR = new ErrorMessage("ERR internal server error");

    private final Map<CommandType, RedisCommand> commandMap = new EnumMap<>(CommandType.class);
    private final StorageEngine storage;
    private final long slowLogThresholdMs;

    public CommandDispatcher(StorageEngine storage) {
        this(storage, DEFAULT_SLOW_LOG_THRESHOLD_MS);
    }

    public CommandDispatcher(StorageEngine storage, long slowLogThresholdMs) {
        this.storage = storage;
        this.slowLogThresholdMs = slowLogThresholdMs;
        this.initCommandRegistry();
    }

    private void initCommandRegistry() {
        commandMap.put(CommandType.PING, new PingCommand());
        commandMap.put(CommandType.ECHO, new EchoCommand());
        commandMap.put(CommandType.SET, new SetCommand());
        commandMap.put(CommandType.GET, new GetCommand());

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(RedisMessage request) {
        // 1. 顶层必须是数组
        if (!(request instanceof RedisArray array)) {
            log.warn("Received non-array request: {}", request);
            return INVALID_COMMAND_FORMAT;
        }
        RedisMessage[] elements = array.elements();
        if (elements == null || elements.length == 0) {
            return UNKNOWN_COMMAND;
        }
        if (!(elements[0] instanceof BulkString cmdNameBulk) || cmdNameBulk.isNull()) {
            return INVALID_COMMAND_FORMAT;
        }

        // 2. 查找命令
        String commandName = cmdNameBulk.asString();
        CommandType type = CommandType.lookup(commandName);
        RedisCommand command = type == null ? null : commandMap.get(type);
        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return UNKNOWN_COMMAND;
        }

        // 3. 参数校验
        for (int i = 1; i < elements.length; i++) {
            if (!(elements[i] instanceof BulkString arg) || arg.isNull()) {
                return INVALID_ARGUMENT_TYPE;
            }
        }
        if (!type.acceptsArgCount(elements.length)) {
            return command.errorArgs(type.commandName());
        }

        // 4. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, array);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > slowLogThresholdMs) {
                log.warn("Slow command detected: {} cost {}ms", type, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} args={} cost {}ms", type, elements.length - 1, duration);
            }
            return response;

        } catch (Exception e) {
            log.error("Internal Server Error processing command: {}", type, e);
            return INTERNAL_ERROR;
        }
    }
}
