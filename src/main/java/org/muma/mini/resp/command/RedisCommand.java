package org.muma.mini.resp.command;

import org.muma.mini.resp.protocol.BulkString;
import org.muma.mini.resp.protocol.ErrorMessage;
import org.muma.mini.resp.protocol.RedisArray;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.store.StorageEngine;

public interface RedisCommand {
    // 执行命令，传入存储引擎和参数 (args[0] 是命令名)
    RedisMessage execute(StorageEngine storage, RedisArray args);

    /**
     * 辅助工具：快速构建参数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：取第 index 个参数。Dispatcher 已保证参数都是 BulkString
     */
    default BulkString arg(RedisArray args, int index) {
        return (BulkString) args.elements()[index];
    }
}
