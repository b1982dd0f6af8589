package org.muma.mini.resp.protocol;

// 密封接口，限制实现类: 只支持 RESP 的四种类型
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, BulkString, RedisArray {
}
