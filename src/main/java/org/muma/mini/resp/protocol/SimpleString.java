package org.muma.mini.resp.protocol;

// 1. 简单字符串 (+)
public record SimpleString(String content) implements RedisMessage {
}
