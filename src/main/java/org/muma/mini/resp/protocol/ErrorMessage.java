package org.muma.mini.resp.protocol;

// 2. 错误 (-)
public record ErrorMessage(String content) implements RedisMessage {
}
