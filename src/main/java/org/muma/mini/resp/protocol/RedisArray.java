package org.muma.mini.resp.protocol;

import java.util.Arrays;

// 4. 数组 (*)
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    @Override
    public String toString() {
        return "RedisArray" + Arrays.toString(elements);
    }
}
