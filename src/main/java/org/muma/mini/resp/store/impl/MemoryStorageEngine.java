package org.muma.mini.resp.store.impl;

import org.muma.mini.resp.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // ConcurrentHashMap 的单个 get/put 本身是原子的，不需要额外加锁
    // ByteBuffer 的 equals/hashCode 按内容计算，Key 是二进制安全的
    private final Map<ByteBuffer, byte[]> memoryDb = new ConcurrentHashMap<>();

    @Override
    public byte[] get(byte[] key) {
        return memoryDb.get(ByteBuffer.wrap(key));
    }

    @Override
    public byte[] put(byte[] key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        // Key 拷贝一份，调用方之后改动数组不会影响 Map 中的 hash
        byte[] previous = memoryDb.put(ByteBuffer.wrap(key.clone()), value);
        if (log.isTraceEnabled()) {
            log.trace("put keyLen={} size={} overwrite={}", key.length, value.length, previous != null);
        }
        return previous;
    }

    @Override
    public int size() {
        return memoryDb.size();
    }
}
