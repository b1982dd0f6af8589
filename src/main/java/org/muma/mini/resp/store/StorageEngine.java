package org.muma.mini.resp.store;

/**
 * 全局共享的 KV 存储，所有连接共用一个实例。
 * Key 和 Value 都是原始字节，按字节内容比较，不做字符集转换。
 * 实现必须保证 get/put 之间的原子性。
 */
public interface StorageEngine {

    /**
     * @return 对应的值；Key 不存在时返回 null。空值返回长度为 0 的数组，不是 null。
     */
    byte[] get(byte[] key);

    /**
     * 覆盖写入
     *
     * @return 之前的值，不存在则为 null
     */
    byte[] put(byte[] key, byte[] value);

    int size();
}
