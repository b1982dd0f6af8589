package org.muma.mini.resp.protocol;

/**
 * RESP 解析失败的分类
 */
public enum ParseError {
    // 未知类型字节、空行、数组元素不是 BulkString
    INVALID_FORMAT,
    // 长度/数量不是非负整数，或超过上限
    INVALID_LENGTH,
    // 实际数据长度与声明长度不符
    MALFORMED_INPUT,
    // 数据不完整 (半包)
    UNEXPECTED_END
}
