package org.muma.mini.resp.protocol;

/**
 * RESP 解析异常，携带失败分类
 */
public class RespProtocolException extends RuntimeException {

    private final ParseError kind;

    public RespProtocolException(ParseError kind, String message) {
        // 半包在流式解码中很常见，不需要堆栈
        super(message, null, false, kind != ParseError.UNEXPECTED_END);
        this.kind = kind;
    }

    public ParseError getKind() {
        return kind;
    }
}
