package org.muma.mini.resp.command;

import java.util.Locale;

/**
 * 支持的命令及其参数个数 (包含命令名本身)
 * arity > 0 表示必须正好等于；arity < 0 表示至少 |arity| 个，与 Redis 命令表的约定一致
 */
public enum CommandType {

    PING(-1),
    ECHO(2),
    SET(3),
    GET(2);

    private final int arity;

    CommandType(int arity) {
        this.arity = arity;
    }

    public boolean acceptsArgCount(int argc) {
        return arity > 0 ? argc == arity : argc >= -arity;
    }

    /**
     * 小写的命令名，用于错误信息
     */
    public String commandName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 大小写不敏感查找，未知命令返回 null
     */
    public static CommandType lookup(String name) {
        if (name == null) return null;
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
