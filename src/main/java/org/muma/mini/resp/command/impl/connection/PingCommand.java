package org.muma.mini.resp.command.impl.connection;

import org.muma.mini.resp.command.RedisCommand;
import org.muma.mini.resp.protocol.RedisArray;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.protocol.SimpleString;
import org.muma.mini.resp.store.StorageEngine;

/**
 * PING [message]
 */
public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        return switch (args.size()) {
            case 1 -> PONG;
            case 2 -> arg(args, 1);
            default -> errorArgs("ping");
        };
    }
}
