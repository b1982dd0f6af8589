package org.muma.mini.resp.command.impl.connection;

import org.muma.mini.resp.command.RedisCommand;
import org.muma.mini.resp.protocol.BulkString;
import org.muma.mini.resp.protocol.RedisArray;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.store.StorageEngine;

public class EchoCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) {
            return errorArgs("echo");
        }
        BulkString message = arg(args, 1);
        return new BulkString(message.content());
    }
}
