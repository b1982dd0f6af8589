package org.muma.mini.resp.command.impl.string;

import org.muma.mini.resp.command.RedisCommand;
import org.muma.mini.resp.protocol.BulkString;
import org.muma.mini.resp.protocol.RedisArray;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 2) {
            return errorArgs("get");
        }

        byte[] key = arg(args, 1).content();
        byte[] data = storage.get(key);

        if (data == null) {
            return BulkString.NULL; // Nil
        }
        return new BulkString(data);
    }
}
