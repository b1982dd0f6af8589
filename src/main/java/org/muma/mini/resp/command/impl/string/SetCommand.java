package org.muma.mini.resp.command.impl.string;

import org.muma.mini.resp.command.RedisCommand;
import org.muma.mini.resp.protocol.RedisArray;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.protocol.SimpleString;
import org.muma.mini.resp.store.StorageEngine;

/**
 * SET key value
 * <p>
 * 只支持最基本的覆盖写，不支持 NX/XX/EX/PX 选项。
 */
public class SetCommand implements RedisCommand {

    private static final SimpleString OK = new SimpleString("OK");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.size() != 3) {
            return errorArgs("set");
        }

        byte[] key = arg(args, 1).content();
        byte[] value = arg(args, 2).content();

        storage.put(key, value);
        return OK;
    }
}
