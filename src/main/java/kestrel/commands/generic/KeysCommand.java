package kestrel.commands.generic;

import kestrel.Config;
import kestrel.ServerContext;
import kestrel.commands.Command;
import kestrel.commands.CommandException;
import kestrel.persistence.rdb.RdbReader;
import kestrel.persistence.rdb.ScanResult;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;
import kestrel.utils.Log;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

/**
 * KEYS pattern. Lists the keys stored in the dump file named by the {@code dir} and
 * {@code dbfilename} parameters. Only the {@code *} pattern matches anything, and a dump
 * file that is missing or unreadable yields an empty list.
 */
public class KeysCommand implements Command {
    @Override
    public Reply execute(ServerContext ctx, Request request) {
        if (request.argCount() < 1) {
            throw CommandException.wrongArity("KEYS");
        }
        if (!request.arg(0).equals("*")) {
            return Reply.array(Collections.emptyList());
        }

        Config config = ctx.getConfig();
        String dir = config.get(Config.DIR).orElse("");
        String dbfilename = config.get(Config.DBFILENAME).orElse("");

        try {
            Path file = Paths.get(dir + "/" + dbfilename);
            ScanResult result = RdbReader.scan(file);
            if (result.stoppedAtUnsupportedType()) {
                Log.debug("KEYS: scan of " + file + " stopped at record type " + result.getUnsupportedType());
            }
            return Reply.array(result.keys());
        } catch (IOException | RuntimeException e) {
            Log.debug("KEYS: dump file unavailable (" + e.getMessage() + ")");
            return Reply.array(Collections.emptyList());
        }
    }
}
