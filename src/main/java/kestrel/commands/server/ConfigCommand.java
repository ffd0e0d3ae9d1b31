package kestrel.commands.server;

import kestrel.ServerContext;
import kestrel.commands.Command;
import kestrel.commands.CommandException;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * CONFIG GET parameter. Only exact parameter names are recognized.
 */
public class ConfigCommand implements Command {
    @Override
    public Reply execute(ServerContext ctx, Request request) {
        if (request.argCount() < 2) {
            throw CommandException.wrongArity("CONFIG");
        }

        String sub = request.arg(0).toUpperCase(Locale.ROOT);
        if (!sub.equals("GET")) {
            throw new CommandException("ERR unknown subcommand '" + request.arg(0) + "' for 'config'");
        }

        String param = request.arg(1);
        Optional<String> value = ctx.getConfig().get(param);
        if (!value.isPresent()) {
            throw new CommandException("ERR unknown config parameter '" + param + "'");
        }
        return Reply.array(Arrays.asList(param, value.get()));
    }
}
