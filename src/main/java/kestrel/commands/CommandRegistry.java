package kestrel.commands;

import kestrel.ServerContext;
import kestrel.commands.connection.EchoCommand;
import kestrel.commands.connection.PingCommand;
import kestrel.commands.generic.KeysCommand;
import kestrel.commands.server.ConfigCommand;
import kestrel.commands.string.GetCommand;
import kestrel.commands.string.SetCommand;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;

import java.util.HashMap;
import java.util.Map;

/**
 * Routes a decoded request to its command by upper-cased name.
 */
public class CommandRegistry {
    private final Map<String, Command> commands = new HashMap<>();
    private final ServerContext ctx;

    public CommandRegistry(ServerContext ctx) {
        this.ctx = ctx;

        // Connection
        register("PING", new PingCommand());
        register("ECHO", new EchoCommand());

        // String
        register("SET", new SetCommand());
        register("GET", new GetCommand());

        // Generic / Server
        register("KEYS", new KeysCommand());
        register("CONFIG", new ConfigCommand());
    }

    public void register(String name, Command command) {
        commands.put(name, command);
    }

    public Command get(String name) {
        return commands.get(name);
    }

    /**
     * Executes {@code request}.
     *
     * @throws UnknownCommandException if no command is registered under the request's name
     * @throws CommandException if the command rejects its arguments
     */
    public Reply dispatch(Request request) {
        Command cmd = commands.get(request.getName());
        if (cmd == null) {
            throw new UnknownCommandException(request.getName());
        }
        return cmd.execute(ctx, request);
    }
}
