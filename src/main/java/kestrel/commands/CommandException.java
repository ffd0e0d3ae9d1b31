package kestrel.commands;

import java.util.Locale;

/**
 * A request that was well-formed on the wire but cannot be executed. The message is sent
 * back to the client as an error reply and the connection stays open.
 */
public class CommandException extends RuntimeException {
    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CommandException wrongArity(String command) {
        return new CommandException("ERR wrong number of arguments for '" + command.toLowerCase(Locale.ROOT) + "' command");
    }
}
