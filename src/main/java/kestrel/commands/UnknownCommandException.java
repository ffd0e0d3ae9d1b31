package kestrel.commands;

public class UnknownCommandException extends CommandException {
    private final String command;

    public UnknownCommandException(String command) {
        super("ERR unknown command '" + command + "'");
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
