package kestrel.commands.connection;

import kestrel.ServerContext;
import kestrel.commands.Command;
import kestrel.commands.CommandException;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;

public class EchoCommand implements Command {
    @Override
    public Reply execute(ServerContext ctx, Request request) {
        if (request.argCount() < 1) {
            throw CommandException.wrongArity("ECHO");
        }
        return Reply.bulk(request.arg(0));
    }
}
