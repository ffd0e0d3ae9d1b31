package kestrel.commands.connection;

import kestrel.ServerContext;
import kestrel.commands.Command;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;

public class PingCommand implements Command {
    @Override
    public Reply execute(ServerContext ctx, Request request) {
        return Reply.status("PONG");
    }
}
