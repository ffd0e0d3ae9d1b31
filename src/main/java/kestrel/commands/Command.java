package kestrel.commands;

import kestrel.ServerContext;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;

public interface Command {
    // Executes the command and returns the reply to send.
    // Usage errors are reported by throwing CommandException, never by returning an error reply.
    Reply execute(ServerContext ctx, Request request);
}
