package kestrel.commands.string;

import kestrel.ServerContext;
import kestrel.commands.Command;
import kestrel.commands.CommandException;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;

import java.util.Optional;

public class GetCommand implements Command {
    @Override
    public Reply execute(ServerContext ctx, Request request) {
        if (request.argCount() < 1) {
            throw CommandException.wrongArity("GET");
        }

        Optional<String> value = ctx.getStore().get(request.arg(0));
        return value.isPresent() ? Reply.bulk(value.get()) : Reply.nullBulk();
    }
}
