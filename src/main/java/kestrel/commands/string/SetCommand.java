package kestrel.commands.string;

import kestrel.ServerContext;
import kestrel.commands.Command;
import kestrel.commands.CommandException;
import kestrel.protocol.Reply;
import kestrel.protocol.Request;

/**
 * SET key value [PX milliseconds]
 * <p>
 * The PX clause is read positionally and leniently: a wrong keyword, a value that is not a
 * plain non-negative decimal, or a missing value all mean "no expiry" rather than an error.
 */
public class SetCommand implements Command {
    @Override
    public Reply execute(ServerContext ctx, Request request) {
        if (request.argCount() < 2) {
            throw CommandException.wrongArity("SET");
        }

        String key = request.arg(0);
        String value = request.arg(1);
        long ttl = parsePx(request);

        try {
            if (ttl >= 0) {
                ctx.getStore().set(key, value, ttl);
            } else {
                ctx.getStore().set(key, value);
            }
        } catch (IllegalArgumentException e) {
            throw new CommandException("ERR " + e.getMessage(), e);
        }
        return Reply.status("OK");
    }

    // Returns -1 when the request carries no usable PX clause.
    static long parsePx(Request request) {
        if (request.argCount() < 4) return -1;
        if (!"PX".equalsIgnoreCase(request.arg(2))) return -1;

        String millis = request.arg(3);
        if (millis.isEmpty()) return -1;
        for (int i = 0; i < millis.length(); i++) {
            char c = millis.charAt(i);
            if (c < '0' || c > '9') return -1;
        }
        try {
            return Long.parseLong(millis);
        } catch (NumberFormatException e) {
            return -1; // Too large for a long
        }
    }
}
