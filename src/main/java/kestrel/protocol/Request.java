package kestrel.protocol;

import java.util.Collections;
import java.util.List;

/**
 * One decoded request: the command name, upper-cased, and its arguments in order.
 */
public final class Request {
    private final String name;
    private final List<String> args;

    public Request(String name, List<String> args) {
        this.name = name;
        this.args = Collections.unmodifiableList(args);
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return args;
    }

    public int argCount() {
        return args.size();
    }

    public String arg(int index) {
        return args.get(index);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        for (String arg : args) {
            sb.append(" \"").append(arg).append("\"");
        }
        return sb.toString();
    }
}
