package kestrel.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Console logging for the server. The threshold comes from the {@code kestrel.log.level}
 * system property ({@code debug}, {@code info}, {@code warn} or {@code error}); the older
 * {@code -Dkestrel.debug} switch still selects debug output.
 */
public final class Log {
    private static final Logger logger = Logger.getLogger("kestrel");

    static {
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(Level.ALL);
        console.setFormatter(new LineFormatter());

        logger.setUseParentHandlers(false);
        logger.addHandler(console);
        logger.setLevel(thresholdFrom(System.getProperty("kestrel.log.level"), Boolean.getBoolean("kestrel.debug")));
    }

    private Log() {
    }

    static Level thresholdFrom(String name, boolean debugSwitch) {
        if (name == null) {
            return debugSwitch ? Level.FINE : Level.INFO;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "debug":
                return Level.FINE;
            case "warn":
                return Level.WARNING;
            case "error":
                return Level.SEVERE;
            default:
                return Level.INFO;
        }
    }

    static String label(Level level) {
        if (level.intValue() >= Level.SEVERE.intValue()) return "ERROR";
        if (level.intValue() >= Level.WARNING.intValue()) return "WARN";
        if (level.intValue() >= Level.INFO.intValue()) return "INFO";
        return "DEBUG";
    }

    // [LEVEL] [thread] message, plus the stack trace when one is attached
    static final class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            StringBuilder line = new StringBuilder(96)
                    .append('[').append(label(record.getLevel())).append("] [")
                    .append(Thread.currentThread().getName()).append("] ")
                    .append(record.getMessage())
                    .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                line.append(trace);
            }
            return line.toString();
        }
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }
}
