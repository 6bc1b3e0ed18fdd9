package ember.utils;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Namespaced logging facade over java.util.logging.
 *
 * <p>Lines look like {@code 2024-05-01T10:00:00Z INFO [core]: message}. Debug output is
 * off by default and is switched on per namespace with the {@code EMBER_DEBUG}
 * environment variable (a comma separated list, {@code *} for all namespaces).
 */
public final class Log {
    private static final String ROOT = "ember";
    private static final Logger rootLogger = Logger.getLogger(ROOT);
    private static final Set<String> debugNamespaces = parseNamespaces(System.getenv("EMBER_DEBUG"));

    static {
        rootLogger.setUseParentHandlers(false);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.ALL);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";
                String namespace = record.getLoggerName();
                if (namespace != null && namespace.startsWith(ROOT + ".")) {
                    namespace = namespace.substring(ROOT.length() + 1);
                }
                String line = String.format("%s %s [%s]: %s",
                        Instant.ofEpochMilli(record.getMillis()), levelStr, namespace, record.getMessage());
                if (record.getThrown() != null) {
                    line += " (" + record.getThrown() + ")";
                }
                return line + System.lineSeparator();
            }
        });
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private final Logger logger;

    private Log(Logger logger) {
        this.logger = logger;
    }

    public static Log named(String namespace) {
        Logger logger = Logger.getLogger(ROOT + "." + namespace);
        if (isDebugEnabled(namespace)) {
            logger.setLevel(Level.FINE);
        }
        return new Log(logger);
    }

    static boolean isDebugEnabled(String namespace) {
        return debugNamespaces.contains("*") || debugNamespaces.contains(namespace);
    }

    static Set<String> parseNamespaces(String value) {
        if (value == null || value.trim().isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> result = new HashSet<>();
        for (String ns : Arrays.asList(value.split(","))) {
            if (!ns.trim().isEmpty()) result.add(ns.trim());
        }
        return result;
    }

    public void info(String msg) {
        logger.info(msg);
    }

    public void warn(String msg) {
        logger.warning(msg);
    }

    public void error(String msg) {
        logger.severe(msg);
    }

    public void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public void debug(String msg) {
        logger.fine(msg);
    }

    public boolean isDebug() {
        return logger.isLoggable(Level.FINE);
    }
}
