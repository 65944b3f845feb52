package org.geoserve.server.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.FormattedMessage;
import org.apache.logging.log4j.spi.ExtendedLogger;

/**
 * Thin facade over Log4j 2 keeping the caller's location intact in log records.
 * <p>
 * Messages with parameters use {@code {}} placeholders.
 */
public class Logger {

    private static final String FQCN = Logger.class.getCanonicalName();

    private final ExtendedLogger delegate;

    Logger(ExtendedLogger delegate) {
        this.delegate = delegate;
    }

    public void error(String message) {
        log(Level.ERROR, message, (Throwable) null);
    }

    public void error(String message, Object... params) {
        log(Level.ERROR, message, params);
    }

    public void error(String message, Throwable t) {
        log(Level.ERROR, message, t);
    }

    public void error(String message, Throwable t, Object... params) {
        log(Level.ERROR, message, t, params);
    }

    public void warn(String message) {
        log(Level.WARN, message, (Throwable) null);
    }

    public void warn(String message, Object... params) {
        log(Level.WARN, message, params);
    }

    public void warn(String message, Throwable t) {
        log(Level.WARN, message, t);
    }

    public void info(String message) {
        log(Level.INFO, message, (Throwable) null);
    }

    public void info(String message, Object... params) {
        log(Level.INFO, message, params);
    }

    public void debug(String message) {
        log(Level.DEBUG, message, (Throwable) null);
    }

    public void debug(String message, Object... params) {
        log(Level.DEBUG, message, params);
    }

    public void trace(String message, Object... params) {
        log(Level.TRACE, message, params);
    }

    private void log(Level level, String message, Throwable t) {
        delegate.logIfEnabled(FQCN, level, null, message, t);
    }

    private void log(Level level, String message, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, message, params);
    }

    private void log(Level level, String message, Throwable t, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, new FormattedMessage(message, params), t);
    }
}
