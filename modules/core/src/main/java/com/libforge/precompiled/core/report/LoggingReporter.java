package com.libforge.precompiled.core.report;

import com.libforge.precompiled.types.Reporter;
import org.jboss.logging.Logger;

/**
 * {@link Reporter} backed by a JBoss Logging category.
 */
public class LoggingReporter implements Reporter {

    private final Logger log;

    public LoggingReporter(Logger log) {
        this.log = log;
    }

    public static LoggingReporter forCategory(String category) {
        return new LoggingReporter(Logger.getLogger(category));
    }

    @Override
    public void info(String message) {
        log.info(message);
    }

    @Override
    public void debug(String message) {
        log.debug(message);
    }

    @Override
    public void warn(String message, Throwable cause) {
        log.warn(message, cause);
    }

    @Override
    public void infof(String format, Object... args) {
        log.infof(format, args);
    }

    @Override
    public void debugf(String format, Object... args) {
        log.debugf(format, args);
    }
}
