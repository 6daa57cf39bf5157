package com.libforge.precompiled.types;

/**
 * Reporting handle passed into every resolution call.
 *
 * <p>Components never reach for a global logger to describe what a resolution is
 * doing; the caller decides where the messages go.
 */
public interface Reporter {

    Reporter SILENT = new Reporter() {
        @Override
        public void info(String message) {
        }

        @Override
        public void debug(String message) {
        }

        @Override
        public void warn(String message, Throwable cause) {
        }
    };

    void info(String message);

    void debug(String message);

    void warn(String message, Throwable cause);

    default void infof(String format, Object... args) {
        info(String.format(format, args));
    }

    default void debugf(String format, Object... args) {
        debug(String.format(format, args));
    }
}
