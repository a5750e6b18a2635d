package org.stianloader.lockresolve.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * The logging facade used throughout lockresolve.
 *
 * <p>Log records are sent to SLF4J if it is present on the classpath, otherwise they are sent to
 * {@link java.util.logging.Logger JUL}. Applications embedding the resolver may route the records elsewhere
 * by installing their own adapter through {@link #setDefaultLogger(LoggingAdapter)}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a placeholder are appended to the end of
 * the message, leftover placeholders are kept as-is. If the last argument is a {@link Throwable}, it's
 * stacktrace should be logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance);
    }

    public abstract void debug(Class<?> clazz, String message, Object... args);
    public abstract void error(Class<?> clazz, String message, Object... args);
    public abstract void info(Class<?> clazz, String message, Object... args);
    public abstract void warn(Class<?> clazz, String message, Object... args);
}
