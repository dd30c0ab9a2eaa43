package org.stianloader.addonresolve.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used throughout addonresolve.
 *
 * <p>The resolver is meant to be embedded into whatever host application manages add-ons,
 * and that host decides on the logging backend. If SLF4J is present on the classpath
 * it is used as the sink, otherwise messages are routed to {@link java.util.logging.Logger JUL}.
 * A host that wishes to route the messages elsewhere may install its own adapter through
 * {@link #setDefaultLogger(LoggingAdapter)}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a matching placeholder
 * are appended to the message, surplus placeholders are kept as-is. If the last argument
 * is a {@link Throwable} its stacktrace is logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    private static volatile LoggingAdapter defaultLogger = LoggingAdapter.detect();

    @NotNull
    private static LoggingAdapter detect() {
        try {
            Class.forName("org.slf4j.LoggerFactory");
            return new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            return new JULLogAdapter();
        }
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.defaultLogger;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter logger) {
        LoggingAdapter.defaultLogger = Objects.requireNonNull(logger, "logger may not be null");
    }

    public abstract void debug(@NotNull Class<?> source, @NotNull String message, Object... args);

    public abstract void error(@NotNull Class<?> source, @NotNull String message, Object... args);

    public abstract void info(@NotNull Class<?> source, @NotNull String message, Object... args);

    public abstract void warn(@NotNull Class<?> source, @NotNull String message, Object... args);
}
