package org.stianloader.addonresolve.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

final class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    static String format(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder(message.length() + 16 * args.length);
        int cursor = 0;
        int lastArg = args.length - 1;
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            if (i == lastArg && arg instanceof Throwable) {
                break;
            }
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder == -1) {
                builder.append(message, cursor, message.length());
                cursor = message.length();
                builder.append(' ').append(Objects.toString(arg));
            } else {
                builder.append(message, cursor, placeholder).append(Objects.toString(arg));
                cursor = placeholder + 2;
            }
        }
        builder.append(message, cursor, message.length());

        if (args.length != 0 && args[lastArg] instanceof Throwable) {
            StringWriter trace = new StringWriter();
            ((Throwable) args[lastArg]).printStackTrace(new PrintWriter(trace));
            builder.append(System.lineSeparator()).append(trace);
        }
        return builder.toString();
    }

    private static void log(@NotNull Level level, @NotNull Class<?> source, @NotNull String message, Object... args) {
        Logger logger = Logger.getLogger(source.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.format(message, args));
        }
    }

    @Override
    public void debug(@NotNull Class<?> source, @NotNull String message, Object... args) {
        JULLogAdapter.log(Level.FINE, source, message, args);
    }

    @Override
    public void error(@NotNull Class<?> source, @NotNull String message, Object... args) {
        JULLogAdapter.log(Level.SEVERE, source, message, args);
    }

    @Override
    public void info(@NotNull Class<?> source, @NotNull String message, Object... args) {
        JULLogAdapter.log(Level.INFO, source, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> source, @NotNull String message, Object... args) {
        JULLogAdapter.log(Level.WARNING, source, message, args);
    }
}
