package org.stianloader.addonresolve.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class SLF4JLogAdapter extends LoggingAdapter {

    @NotNull
    private static Logger logger(@NotNull Class<?> source) {
        return LoggerFactory.getLogger(source);
    }

    @Override
    public void debug(@NotNull Class<?> source, @NotNull String message, Object... args) {
        Logger logger = SLF4JLogAdapter.logger(source);
        if (logger.isDebugEnabled()) {
            logger.debug(message, args);
        }
    }

    @Override
    public void error(@NotNull Class<?> source, @NotNull String message, Object... args) {
        SLF4JLogAdapter.logger(source).error(message, args);
    }

    @Override
    public void info(@NotNull Class<?> source, @NotNull String message, Object... args) {
        SLF4JLogAdapter.logger(source).info(message, args);
    }

    @Override
    public void warn(@NotNull Class<?> source, @NotNull String message, Object... args) {
        SLF4JLogAdapter.logger(source).warn(message, args);
    }
}
