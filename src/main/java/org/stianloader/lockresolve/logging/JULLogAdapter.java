package org.stianloader.lockresolve.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    static String formatMessage(@NotNull String message, Object @NotNull... args) {
        StringBuilder builder = new StringBuilder();
        int head = 0;
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            int placeholder = message.indexOf("{}", head);
            if (placeholder != -1) {
                builder.append(message, head, placeholder).append(Objects.toString(arg));
                head = placeholder + 2;
            } else if (i == args.length - 1 && arg instanceof Throwable) {
                builder.append(message, head, message.length()).append('\n');
                head = message.length();
                StringWriter sw = new StringWriter();
                ((Throwable) arg).printStackTrace(new PrintWriter(sw));
                builder.append(sw);
            } else {
                builder.append(message, head, message.length()).append(' ').append(Objects.toString(arg));
                head = message.length();
            }
        }
        builder.append(message, head, message.length());
        return builder.toString();
    }

    private static void log(Class<?> clazz, Level level, String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.formatMessage(message, args));
        }
    }

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
