package com.github.jnthnclt.os.chaining.log;

import java.io.PrintStream;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

public class ChainingLoggerFactory {

    public interface ChainingLoggerProvider {
        ChainingLogger createLogger(String name);
    }

    public static final ConcurrentHashMap<String, ChainingLogger> loggers = new ConcurrentHashMap<>();
    public static final AtomicReference<ChainingLoggerProvider> LOGGER_PROVIDER = new AtomicReference<>(
        name -> new SysoutChainingLogger(name, SysoutChainingLoggerLevel.INFO));

    public static ChainingLogger getLogger() {
        StackTraceElement[] elements = Thread.currentThread().getStackTrace();
        String name = elements[2].getClassName();
        return getLogger(name);
    }

    public static ChainingLogger getLogger(String name) {
        return loggers.computeIfAbsent(name, s -> LOGGER_PROVIDER.get().createLogger(s));
    }

    public enum SysoutChainingLoggerLevel {
        DEBUG, INFO, WARN, ERROR, OFF
    }

    /**
     * Replaces "{}" anchors in order with the rendered arguments. Surplus anchors are left as is.
     */
    static String format(String messagePattern, Object... args) {
        return MessageFormatter.arrayFormat(messagePattern, args).getMessage();
    }

    public static class SysoutChainingLogger implements ChainingLogger {

        private final String name;
        private final SysoutChainingLoggerLevel level;
        private final PrintStream out;

        public SysoutChainingLogger(String name, SysoutChainingLoggerLevel level) {
            this(name, level, System.out);
        }

        public SysoutChainingLogger(String name, SysoutChainingLoggerLevel level, PrintStream out) {
            this.name = name;
            this.level = level;
            this.out = out;
        }

        private boolean enabled(SysoutChainingLoggerLevel at) {
            return at.ordinal() >= level.ordinal() && level != SysoutChainingLoggerLevel.OFF;
        }

        private void log(SysoutChainingLoggerLevel at, String msg, Throwable t) {
            if (!enabled(at)) {
                return;
            }
            out.println(Thread.currentThread().getName() + " " + at + " " + name + " " + msg);
            if (t != null) {
                t.printStackTrace(out);
            }
        }

        private void logPattern(SysoutChainingLoggerLevel at, String messagePattern, Object... args) {
            if (!enabled(at)) {
                return;
            }
            // a trailing throwable with no anchor left for it is logged as the cause
            FormattingTuple tuple = MessageFormatter.arrayFormat(messagePattern, args);
            log(at, tuple.getMessage(), tuple.getThrowable());
        }

        @Override
        public boolean isDebugEnabled() {
            return enabled(SysoutChainingLoggerLevel.DEBUG);
        }

        @Override
        public void debug(String msg) {
            log(SysoutChainingLoggerLevel.DEBUG, msg, null);
        }

        @Override
        public void debug(String messagePattern, Object arg) {
            logPattern(SysoutChainingLoggerLevel.DEBUG, messagePattern, arg);
        }

        @Override
        public void debug(String messagePattern, Object arg1, Object arg2) {
            logPattern(SysoutChainingLoggerLevel.DEBUG, messagePattern, arg1, arg2);
        }

        @Override
        public void debug(String messagePattern, Object arg1, Object arg2, Object arg3) {
            logPattern(SysoutChainingLoggerLevel.DEBUG, messagePattern, arg1, arg2, arg3);
        }

        @Override
        public void debug(String messagePattern, Object... argArray) {
            logPattern(SysoutChainingLoggerLevel.DEBUG, messagePattern, argArray);
        }

        @Override
        public void debug(String msg, Throwable t) {
            log(SysoutChainingLoggerLevel.DEBUG, msg, t);
        }

        @Override
        public void info(String msg) {
            log(SysoutChainingLoggerLevel.INFO, msg, null);
        }

        @Override
        public void info(String messagePattern, Object arg) {
            logPattern(SysoutChainingLoggerLevel.INFO, messagePattern, arg);
        }

        @Override
        public void info(String messagePattern, Object arg1, Object arg2) {
            logPattern(SysoutChainingLoggerLevel.INFO, messagePattern, arg1, arg2);
        }

        @Override
        public void info(String messagePattern, Object... argArray) {
            logPattern(SysoutChainingLoggerLevel.INFO, messagePattern, argArray);
        }

        @Override
        public void info(String msg, Throwable t) {
            log(SysoutChainingLoggerLevel.INFO, msg, t);
        }

        @Override
        public void warn(String msg) {
            log(SysoutChainingLoggerLevel.WARN, msg, null);
        }

        @Override
        public void warn(String messagePattern, Object arg) {
            logPattern(SysoutChainingLoggerLevel.WARN, messagePattern, arg);
        }

        @Override
        public void warn(String messagePattern, Object arg1, Object arg2) {
            logPattern(SysoutChainingLoggerLevel.WARN, messagePattern, arg1, arg2);
        }

        @Override
        public void warn(String messagePattern, Object... argArray) {
            logPattern(SysoutChainingLoggerLevel.WARN, messagePattern, argArray);
        }

        @Override
        public void warn(String msg, Throwable t) {
            log(SysoutChainingLoggerLevel.WARN, msg, t);
        }

        @Override
        public void error(String msg) {
            log(SysoutChainingLoggerLevel.ERROR, msg, null);
        }

        @Override
        public void error(String messagePattern, Object arg) {
            logPattern(SysoutChainingLoggerLevel.ERROR, messagePattern, arg);
        }

        @Override
        public void error(String messagePattern, Object arg1, Object arg2) {
            logPattern(SysoutChainingLoggerLevel.ERROR, messagePattern, arg1, arg2);
        }

        @Override
        public void error(String messagePattern, Object... argArray) {
            logPattern(SysoutChainingLoggerLevel.ERROR, messagePattern, argArray);
        }

        @Override
        public void error(String msg, Throwable t) {
            log(SysoutChainingLoggerLevel.ERROR, msg, t);
        }
    }
}
