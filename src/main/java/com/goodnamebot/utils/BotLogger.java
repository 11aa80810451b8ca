/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.utils;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * Line-oriented logger shared by every component of the bot.
 *
 * <p>One instance is created at startup and handed to each component, which
 * usually derives a {@link #named(String) named} child so its lines carry the
 * component tag:
 * <pre>
 * [2025-01-01 12:00:00.000][INFO] [FileGoodNameStore] Loaded 12 good name(s)
 * </pre>
 * Children share the parent's sink and debug setting.
 */
public final class BotLogger {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final String component;
    private final PrintStream out;
    private final boolean debugEnabled;

    public BotLogger(PrintStream out, boolean debugEnabled) {
        this(null, out, debugEnabled);
    }

    private BotLogger(String component, PrintStream out, boolean debugEnabled) {
        if (out == null) {
            throw new IllegalArgumentException("Log sink cannot be null");
        }
        this.component = component;
        this.out = out;
        this.debugEnabled = debugEnabled;
    }

    /** Logger writing to stdout. */
    public static BotLogger stdout(boolean debugEnabled) {
        return new BotLogger(System.out, debugEnabled);
    }

    /**
     * Returns a logger that tags every line with the given component name.
     *
     * @param component short component name, e.g. the simple class name
     * @return child logger sharing this logger's sink
     */
    public BotLogger named(String component) {
        return new BotLogger(component, out, debugEnabled);
    }

    public void log(String level, String msg) {
        StringBuilder line = new StringBuilder()
                .append('[').append(TS.format(LocalDateTime.now())).append("][").append(level).append("] ");
        if (component != null) {
            line.append('[').append(component).append("] ");
        }
        line.append(msg);
        out.println(line);
    }

    public void info(String msg) { log("INFO", msg); }
    public void warn(String msg) { log("WARN", msg); }
    public void error(String msg) { log("ERROR", msg); }
    public void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public void debug(Supplier<String> msgSupplier) {
        if (debugEnabled) {
            log("DEBUG", msgSupplier.get());
        }
    }

    /**
     * Logs an error with its cause. The stack trace is only printed when debug
     * output is enabled.
     */
    public void error(String msg, Throwable cause) {
        log("ERROR", msg + ": " + cause);
        if (debugEnabled) {
            cause.printStackTrace(out);
        }
    }

    public boolean isDebugEnabled() { return debugEnabled; }

    public String getComponent() { return component; }
}
