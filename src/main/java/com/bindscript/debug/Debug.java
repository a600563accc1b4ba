package com.bindscript.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all BindScript components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Records below the configured threshold are dropped before reaching the sink
 * - Safe default (no-op) if no sink installed
 */
public final class Debug {

    private static final Debug INSTANCE = new Debug();

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel threshold = DebugLevel.INFO;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setLevel(DebugLevel level) {
        this.threshold = (level == null) ? DebugLevel.INFO : level;
    }

    public DebugLevel getLevel() {
        return threshold;
    }

    /** Cheap guard for call sites that build expensive messages. */
    public boolean isEnabled(DebugLevel level) {
        return level != DebugLevel.OFF && level.ordinal() >= threshold.ordinal();
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!isEnabled(level)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
