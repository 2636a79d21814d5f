package com.ldgv.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all LDGV components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 * - Process-wide tracing toggle: TRACE lines are dropped unless tracing is on
 */
public final class Debug {

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    // after NOOP: the constructor reads it
    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile boolean tracing = false;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs a sink printing every line to stderr. */
    public static void useSysOut() {
        INSTANCE.setSink(printer(System.err));
    }

    public static DebugSink printer(PrintStream out) {
        return (level, tag, message, error) -> {
            synchronized (out) {
                out.println("[" + level + "][" + tag + "][" + Thread.currentThread().getName() + "] " + message);
                if (error != null) error.printStackTrace(out);
            }
        };
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setTracing(boolean enabled) {
        this.tracing = enabled;
    }

    public boolean isTracing() {
        return tracing;
    }

    // Convenience methods
    public void t(String tag, String msg) { if (tracing) log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
