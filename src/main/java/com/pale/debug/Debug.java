package com.pale.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all Pale components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 */
public final class Debug {

    // NOOP must be initialized before INSTANCE, whose constructor reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel threshold = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Route everything at or above {@code minimum} to stdout. */
    public static void useSysOut(DebugLevel minimum) {
        INSTANCE.threshold = (minimum == null) ? DebugLevel.TRACE : minimum;
        INSTANCE.setSink(streamSink(System.out));
    }

    /** Route everything at or above {@code minimum} to stderr. The CLI uses this for --verbose. */
    public static void useSysErr(DebugLevel minimum) {
        INSTANCE.threshold = (minimum == null) ? DebugLevel.TRACE : minimum;
        INSTANCE.setSink(streamSink(System.err));
    }

    public static DebugSink streamSink(PrintStream out) {
        return (level, tag, message, error) -> {
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void reset() {
        threshold = DebugLevel.TRACE;
        sinkRef.set(NOOP);
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < threshold.ordinal()) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
