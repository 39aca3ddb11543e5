package com.callprobe.runtime;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry points called by instrumented source.
 *
 * Generated code refers to this class by simple name (the instrumenter adds the import), so
 * every method here is public and static and its signature is part of the generated-code contract.
 */
public final class PerfRuntime {

    private PerfRuntime() {}

    private static volatile RuntimeConfig config = RuntimeConfig.fromSystemProperties();
    private static final AtomicBoolean hookInstalled = new AtomicBoolean(false);

    static {
        PerfRecorder.traceCapacity = config.traceBuffer();
    }

    // -----------------------------------------------------------------------
    // Unit initialization
    // -----------------------------------------------------------------------

    /**
     * Runs once per instrumented compilation unit, from the static initializer the instrumenter
     * prepends to it. The first call installs the report shutdown hook when an output directory
     * is configured.
     */
    public static void init(String unitName) {
        PerfRecorder.recordUnit(unitName);
        RuntimeConfig c = config;
        if (c.reportEnabled() && hookInstalled.compareAndSet(false, true)) {
            Path reportPath = Paths.get(c.outputPath(), ShutdownHook.REPORT_FILE);
            Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(reportPath), "callprobe-report"));
            System.err.println("[callprobe-runtime] report will be written to: " + reportPath);
        }
    }

    /** Replaces the active configuration; used by tests and embedding hosts. */
    public static void configure(RuntimeConfig newConfig) {
        config = newConfig;
        PerfRecorder.traceCapacity = newConfig.traceBuffer();
    }

    // -----------------------------------------------------------------------
    // Primitive operations
    // -----------------------------------------------------------------------

    public static void trace(String text) {
        PerfRecorder.recordTrace(text);
        if (config.traceEnabled()) {
            System.err.println("[callprobe] " + text);
        }
    }

    public static void registerCall(String name) {
        PerfRecorder.recordCallSite(name);
    }

    public static void incrementCallCount(String name) {
        PerfRecorder.incrementCallCount(name);
    }

    /** Returns the start token for a later {@link #markEnd} of the same name. */
    public static long markStart(String name) {
        return System.nanoTime();
    }

    /** Records and returns the nanoseconds elapsed since {@code startToken}. */
    public static long markEnd(String name, long startToken) {
        long elapsed = System.nanoTime() - startToken;
        PerfRecorder.recordDuration(name, elapsed);
        return elapsed;
    }

    public static void registerLoop(String loopId) {
        PerfRecorder.recordLoopSite(loopId);
    }

    public static void incrementIteration(String loopId) {
        PerfRecorder.incrementIteration(loopId);
    }

    // -----------------------------------------------------------------------
    // Expression-form wrapping: exitCall(enterCall(name, label), originalCall)
    // -----------------------------------------------------------------------

    public static CallFrame enterCall(String name, String label) {
        trace("begin call " + label);
        registerCall(name);
        incrementCallCount(name);
        return new CallFrame(name, label, markStart(name));
    }

    public static <T> T exitCall(CallFrame frame, T result) {
        finish(frame);
        return result;
    }

    // One overload per primitive type keeps the static type of the wrapped call unchanged.

    public static boolean exitCall(CallFrame frame, boolean result) {
        finish(frame);
        return result;
    }

    public static byte exitCall(CallFrame frame, byte result) {
        finish(frame);
        return result;
    }

    public static short exitCall(CallFrame frame, short result) {
        finish(frame);
        return result;
    }

    public static char exitCall(CallFrame frame, char result) {
        finish(frame);
        return result;
    }

    public static int exitCall(CallFrame frame, int result) {
        finish(frame);
        return result;
    }

    public static long exitCall(CallFrame frame, long result) {
        finish(frame);
        return result;
    }

    public static float exitCall(CallFrame frame, float result) {
        finish(frame);
        return result;
    }

    public static double exitCall(CallFrame frame, double result) {
        finish(frame);
        return result;
    }

    private static void finish(CallFrame frame) {
        markEnd(frame.name, frame.startToken);
        trace("end call " + frame.label);
    }
}
