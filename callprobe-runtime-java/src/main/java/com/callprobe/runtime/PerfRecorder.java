package com.callprobe.runtime;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe, low-allocation in-memory aggregator for the telemetry emitted by instrumented code.
 *
 * All state is static: instrumented classes reach it through {@link PerfRuntime} without holding
 * a reference.
 */
public final class PerfRecorder {

    private PerfRecorder() {}

    // Compilation units whose initialization sequence has run, in first-seen order
    static final Set<String> units = ConcurrentHashMap.newKeySet();

    // Call sites seen at least once
    static final Set<String> callSites = ConcurrentHashMap.newKeySet();

    // Aggregated call counts: resolved name -> count
    static final ConcurrentHashMap<String, LongAdder> callCounts = new ConcurrentHashMap<>();

    // Timing aggregates: resolved name -> stats
    static final ConcurrentHashMap<String, TimingStats> timings = new ConcurrentHashMap<>();

    // Loop sites seen at least once
    static final Set<String> loopSites = ConcurrentHashMap.newKeySet();

    // Aggregated iteration counts: loop id -> iterations
    static final ConcurrentHashMap<String, LongAdder> iterationCounts = new ConcurrentHashMap<>();

    // Newest trace events; trimmed from the head once the capacity is exceeded
    static final Deque<String> traceEvents = new ConcurrentLinkedDeque<>();
    private static final AtomicInteger traceSize = new AtomicInteger();
    static volatile int traceCapacity = RuntimeConfig.DEFAULT_TRACE_BUFFER;

    /** Count, total and max of the recorded durations for one name. */
    static final class TimingStats {
        final LongAdder count = new LongAdder();
        final LongAdder totalNanos = new LongAdder();
        final LongAccumulator maxNanos = new LongAccumulator(Long::max, 0L);

        void record(long nanos) {
            count.increment();
            totalNanos.add(nanos);
            maxNanos.accumulate(nanos);
        }
    }

    // -----------------------------------------------------------------------
    // Recording
    // -----------------------------------------------------------------------

    static void recordUnit(String unitName) {
        if (unitName != null) units.add(unitName);
    }

    static void recordCallSite(String name) {
        callSites.add(name);
    }

    static void incrementCallCount(String name) {
        callCounts.computeIfAbsent(name, k -> new LongAdder()).increment();
    }

    static void recordDuration(String name, long nanos) {
        timings.computeIfAbsent(name, k -> new TimingStats()).record(nanos);
    }

    static void recordLoopSite(String loopId) {
        loopSites.add(loopId);
    }

    static void incrementIteration(String loopId) {
        iterationCounts.computeIfAbsent(loopId, k -> new LongAdder()).increment();
    }

    static void recordTrace(String text) {
        traceEvents.addLast(text);
        if (traceSize.incrementAndGet() > traceCapacity) {
            if (traceEvents.pollFirst() != null) traceSize.decrementAndGet();
        }
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    /** Number of recorded invocations of {@code name}; 0 if never called. */
    public static long callCount(String name) {
        LongAdder adder = callCounts.get(name);
        return adder != null ? adder.sum() : 0L;
    }

    /** Number of completed, timed invocations of {@code name}. */
    public static long timedCount(String name) {
        TimingStats stats = timings.get(name);
        return stats != null ? stats.count.sum() : 0L;
    }

    /** Number of recorded iterations of the loop {@code loopId}; 0 if it never ran. */
    public static long iterationCount(String loopId) {
        LongAdder adder = iterationCounts.get(loopId);
        return adder != null ? adder.sum() : 0L;
    }

    public static boolean isCallSiteRegistered(String name) {
        return callSites.contains(name);
    }

    public static boolean isLoopRegistered(String loopId) {
        return loopSites.contains(loopId);
    }

    public static boolean isUnitInitialized(String unitName) {
        return units.contains(unitName);
    }

    /** Snapshot of the buffered trace events, oldest first. */
    public static List<String> traceEvents() {
        return new ArrayList<>(traceEvents);
    }

    // -----------------------------------------------------------------------
    // Reset (for testing)
    // -----------------------------------------------------------------------

    public static void reset() {
        units.clear();
        callSites.clear();
        callCounts.clear();
        timings.clear();
        loopSites.clear();
        iterationCounts.clear();
        traceEvents.clear();
        traceSize.set(0);
    }
}
