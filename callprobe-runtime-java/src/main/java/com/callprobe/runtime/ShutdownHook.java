package com.callprobe.runtime;

import com.google.gson.GsonBuilder;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Serializes all PerfRecorder data to perf_report.json on JVM shutdown.
 * Registered by PerfRuntime.init() when an output directory is configured.
 */
public class ShutdownHook implements Runnable {

    static final String REPORT_FILE = "perf_report.json";

    private final Path outputPath;

    public ShutdownHook(Path outputPath) {
        this.outputPath = outputPath;
    }

    @Override
    public void run() {
        try {
            PerfReport report = buildReport();
            write(report);
        } catch (Exception e) {
            System.err.println("[callprobe-runtime] ERROR writing " + REPORT_FILE + ": " + e.getMessage());
        }
    }

    PerfReport buildReport() {
        PerfReport report = new PerfReport();

        report.units = PerfRecorder.units.stream()
            .sorted()
            .collect(Collectors.toList());

        // Every registered call site gets an entry, even if it never completed a timed call
        Set<String> names = new TreeSet<>(PerfRecorder.callSites);
        names.addAll(PerfRecorder.callCounts.keySet());
        report.calls = names.stream()
            .map(name -> {
                PerfReport.CallStats s = new PerfReport.CallStats();
                s.name = name;
                s.callCount = PerfRecorder.callCount(name);
                PerfRecorder.TimingStats t = PerfRecorder.timings.get(name);
                if (t != null) {
                    s.timedCount = t.count.sum();
                    s.totalNanos = t.totalNanos.sum();
                    s.maxNanos = t.maxNanos.get();
                }
                return s;
            })
            .collect(Collectors.toList());

        Set<String> loopIds = new TreeSet<>(PerfRecorder.loopSites);
        loopIds.addAll(PerfRecorder.iterationCounts.keySet());
        report.loops = loopIds.stream()
            .map(id -> {
                PerfReport.LoopStats l = new PerfReport.LoopStats();
                l.loopId = id;
                LongAdder iterations = PerfRecorder.iterationCounts.get(id);
                l.iterations = iterations != null ? iterations.sum() : 0L;
                return l;
            })
            .collect(Collectors.toList());

        return report;
    }

    void write(PerfReport report) throws IOException {
        Files.createDirectories(outputPath.getParent() != null ? outputPath.getParent() : Path.of("."));
        try (Writer w = new FileWriter(outputPath.toFile())) {
            new GsonBuilder().setPrettyPrinting().create().toJson(report, w);
        }
        System.err.println("[callprobe-runtime] " + REPORT_FILE + " written: " + outputPath);
    }
}
