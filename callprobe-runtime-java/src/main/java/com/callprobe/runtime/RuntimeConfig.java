package com.callprobe.runtime;

/**
 * Runtime settings, read from the {@code callprobe.args} system property.
 *
 * Format (key=value pairs separated by comma):
 *   output       : directory where perf_report.json is written on JVM exit (default: none, no report)
 *   trace        : "true" or "false", echo trace events to stderr (default: false)
 *   trace_buffer : number of newest trace events kept in memory (default: 10000)
 */
public record RuntimeConfig(
    String outputPath,
    boolean traceEnabled,
    int traceBuffer
) {

    public static final String SYSTEM_PROPERTY = "callprobe.args";
    static final int DEFAULT_TRACE_BUFFER = 10_000;

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(null, false, DEFAULT_TRACE_BUFFER);
    }

    public static RuntimeConfig fromSystemProperties() {
        return parse(System.getProperty(SYSTEM_PROPERTY));
    }

    public boolean reportEnabled() {
        return outputPath != null && !outputPath.isBlank();
    }

    static RuntimeConfig parse(String args) {
        String outputPath = null;
        boolean traceEnabled = false;
        int traceBuffer = DEFAULT_TRACE_BUFFER;

        if (args != null && !args.isBlank()) {
            for (String part : args.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    switch (kv[0].trim()) {
                        case "output"       -> outputPath   = kv[1].trim();
                        case "trace"        -> traceEnabled = "true".equalsIgnoreCase(kv[1].trim());
                        case "trace_buffer" -> traceBuffer  = parsePositive(kv[1].trim(), DEFAULT_TRACE_BUFFER);
                        default -> System.err.println("[callprobe-runtime] ignoring unknown setting: " + kv[0].trim());
                    }
                }
            }
        }
        return new RuntimeConfig(outputPath, traceEnabled, traceBuffer);
    }

    private static int parsePositive(String value, int fallback) {
        try {
            int parsed = Integer.parseInt(value);
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            System.err.println("[callprobe-runtime] invalid number '" + value + "', using " + fallback);
            return fallback;
        }
    }
}
