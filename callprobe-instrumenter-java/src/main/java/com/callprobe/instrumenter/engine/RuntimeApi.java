package com.callprobe.instrumenter.engine;

import java.util.List;

/**
 * The telemetry sink class generated code calls, and the names of its entry points.
 * Must match the public static methods of {@code com.callprobe.runtime.PerfRuntime}.
 */
public record RuntimeApi(String qualifiedName) {

    public static final String DEFAULT_CLASS = "com.callprobe.runtime.PerfRuntime";

    static final String INIT = "init";
    static final String TRACE = "trace";
    static final String REGISTER_CALL = "registerCall";
    static final String INCREMENT_CALL_COUNT = "incrementCallCount";
    static final String MARK_START = "markStart";
    static final String MARK_END = "markEnd";
    static final String REGISTER_LOOP = "registerLoop";
    static final String INCREMENT_ITERATION = "incrementIteration";
    static final String ENTER_CALL = "enterCall";
    static final String EXIT_CALL = "exitCall";

    public RuntimeApi {
        if (qualifiedName == null || qualifiedName.isBlank() || qualifiedName.indexOf('.') <= 0
                || qualifiedName.endsWith(".")) {
            throw new IllegalArgumentException("runtime class must be a qualified name, got: " + qualifiedName);
        }
    }

    public static RuntimeApi defaults() {
        return new RuntimeApi(DEFAULT_CLASS);
    }

    public String simpleName() {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    /** Names under which calls into the runtime resolve; these are never instrumented. */
    public List<String> exclusionNames() {
        return List.of(simpleName(), qualifiedName);
    }
}
