package com.callprobe.runtime;

/**
 * Token returned by {@link PerfRuntime#enterCall} and handed back to {@code exitCall}.
 * Carries everything the end of the call needs so the wrapped expression stays a single expression.
 */
public final class CallFrame {

    final String name;
    final String label;
    final long startToken;

    CallFrame(String name, String label, long startToken) {
        this.name = name;
        this.label = label;
        this.startToken = startToken;
    }

    public String name() { return name; }
    public String label() { return label; }
    public long startToken() { return startToken; }
}
