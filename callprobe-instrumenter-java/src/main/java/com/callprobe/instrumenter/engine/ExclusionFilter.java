package com.callprobe.instrumenter.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a resolved call name is exempt from instrumentation.
 *
 * A name is excluded when it equals an excluded name or is a member of one
 * ({@code excluded + "."} prefix). There is no substring matching.
 *
 * A call is checked twice: by its resolved name and by its callee text with whitespace removed.
 * The second form reaches calls whose receiver resolves to an {@code anonymous_} name, such as
 * {@code Runtime.getRuntime().addShutdownHook}.
 */
public final class ExclusionFilter {

    /** Logging, shutdown-hook registration, clock reads and min/max helpers. */
    public static final List<String> DEFAULT_EXCLUSIONS = List.of(
        "System.out.println",
        "System.out.print",
        "System.out.printf",
        "System.err.println",
        "System.err.print",
        "System.err.printf",
        "Runtime.getRuntime",
        "Runtime.getRuntime().addShutdownHook",
        "System.nanoTime",
        "System.currentTimeMillis",
        "Math.max",
        "Math.min"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Set<String> excludedNames;

    public ExclusionFilter(Collection<String> excludedNames) {
        this.excludedNames = Collections.unmodifiableSet(new LinkedHashSet<>(excludedNames));
    }

    public static ExclusionFilter defaults() {
        return new ExclusionFilter(DEFAULT_EXCLUSIONS);
    }

    /** Returns a new filter excluding everything this one does plus {@code more}. */
    public ExclusionFilter extendedWith(Collection<String> more) {
        Set<String> merged = new LinkedHashSet<>(excludedNames);
        merged.addAll(more);
        return new ExclusionFilter(merged);
    }

    /** True unless either the resolved name or the callee text is excluded. */
    public boolean shouldInstrument(String resolvedName, String calleeText) {
        return shouldInstrument(resolvedName) && shouldInstrument(WHITESPACE.matcher(calleeText).replaceAll(""));
    }

    public boolean shouldInstrument(String resolvedName) {
        for (String excluded : excludedNames) {
            if (resolvedName.equals(excluded) || resolvedName.startsWith(excluded + ".")) {
                return false;
            }
        }
        return true;
    }

    public Set<String> excludedNames() { return excludedNames; }
}
