package com.callprobe.instrumenter.engine;

/**
 * Pure function from a span of source text to a short, deterministic identifier fragment.
 * The result must be usable inside a Java identifier.
 */
@FunctionalInterface
public interface SourceHasher {

    String hash(String text);
}
