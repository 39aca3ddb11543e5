package com.callprobe.instrumenter.engine;

/**
 * One instrumented site: a wrapped call (by resolved name), a wrapped loop (by loop id), a unit
 * initialization (by unit name) or a traced method body (by {@code Type.method} label).
 * Line is 1-based, -1 when unknown.
 */
public record SiteRecord(Kind kind, String name, int line) {

    public enum Kind { CALL, LOOP, UNIT, METHOD }
}
