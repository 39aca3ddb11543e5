package com.callprobe.instrumenter.project;

import java.nio.file.Path;

/**
 * Result of source root resolution.
 */
public record SourceRoots(
    Path projectRoot,   // absolute project directory
    Path sourceRoot,    // absolute path to src/main/java (or the pom's sourceDirectory)
    String buildTool    // "maven" or "gradle"
) {}
