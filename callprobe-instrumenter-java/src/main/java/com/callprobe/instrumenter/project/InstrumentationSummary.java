package com.callprobe.instrumenter.project;

import com.callprobe.instrumenter.engine.SiteRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * What one project run produced: every instrumented file with the sites rewritten in it.
 */
public record InstrumentationSummary(
    Path sourceRoot,
    Path outputDir,
    String runtimeClass,
    List<FileResult> files
) {

    /** Path is relative to the source root, with forward slashes. */
    public record FileResult(String path, List<SiteRecord> sites) {}

    public long count(SiteRecord.Kind kind) {
        return files.stream()
            .flatMap(f -> f.sites().stream())
            .filter(s -> s.kind() == kind)
            .count();
    }
}
