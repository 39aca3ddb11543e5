package com.callprobe.instrumenter.report;

import com.callprobe.instrumenter.engine.SiteRecord;
import com.callprobe.instrumenter.project.InstrumentationSummary;
import com.google.gson.GsonBuilder;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Serializes an {@link InstrumentationSummary} to instrumentation_manifest.json.
 * Sites are sorted by file, line, kind and name so output is deterministic.
 */
public class SiteManifestWriter {

    public static final String MANIFEST_FILE = "instrumentation_manifest.json";
    public static final String METADATA_FILE = "metadata.json";
    static final String TOOL_VERSION = "0.1.0";

    public static class ManifestWriteException extends RuntimeException {
        public ManifestWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code outputDir/instrumentation_manifest.json} and {@code outputDir/metadata.json}.
     *
     * @param summary   result of a project run
     * @param outputDir directory to write into (created if absent)
     */
    public void write(InstrumentationSummary summary, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ManifestWriteException("Could not create output directory: " + outputDir, e);
        }

        var gson = new GsonBuilder().setPrettyPrinting().create();

        Path manifestPath = outputDir.resolve(MANIFEST_FILE);
        try (Writer w = new FileWriter(manifestPath.toFile())) {
            gson.toJson(toManifest(summary), w);
        } catch (IOException e) {
            throw new ManifestWriteException("Failed to write " + MANIFEST_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[callprobe] " + MANIFEST_FILE + " written: " + manifestPath);

        var meta = new Metadata("callprobe", TOOL_VERSION, summary.runtimeClass(), Instant.now().toString());
        Path metaPath = outputDir.resolve(METADATA_FILE);
        try (Writer w = new FileWriter(metaPath.toFile())) {
            gson.toJson(meta, w);
        } catch (IOException e) {
            throw new ManifestWriteException("Failed to write " + METADATA_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[callprobe] " + METADATA_FILE + " written: " + metaPath);
    }

    SiteManifest toManifest(InstrumentationSummary summary) {
        List<SiteManifest.Site> sites = new ArrayList<>();
        for (InstrumentationSummary.FileResult file : summary.files()) {
            for (SiteRecord record : file.sites()) {
                SiteManifest.Site site = new SiteManifest.Site();
                site.file = file.path();
                site.kind = record.kind().name().toLowerCase(Locale.ROOT);
                site.name = record.name();
                site.line = record.line();
                sites.add(site);
            }
        }
        sites.sort(Comparator.comparing((SiteManifest.Site s) -> s.file)
                .thenComparingInt(s -> s.line)
                .thenComparing(s -> s.kind)
                .thenComparing(s -> s.name));

        SiteManifest.Totals totals = new SiteManifest.Totals();
        totals.files = summary.files().size();
        totals.calls = summary.count(SiteRecord.Kind.CALL);
        totals.loops = summary.count(SiteRecord.Kind.LOOP);
        totals.units = summary.count(SiteRecord.Kind.UNIT);
        totals.methods = summary.count(SiteRecord.Kind.METHOD);

        SiteManifest manifest = new SiteManifest();
        manifest.runtimeClass = summary.runtimeClass();
        manifest.sourceRoot = summary.sourceRoot().toString();
        manifest.totals = totals;
        manifest.sites = sites;
        return manifest;
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String tool,
            String toolVersion,
            String runtimeClass,
            String timestamp
    ) {}
}
