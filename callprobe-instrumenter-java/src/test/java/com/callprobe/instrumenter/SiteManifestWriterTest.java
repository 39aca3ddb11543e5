package com.callprobe.instrumenter;

import com.callprobe.instrumenter.engine.SiteRecord;
import com.callprobe.instrumenter.engine.SiteRecord.Kind;
import com.callprobe.instrumenter.project.InstrumentationSummary;
import com.callprobe.instrumenter.project.InstrumentationSummary.FileResult;
import com.callprobe.instrumenter.report.SiteManifestWriter;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SiteManifestWriterTest {

    private final SiteManifestWriter writer = new SiteManifestWriter();

    private InstrumentationSummary summary(Path root) {
        return new InstrumentationSummary(root.resolve("src/main/java"), root.resolve("out"),
            "com.callprobe.runtime.PerfRuntime",
            List.of(
                new FileResult("b/B.java", List.of(
                    new SiteRecord(Kind.CALL, "zeta", 9),
                    new SiteRecord(Kind.UNIT, "b/B.java", 1),
                    new SiteRecord(Kind.METHOD, "B.run", 3))),
                new FileResult("a/A.java", List.of(
                    new SiteRecord(Kind.LOOP, "for_1234abcd", 5),
                    new SiteRecord(Kind.CALL, "beta", 5),
                    new SiteRecord(Kind.CALL, "alpha", 5)))));
    }

    private static JsonObject readJson(Path file) throws IOException {
        return JsonParser.parseString(Files.readString(file)).getAsJsonObject();
    }

    @Test
    void sitesAreSortedByFileLineKindAndName(@TempDir Path tmp) throws IOException {
        Path out = tmp.resolve("out");
        writer.write(summary(tmp), out);

        JsonArray sites = readJson(out.resolve(SiteManifestWriter.MANIFEST_FILE)).getAsJsonArray("sites");
        List<String> order = new ArrayList<>();
        for (int i = 0; i < sites.size(); i++) {
            JsonObject site = sites.get(i).getAsJsonObject();
            order.add(site.get("file").getAsString() + ":" + site.get("line").getAsInt() + ":"
                + site.get("kind").getAsString() + ":" + site.get("name").getAsString());
        }
        assertEquals(List.of(
            "a/A.java:5:call:alpha",
            "a/A.java:5:call:beta",
            "a/A.java:5:loop:for_1234abcd",
            "b/B.java:1:unit:b/B.java",
            "b/B.java:3:method:B.run",
            "b/B.java:9:call:zeta"), order);
    }

    @Test
    void totalsAndRuntimeClassAreWritten(@TempDir Path tmp) throws IOException {
        Path out = tmp.resolve("out");
        writer.write(summary(tmp), out);

        JsonObject manifest = readJson(out.resolve(SiteManifestWriter.MANIFEST_FILE));
        assertEquals("com.callprobe.runtime.PerfRuntime", manifest.get("runtime_class").getAsString());
        JsonObject totals = manifest.getAsJsonObject("totals");
        assertEquals(2, totals.get("files").getAsInt());
        assertEquals(3, totals.get("calls").getAsInt());
        assertEquals(1, totals.get("loops").getAsInt());
        assertEquals(1, totals.get("units").getAsInt());
        assertEquals(1, totals.get("methods").getAsInt());
    }

    @Test
    void metadataIsWritten(@TempDir Path tmp) throws IOException {
        Path out = tmp.resolve("out");
        writer.write(summary(tmp), out);

        JsonObject meta = readJson(out.resolve(SiteManifestWriter.METADATA_FILE));
        assertEquals("callprobe", meta.get("tool").getAsString());
        assertNotNull(meta.get("timestamp"));
    }

    @Test
    void outputPathThatIsAFileThrowsManifestWriteException(@TempDir Path tmp) throws IOException {
        Path blocker = tmp.resolve("blocker");
        Files.writeString(blocker, "x");
        assertThrows(SiteManifestWriter.ManifestWriteException.class,
            () -> writer.write(summary(tmp), blocker));
    }
}
