package com.callprobe.instrumenter;

import com.callprobe.instrumenter.project.InstrumentationSummary;
import com.callprobe.instrumenter.report.SiteManifestWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class InstrumenterMainTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/sample-app");

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(InstrumenterMain.UsageException.class, () -> InstrumenterMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(InstrumenterMain.UsageException.class,
                () -> InstrumenterMain.run(new String[]{"record"}));
    }

    @Test
    void missingProjectFlagThrowsUsageException() {
        assertThrows(InstrumenterMain.UsageException.class,
                () -> InstrumenterMain.run(new String[]{"instrument", "--output", "/tmp/out"}));
    }

    @Test
    void missingOutputFlagThrowsUsageException() {
        assertThrows(InstrumenterMain.UsageException.class,
                () -> InstrumenterMain.run(new String[]{"instrument", "--project", "/tmp/p"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(InstrumenterMain.UsageException.class,
                () -> InstrumenterMain.run(new String[]{"instrument", "--project"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(InstrumenterMain.UsageException.class,
                () -> InstrumenterMain.run(new String[]{"instrument", "--foo", "bar"}));
    }

    @Test
    void usageErrorExitsWithCode2() {
        assertEquals(2, InstrumenterMain.execute(new String[]{"instrument"}));
    }

    @Test
    void missingConfigExitsWithCode1(@TempDir Path out) {
        assertEquals(1, InstrumenterMain.execute(new String[]{
            "instrument",
            "--project", FIXTURE_ROOT.toString(),
            "--output", out.toString(),
            "--config", out.resolve("missing.json").toString()}));
    }

    @Test
    void projectWithoutBuildFileExitsWithCode1(@TempDir Path tmp) {
        assertEquals(1, InstrumenterMain.execute(new String[]{
            "instrument", "--project", tmp.toString(), "--output", tmp.resolve("out").toString()}));
    }

    @Test
    void instrumentWritesSourcesAndManifest(@TempDir Path out) {
        InstrumentationSummary summary = InstrumenterMain.run(new String[]{
            "instrument",
            "--project", FIXTURE_ROOT.toString(),
            "--output", out.toString(),
            "--config", FIXTURE_ROOT.resolve("instrument.json").toString()});

        assertEquals(3, summary.files().size());
        assertTrue(Files.exists(out.resolve("com/example/sample/Calculator.java")));
        assertTrue(Files.exists(out.resolve(SiteManifestWriter.MANIFEST_FILE)));
        assertTrue(Files.exists(out.resolve(SiteManifestWriter.METADATA_FILE)));
    }

    @Test
    void successExitsWithCode0(@TempDir Path out) {
        assertEquals(0, InstrumenterMain.execute(new String[]{
            "instrument", "--project", FIXTURE_ROOT.toString(), "--output", out.toString()}));
    }
}
