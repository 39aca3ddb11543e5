package com.callprobe.instrumenter;

import com.callprobe.instrumenter.config.InstrumentConfig;
import com.callprobe.instrumenter.config.InstrumentConfigReader;
import com.callprobe.instrumenter.engine.SiteRecord;
import com.callprobe.instrumenter.project.InstrumentationSummary;
import com.callprobe.instrumenter.project.ProjectInstrumenter;
import com.callprobe.runtime.PerfRecorder;
import com.callprobe.runtime.PerfRuntime;
import com.callprobe.runtime.RuntimeConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: instruments the sample-app fixture end to end.
 */
class ProjectInstrumenterTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/sample-app");

    private static final String CALCULATOR = "com/example/sample/Calculator.java";
    private static final String REPORT_BUILDER = "com/example/sample/ReportBuilder.java";
    private static final String SHAPE = "com/example/sample/Shape.java";

    private final ProjectInstrumenter instrumenter = new ProjectInstrumenter();

    private InstrumentationSummary instrumentFixture(Path out) {
        InstrumentConfig config = new InstrumentConfigReader().read(FIXTURE_ROOT.resolve("instrument.json"));
        return instrumenter.instrument(FIXTURE_ROOT, out, config);
    }

    @Test
    void everySourceFileIsWrittenAtItsRelativePath(@TempDir Path out) {
        InstrumentationSummary summary = instrumentFixture(out);

        List<String> paths = summary.files().stream()
            .map(InstrumentationSummary.FileResult::path)
            .collect(Collectors.toList());
        assertEquals(List.of(CALCULATOR, REPORT_BUILDER, SHAPE), paths);
        for (String path : paths) {
            assertTrue(Files.exists(out.resolve(path)), "missing output: " + path);
        }
    }

    @Test
    void summaryCountsSitesPerKind(@TempDir Path out) {
        InstrumentationSummary summary = instrumentFixture(out);

        assertEquals(9, summary.count(SiteRecord.Kind.CALL));
        assertEquals(2, summary.count(SiteRecord.Kind.LOOP));
        assertEquals(3, summary.count(SiteRecord.Kind.UNIT));
        assertEquals("com.callprobe.runtime.PerfRuntime", summary.runtimeClass());
        assertEquals(out, summary.outputDir());
    }

    @Test
    void configuredExclusionsAreRespected(@TempDir Path out) throws Exception {
        instrumentFixture(out);
        String report = Files.readString(out.resolve(REPORT_BUILDER));
        assertFalse(report.contains("\"audit\""), report);
        assertTrue(report.contains("registerCall(\"append\")"), report);
    }

    @Test
    void defaultConfigInstrumentsEveryCall(@TempDir Path out) {
        InstrumentationSummary summary = instrumenter.instrument(FIXTURE_ROOT, out, InstrumentConfig.defaults());
        assertEquals(10, summary.count(SiteRecord.Kind.CALL));
    }

    @Test
    void traceMethodsOptionTracesEveryMethodBody(@TempDir Path tmp) throws Exception {
        Path configFile = tmp.resolve("instrument.json");
        Files.writeString(configFile, "{\"trace_methods\": true}");
        Path out = tmp.resolve("out");

        InstrumentationSummary summary = instrumenter.instrument(FIXTURE_ROOT, out,
            new InstrumentConfigReader().read(configFile));

        // Shape.area() is abstract
        assertEquals(7, summary.count(SiteRecord.Kind.METHOD));
        assertEquals(10, summary.count(SiteRecord.Kind.CALL));
        String calculator = Files.readString(out.resolve(CALCULATOR));
        assertTrue(calculator.contains("PerfRuntime.trace(\"Entering method Calculator.sumTo\");"), calculator);
    }

    @Test
    void interfaceUnitGetsImportButNoInitializer(@TempDir Path out) throws Exception {
        instrumentFixture(out);
        String shape = Files.readString(out.resolve(SHAPE));
        assertTrue(shape.contains("import com.callprobe.runtime.PerfRuntime;"), shape);
        assertFalse(shape.contains("PerfRuntime.init("), shape);
    }

    @Test
    void instrumentedOutputCompilesAndRuns(@TempDir Path out) throws Exception {
        instrumentFixture(out);
        PerfRecorder.reset();
        PerfRuntime.configure(RuntimeConfig.defaults());

        Class<?> calculator = SourceCompiler.compileAndLoad("com.example.sample.Calculator",
            Files.readString(out.resolve(CALCULATOR)));

        assertEquals(7, calculator.getMethod("compute").invoke(null));
        assertEquals(10, calculator.getMethod("sumTo", int.class).invoke(null, 4));
        assertEquals(5L, PerfRecorder.callCount("add"));
        assertTrue(PerfRecorder.isUnitInitialized(CALCULATOR));
    }
}
