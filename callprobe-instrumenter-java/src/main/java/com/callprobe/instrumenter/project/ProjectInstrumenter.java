package com.callprobe.instrumenter.project;

import com.callprobe.instrumenter.config.InstrumentConfig;
import com.callprobe.instrumenter.engine.ExclusionFilter;
import com.callprobe.instrumenter.engine.IdentityTracker;
import com.callprobe.instrumenter.engine.InstrumentationContext;
import com.callprobe.instrumenter.engine.InstrumentationEngine;
import com.callprobe.instrumenter.engine.RuntimeApi;
import com.callprobe.instrumenter.engine.Sha256SourceHasher;
import com.callprobe.instrumenter.host.JdtSourceParser;
import com.callprobe.instrumenter.host.JdtSourceParser.ParsedUnit;
import com.callprobe.instrumenter.host.SourcePrinter;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Orchestrates a full project pass.
 * Every .java file under the source root is parsed, instrumented and printed to the output
 * directory at the same relative path.
 */
public class ProjectInstrumenter {

    private final SourceRootResolver resolver = new SourceRootResolver();
    private final JdtSourceParser parser = new JdtSourceParser();
    private final SourcePrinter printer = new SourcePrinter();

    public InstrumentationSummary instrument(Path projectRoot, Path outputDir, InstrumentConfig config) {
        // 1. Resolve source root
        SourceRoots roots = resolver.resolve(projectRoot);
        List<Path> sourceFiles = collectSourceFiles(roots.sourceRoot());
        System.err.println("[callprobe] " + roots.buildTool() + " project, "
                + sourceFiles.size() + " source files under " + roots.sourceRoot());

        // 2. Build the engine from config
        RuntimeApi runtime = new RuntimeApi(config.getRuntimeClass());
        InstrumentationEngine engine = InstrumentationEngine.create(
                ExclusionFilter.defaults().extendedWith(config.getExcludedNames()),
                runtime,
                new Sha256SourceHasher(config.getHashLength()),
                config.isVerbose(),
                config.isTraceMethods());
        IdentityTracker sharedTracker = new IdentityTracker();

        // 3. Instrument each file
        List<InstrumentationSummary.FileResult> results = new ArrayList<>();
        for (Path file : sourceFiles) {
            String relativePath = relativize(roots.sourceRoot(), file);
            ParsedUnit parsed = parser.parse(file);

            IdentityTracker tracker = config.isShareIdentityTracker() ? sharedTracker : new IdentityTracker();
            InstrumentationContext ctx = InstrumentationContext.forUnit(
                    relativePath, parsed.source(), parsed.unit(), tracker);
            CompilationUnit instrumented = engine.instrument(parsed.unit(), ctx);

            write(outputDir.resolve(relativePath), printer.print(instrumented));
            results.add(new InstrumentationSummary.FileResult(relativePath, ctx.sites()));
        }

        return new InstrumentationSummary(roots.sourceRoot(), outputDir, runtime.qualifiedName(), results);
    }

    private List<Path> collectSourceFiles(Path sourceRoot) {
        if (!sourceRoot.toFile().exists()) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(sourceRoot)) {
            return walk
                .filter(p -> p.toString().endsWith(".java"))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not walk source tree: " + sourceRoot, e);
        }
    }

    private void write(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write instrumented source: " + target, e);
        }
    }

    static String relativize(Path sourceRoot, Path file) {
        return sourceRoot.relativize(file).toString().replace('\\', '/');
    }
}
