package com.callprobe.instrumenter;

import com.callprobe.instrumenter.config.InstrumentConfig;
import com.callprobe.instrumenter.config.InstrumentConfigReader;
import com.callprobe.instrumenter.engine.SiteRecord;
import com.callprobe.instrumenter.project.InstrumentationSummary;
import com.callprobe.instrumenter.project.ProjectInstrumenter;
import com.callprobe.instrumenter.report.SiteManifestWriter;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar callprobe-instrumenter-java.jar instrument \
 *     --project <project-dir> \
 *     --output  <output-dir> \
 *     [--config <path-to-instrument.json>]
 */
public class InstrumenterMain {

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /** Runs the CLI and returns its exit code: 0 on success, 2 on usage errors, 1 otherwise. */
    static int execute(String[] args) {
        try {
            run(args);
            return 0;
        } catch (UsageException e) {
            System.err.println("[callprobe] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar callprobe-instrumenter-java.jar instrument " +
                               "--project <dir> --output <dir> [--config <file>]");
            return 2;
        } catch (Exception e) {
            System.err.println("[callprobe] FATAL: " + e.getMessage());
            return 1;
        }
    }

    static InstrumentationSummary run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("instrument")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String projectDir = null;
        String outputDir = null;
        String configPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--project" -> projectDir = requireNext(args, i++, "--project");
                case "--output"  -> outputDir  = requireNext(args, i++, "--output");
                case "--config"  -> configPath = requireNext(args, i++, "--config");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (projectDir == null) throw new UsageException("--project is required");
        if (outputDir == null)  throw new UsageException("--output is required");

        Path project = Paths.get(projectDir);
        Path output  = Paths.get(outputDir);

        // 1. Config
        InstrumentConfig config = InstrumentConfig.defaults();
        if (configPath != null) {
            System.err.println("[callprobe] Reading config: " + configPath);
            config = new InstrumentConfigReader().read(Paths.get(configPath));
        }

        // 2. Instrument
        System.err.println("[callprobe] Instrumenting project: " + project);
        InstrumentationSummary summary = new ProjectInstrumenter().instrument(project, output, config);
        System.err.println("[callprobe] Instrumented " + summary.files().size() + " files: "
                + summary.count(SiteRecord.Kind.CALL) + " calls, "
                + summary.count(SiteRecord.Kind.LOOP) + " loops");

        // 3. Manifest
        new SiteManifestWriter().write(summary, output);

        System.err.println("[callprobe] Done.");
        return summary;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
