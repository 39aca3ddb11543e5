package com.callprobe.instrumenter.project;

import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Resolves the main source root of a Maven or Gradle project.
 */
public class SourceRootResolver {

    static final String DEFAULT_SOURCE_DIR = "src/main/java";

    public static class UnsupportedBuildToolException extends RuntimeException {
        public UnsupportedBuildToolException(String message) { super(message); }
    }

    /**
     * Detect build tool and resolve the source root.
     *
     * @param projectRoot path to the project root directory
     */
    public SourceRoots resolve(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        Path pomFile = root.resolve("pom.xml");
        Path gradleFile = root.resolve("build.gradle");
        Path gradleKts = root.resolve("build.gradle.kts");

        if (pomFile.toFile().exists()) {
            return resolveMaven(root, pomFile);
        } else if (gradleFile.toFile().exists() || gradleKts.toFile().exists()) {
            // Gradle: standard convention, no build script evaluation
            return new SourceRoots(root, root.resolve(DEFAULT_SOURCE_DIR), "gradle");
        } else {
            throw new UnsupportedBuildToolException(
                "No pom.xml or build.gradle found in: " + root +
                ". Supported build tools: Maven, Gradle."
            );
        }
    }

    private SourceRoots resolveMaven(Path projectRoot, Path pomFile) {
        String sourceDir = DEFAULT_SOURCE_DIR;
        try (FileReader reader = new FileReader(pomFile.toFile())) {
            Model model = new MavenXpp3Reader().read(reader);
            if (model.getBuild() != null && model.getBuild().getSourceDirectory() != null) {
                sourceDir = model.getBuild().getSourceDirectory();
            }
        } catch (IOException | XmlPullParserException e) {
            System.err.println("[callprobe] Warning: could not parse pom.xml, using default source root: " + e.getMessage());
        }
        return new SourceRoots(projectRoot, projectRoot.resolve(sourceDir).normalize(), "maven");
    }
}
