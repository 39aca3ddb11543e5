package com.callprobe.instrumenter;

import com.callprobe.instrumenter.project.SourceRootResolver;
import com.callprobe.instrumenter.project.SourceRoots;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class SourceRootResolverTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/sample-app");

    private final SourceRootResolver resolver = new SourceRootResolver();

    @Test
    void mavenProjectResolvesCorrectSourceRoot() {
        SourceRoots roots = resolver.resolve(FIXTURE_ROOT);
        assertEquals("maven", roots.buildTool());
        assertEquals(FIXTURE_ROOT.toAbsolutePath().normalize(), roots.projectRoot());
        assertTrue(roots.sourceRoot().endsWith(Path.of("src", "main", "java")),
            "Expected source root to end with src/main/java but got: " + roots.sourceRoot());
        assertTrue(roots.sourceRoot().toFile().exists(),
            "Source root directory must exist: " + roots.sourceRoot());
    }

    @Test
    void customSourceDirectoryIsHonoured(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), """
            <project>
              <modelVersion>4.0.0</modelVersion>
              <groupId>x</groupId>
              <artifactId>y</artifactId>
              <version>1</version>
              <build>
                <sourceDirectory>src/java</sourceDirectory>
              </build>
            </project>
            """);
        SourceRoots roots = resolver.resolve(tmp);
        assertEquals(tmp.toAbsolutePath().normalize().resolve("src/java"), roots.sourceRoot());
    }

    @Test
    void unparsablePomFallsBackToDefault(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), "<project><oops>");
        SourceRoots roots = resolver.resolve(tmp);
        assertTrue(roots.sourceRoot().endsWith(Path.of("src", "main", "java")));
    }

    @Test
    void gradleProjectUsesConvention(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("build.gradle.kts"), "plugins { java }");
        SourceRoots roots = resolver.resolve(tmp);
        assertEquals("gradle", roots.buildTool());
        assertTrue(roots.sourceRoot().endsWith(Path.of("src", "main", "java")));
    }

    @Test
    void noBuildFileThrows(@TempDir Path tmp) {
        assertThrows(SourceRootResolver.UnsupportedBuildToolException.class,
            () -> resolver.resolve(tmp));
    }
}
