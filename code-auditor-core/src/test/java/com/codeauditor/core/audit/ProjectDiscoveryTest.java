package com.codeauditor.core.audit;

import com.codeauditor.core.config.AuditorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProjectDiscovery}.
 */
class ProjectDiscoveryTest {

    @TempDir
    Path workspace;

    @Test
    void discover_skipsExcludedDirectoriesAndFiles() throws IOException {
        Files.createDirectories(workspace.resolve("b"));
        Files.createDirectories(workspace.resolve("a"));
        Files.createDirectories(workspace.resolve(".git"));
        Files.createDirectories(workspace.resolve("node_modules"));
        Files.writeString(workspace.resolve("README.md"), "# workspace");

        List<Path> projects = ProjectDiscovery.discover(workspace, AuditorConfig.DEFAULT_EXCLUDED_DIRECTORIES);

        assertThat(projects).extracting(p -> p.getFileName().toString()).containsExactly("a", "b");
    }

    @Test
    void discover_customDenylist_replacesDefaults() throws IOException {
        Files.createDirectories(workspace.resolve("build"));
        Files.createDirectories(workspace.resolve("legacy"));

        List<Path> projects = ProjectDiscovery.discover(workspace, Set.of("legacy"));

        assertThat(projects).extracting(p -> p.getFileName().toString()).containsExactly("build");
    }

    @Test
    void discover_emptyWorkspace_returnsNothing() throws IOException {
        assertThat(ProjectDiscovery.discover(workspace, Set.of())).isEmpty();
    }
}
