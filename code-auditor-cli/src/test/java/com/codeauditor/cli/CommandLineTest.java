package com.codeauditor.cli;

import com.codeauditor.CodeAuditorCLI;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.store.AuditDatabase;
import com.codeauditor.core.store.FindingQueries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the subcommands against a temporary database.
 */
@DisplayName("Command line")
class CommandLineTest {

    @TempDir
    Path tempDir;

    private Path database;
    private Path config;

    @BeforeEach
    void writeConfig() throws IOException {
        database = tempDir.resolve("out").resolve("auditor.sqlite3");
        config = tempDir.resolve("auditor.yaml");
        Files.writeString(config, """
            database:
              path: "%s"
            tools:
              bandit:
                executable: "%s"
            """.formatted(
                database.toString().replace("\\", "/"),
                tempDir.resolve("bin").resolve("no-such-bandit").toString().replace("\\", "/")));
    }

    @Test
    @DisplayName("list prints the registered tools")
    void list_succeeds() {
        assertThat(execute("list")).isZero();
    }

    @Test
    @DisplayName("seed-db creates the database file and is repeatable")
    void seedDb_createsDatabase() {
        assertThat(execute("seed-db", "-c", config.toString())).isZero();
        assertThat(database).exists();

        assertThat(execute("seed-db", "-c", config.toString())).isZero();
    }

    @Test
    @DisplayName("audit with an unknown tool fails without touching the database")
    void audit_unknownTool_returnsOne() {
        int exitCode = execute("audit", tempDir.toString(), "-t", "pylint", "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(database).doesNotExist();
    }

    @Test
    @DisplayName("audit with a missing root fails")
    void audit_missingRoot_returnsOne() {
        int exitCode = execute("audit", tempDir.resolve("missing").toString(), "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @DisplayName("audit records a scan when the tool cannot be launched")
    void audit_missingExecutable_recordsLaunchFailure() throws IOException {
        Path project = Files.createDirectories(tempDir.resolve("billing-service"));
        Files.writeString(project.resolve("app.py"), "print('hello')\n");

        int exitCode = execute("audit", project.toString(), "-t", "bandit", "--timeout", "10", "-c", config.toString());

        assertThat(exitCode).isZero();
        try (AuditDatabase db = AuditDatabase.open(database, false)) {
            FindingQueries queries = new FindingQueries(db);
            assertThat(queries.countScans()).isEqualTo(1);
            assertThat(queries.countFindings(ToolKind.SECURITY)).isZero();
        }
    }

    @Test
    @DisplayName("export on an empty database writes nothing")
    void export_emptyDatabase_succeeds() {
        Path output = tempDir.resolve("export");

        int exitCode = execute("export", "-o", output.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(output).doesNotExist();
    }

    private static int execute(String... args) {
        return CodeAuditorCLI.commandLine().execute(args);
    }
}
