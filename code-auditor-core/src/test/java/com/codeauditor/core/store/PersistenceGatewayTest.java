package com.codeauditor.core.store;

import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.PersistOutcome;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.convert.impl.python.VultureParser;
import com.codeauditor.core.model.ConversionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.codeauditor.core.store.StoreFixtures.scan;
import static com.codeauditor.core.store.StoreFixtures.securityRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PersistenceGateway} against a real SQLite file.
 */
class PersistenceGatewayTest {

    @TempDir
    Path tempDir;

    private AuditDatabase database;
    private PersistenceGateway gateway;
    private FindingQueries queries;

    @BeforeEach
    void openDatabase() {
        database = AuditDatabase.open(tempDir.resolve("db").resolve("audit.sqlite3"), false);
        database.initializeSchema();
        gateway = new PersistenceGateway(database);
        queries = new FindingQueries(database);
    }

    @AfterEach
    void closeDatabase() {
        database.close();
    }

    @Test
    void persist_newScan_insertsScanAndFindings() {
        List<FindingRow> rows = List.of(
            securityRow("app/db.py", 12, "Possible SQL injection"),
            securityRow("app/db.py", 40, "Possible SQL injection"));

        PersistOutcome outcome = gateway.persist(scan("bandit", ToolKind.SECURITY), rows);

        assertThat(outcome.submitted()).isEqualTo(2);
        assertThat(outcome.newlyPersisted()).isEqualTo(2);
        assertThat(outcome.scanId()).isPositive();
        assertThat(queries.countScans()).isEqualTo(1);
        assertThat(queries.countFindings(ToolKind.SECURITY)).isEqualTo(2);
    }

    @Test
    void persist_sameFindingsTwice_isIdempotent() {
        List<FindingRow> rows = List.of(
            securityRow("app/db.py", 12, "Possible SQL injection"),
            securityRow("app/auth.py", 3, "Hardcoded password"));

        PersistOutcome first = gateway.persist(scan("bandit", ToolKind.SECURITY), rows);
        PersistOutcome second = gateway.persist(scan("bandit", ToolKind.SECURITY), rows);

        assertThat(first.newlyPersisted()).isEqualTo(2);
        assertThat(second.submitted()).isEqualTo(2);
        assertThat(second.newlyPersisted()).isZero();
        assertThat(second.duplicates()).isEqualTo(2);
        assertThat(second.scanId()).isGreaterThan(first.scanId());
        assertThat(queries.countScans()).isEqualTo(2);
        assertThat(queries.countFindings(ToolKind.SECURITY)).isEqualTo(2);
    }

    @Test
    void persist_failureOnThirdOfFiveRows_leavesNothingVisible() {
        List<FindingRow> rows = new ArrayList<>();
        rows.add(securityRow("app/a.py", 1, "one"));
        rows.add(securityRow("app/b.py", 2, "two"));
        rows.add(FindingRow.builder(ToolKind.SECURITY).root("billing-service").message("no file").build());
        rows.add(securityRow("app/d.py", 4, "four"));
        rows.add(securityRow("app/e.py", 5, "five"));

        assertThatThrownBy(() -> gateway.persist(scan("bandit", ToolKind.SECURITY), rows))
            .isInstanceOf(PersistenceException.class)
            .hasMessageContaining("bandit");

        assertThat(queries.countScans()).isZero();
        assertThat(queries.countFindings(ToolKind.SECURITY)).isZero();
    }

    @Test
    void persist_afterRolledBackFailure_connectionRemainsUsable() {
        List<FindingRow> broken = List.of(FindingRow.builder(ToolKind.LINT).message("no file").build());
        assertThatThrownBy(() -> gateway.persist(scan("eslint", ToolKind.LINT), broken))
            .isInstanceOf(PersistenceException.class);

        PersistOutcome outcome = gateway.persist(scan("eslint", ToolKind.LINT), List.of(
            FindingRow.builder(ToolKind.LINT).root("web").filePath("src/a.js").line(1).message("Missing semicolon.").build()));

        assertThat(outcome.newlyPersisted()).isEqualTo(1);
        assertThat(queries.countFindings(ToolKind.LINT)).isEqualTo(1);
    }

    @Test
    void persist_deadCodeAboveConfidenceThreshold_isStored() {
        ToolRunResult run = ToolRunResult.completed("vulture", List.of("vulture", "."), "/work/billing-service", 3, 80,
            "app/models.py:42: unused function 'legacy_export' (60% confidence)\n"
                + "app/models.py:7: unused import 'typing' (40% confidence)\n", "", null);
        ConversionResult converted = new VultureParser(50).convert(run);

        PersistOutcome outcome = gateway.persist(converted.scan(), converted.rows());

        assertThat(outcome.newlyPersisted()).isEqualTo(1);
        assertThat(queries.findings(ToolKind.DEAD_CODE, "billing-service"))
            .singleElement()
            .satisfies(stored -> {
                assertThat(stored.filePath()).isEqualTo("app/models.py");
                assertThat(stored.lineNumber()).isEqualTo(42);
                assertThat(stored.tool()).isEqualTo("vulture");
                assertThat(stored.extra()).containsEntry("confidence", 60);
            });
    }

    @Test
    void persist_scanWithoutFindings_storesFailureSummary() {
        PersistOutcome outcome = gateway.persist(
            scan("mypy", ToolKind.TYPE_CHECK).withFailure("timed out after 300000 ms"), List.of());

        assertThat(outcome.submitted()).isZero();
        assertThat(queries.countScans()).isEqualTo(1);
        assertThat(queries.countFindings(ToolKind.TYPE_CHECK)).isZero();
    }
}
