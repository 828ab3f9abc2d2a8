package com.codeauditor.core.store;

import com.codeauditor.core.model.FindingRow;
import com.codeauditor.core.model.ToolKind;
import org.junit.jupiter.api.Test;

import static com.codeauditor.core.store.StoreFixtures.securityRow;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DeterministicKeys}.
 */
class DeterministicKeysTest {

    @Test
    void compute_sameIdentifyingFields_sameKey() {
        FindingRow first = securityRow("app/db.py", 12, "Possible SQL injection");
        FindingRow rescan = FindingRow.builder(ToolKind.SECURITY)
            .root("billing-service")
            .filePath("app/db.py")
            .line(12)
            .column(4)
            .message("Possible SQL injection")
            .ruleId("B608:hardcoded_sql_expressions")
            .severity("HIGH")
            .extra("confidence", "HIGH")
            .build();

        assertThat(DeterministicKeys.compute(first)).isEqualTo(DeterministicKeys.compute(rescan));
    }

    @Test
    void compute_isSha256Hex() {
        assertThat(DeterministicKeys.compute(securityRow("app/db.py", 12, "x"))).matches("[0-9a-f]{64}");
    }

    @Test
    void compute_differentLineOrKind_differentKey() {
        FindingRow base = securityRow("app/db.py", 12, "Possible SQL injection");
        FindingRow otherLine = securityRow("app/db.py", 13, "Possible SQL injection");
        FindingRow otherKind = FindingRow.builder(ToolKind.LINT)
            .root(base.root()).filePath(base.filePath()).line(12).column(4)
            .message(base.message()).ruleId(base.ruleId()).build();

        assertThat(DeterministicKeys.compute(base))
            .isNotEqualTo(DeterministicKeys.compute(otherLine))
            .isNotEqualTo(DeterministicKeys.compute(otherKind));
    }

    @Test
    void compute_fieldsDoNotRunTogether() {
        FindingRow a = FindingRow.builder(ToolKind.LINT).root("ab").filePath("c").message("m").build();
        FindingRow b = FindingRow.builder(ToolKind.LINT).root("a").filePath("bc").message("m").build();

        assertThat(DeterministicKeys.compute(a)).isNotEqualTo(DeterministicKeys.compute(b));
    }
}
