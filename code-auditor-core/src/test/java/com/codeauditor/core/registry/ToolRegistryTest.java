package com.codeauditor.core.registry;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.convert.impl.python.BanditParser;
import com.codeauditor.core.convert.impl.python.MypyParser;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.tool.impl.python.BanditTool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ToolRegistry} and {@link ToolBinding} validation.
 */
class ToolRegistryTest {

    private final ToolRegistry registry = ToolRegistry.defaults(AuditorConfig.defaults());

    @Test
    void defaults_coverEveryToolKind() {
        assertThat(registry.ids()).containsExactly("bandit", "mypy", "radon", "vulture", "eslint", "semgrep");
        assertThat(registry.bindings())
            .extracting(b -> b.tool().getKind())
            .containsOnly(ToolKind.values());
    }

    @Test
    void defaults_everyToolHasMatchingParser() {
        for (ToolBinding binding : registry.bindings()) {
            assertThat(binding.parser().getToolId()).isEqualTo(binding.tool().getId());
            assertThat(binding.parser().getKind()).isEqualTo(binding.tool().getKind());
        }
    }

    @Test
    void binding_unknownTool_throwsConfigurationException() {
        assertThatThrownBy(() -> registry.binding("pylint"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("pylint")
            .hasMessageContaining("bandit");
    }

    @Test
    void requireKnown_reportsFirstUnknownId() {
        assertThatThrownBy(() -> registry.requireKnown(List.of("mypy", "snyk", "gitleaks")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("snyk")
            .hasMessageNotContaining("gitleaks");
    }

    @Test
    void of_duplicateIds_isRejected() {
        ToolBinding bandit = new ToolBinding(new BanditTool(null), new BanditParser());

        assertThatThrownBy(() -> ToolRegistry.of(List.of(bandit, bandit)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void of_emptyTable_isRejected() {
        assertThatThrownBy(() -> ToolRegistry.of(List.of()))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void binding_mismatchedParser_isRejected() {
        assertThatThrownBy(() -> new ToolBinding(new BanditTool(null), new MypyParser()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("mypy");
    }
}
