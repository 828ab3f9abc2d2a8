package com.codeauditor.core.registry;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.convert.impl.javascript.EslintParser;
import com.codeauditor.core.convert.impl.polyglot.SemgrepParser;
import com.codeauditor.core.convert.impl.python.BanditParser;
import com.codeauditor.core.convert.impl.python.MypyParser;
import com.codeauditor.core.convert.impl.python.RadonParser;
import com.codeauditor.core.convert.impl.python.VultureParser;
import com.codeauditor.core.tool.impl.javascript.EslintTool;
import com.codeauditor.core.tool.impl.polyglot.SemgrepTool;
import com.codeauditor.core.tool.impl.python.BanditTool;
import com.codeauditor.core.tool.impl.python.MypyTool;
import com.codeauditor.core.tool.impl.python.RadonTool;
import com.codeauditor.core.tool.impl.python.VultureTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static table of supported analyzers, keyed by tool id.
 *
 * <p>The table is built and validated once when the command starts: ids must be
 * unique and every analyzer must have a parser of the same kind. Lookups of an
 * unregistered id raise {@link ConfigurationException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ToolRegistry registry = ToolRegistry.defaults(config);
 * ToolBinding bandit = registry.binding("bandit");
 * }</pre>
 */
public final class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolBinding> bindings;

    private ToolRegistry(Map<String, ToolBinding> bindings) {
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    /**
     * Builds the registry of built-in analyzers.
     *
     * @param config configuration supplying executable overrides and converter thresholds
     * @return validated registry
     */
    public static ToolRegistry defaults(AuditorConfig config) {
        return of(List.of(
            new ToolBinding(new BanditTool(config.toolSettings(BanditTool.TOOL_ID)), new BanditParser()),
            new ToolBinding(new MypyTool(config.toolSettings(MypyTool.TOOL_ID)), new MypyParser()),
            new ToolBinding(new RadonTool(config.toolSettings(RadonTool.TOOL_ID)), new RadonParser()),
            new ToolBinding(new VultureTool(config.toolSettings(VultureTool.TOOL_ID)),
                new VultureParser(config.converter().effectiveDeadCodeMinConfidence())),
            new ToolBinding(new EslintTool(config.toolSettings(EslintTool.TOOL_ID)), new EslintParser()),
            new ToolBinding(new SemgrepTool(config.toolSettings(SemgrepTool.TOOL_ID)), new SemgrepParser())
        ));
    }

    /**
     * Builds a registry from explicit bindings, preserving their order.
     *
     * @param bindings tool bindings
     * @return validated registry
     * @throws ConfigurationException if the list is empty or ids repeat
     */
    public static ToolRegistry of(List<ToolBinding> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            throw new ConfigurationException("Tool registry must not be empty");
        }
        Map<String, ToolBinding> table = new LinkedHashMap<>();
        for (ToolBinding binding : bindings) {
            if (table.putIfAbsent(binding.id(), binding) != null) {
                throw new ConfigurationException("Duplicate tool id: " + binding.id());
            }
        }
        log.debug("Registered tools: {}", table.keySet());
        return new ToolRegistry(table);
    }

    /**
     * Returns registered tool ids in registration order.
     *
     * @return tool ids
     */
    public List<String> ids() {
        return List.copyOf(bindings.keySet());
    }

    public Collection<ToolBinding> bindings() {
        return bindings.values();
    }

    /**
     * Looks up a tool.
     *
     * @param toolId tool identifier
     * @return binding
     * @throws ConfigurationException if the tool is not registered
     */
    public ToolBinding binding(String toolId) {
        ToolBinding binding = bindings.get(toolId);
        if (binding == null) {
            throw new ConfigurationException("Unknown tool: " + toolId + " (available: " + String.join(", ", ids()) + ")");
        }
        return binding;
    }

    /**
     * Verifies that every id is registered.
     *
     * @param toolIds ids to check
     * @throws ConfigurationException naming the first unknown id
     */
    public void requireKnown(Collection<String> toolIds) {
        for (String toolId : toolIds) {
            binding(toolId);
        }
    }
}
