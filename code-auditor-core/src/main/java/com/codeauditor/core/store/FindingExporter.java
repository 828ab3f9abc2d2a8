package com.codeauditor.core.store;

import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.model.ToolKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes stored findings to {@code <output>/<root>/findings.json}, one file per project root.
 *
 * <p>Complexity metrics are left out unless requested. Roots with nothing to
 * export get no file.
 */
public class FindingExporter {

    private static final Logger log = LoggerFactory.getLogger(FindingExporter.class);

    public static final String FILE_NAME = "findings.json";

    private final FindingQueries queries;
    private final ObjectMapper objectMapper;

    public FindingExporter(FindingQueries queries) {
        this.queries = queries;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Exports findings.
     *
     * @param outputDirectory directory receiving one subdirectory per root
     * @param rootFilter only export this root, or {@code null} for all
     * @param includeMetrics include complexity metric rows
     * @return files written and counts per root
     * @throws IOException if a file cannot be written
     * @throws ConfigurationException if the root filter is not a single directory name
     */
    public ExportReport export(Path outputDirectory, String rootFilter, boolean includeMetrics) throws IOException {
        Path base = outputDirectory.toAbsolutePath().normalize();
        if (rootFilter != null) {
            directoryFor(base, rootFilter);
        }
        List<String> roots = rootFilter != null ? List.of(rootFilter) : queries.roots();
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<Path> files = new ArrayList<>();

        for (String root : roots) {
            Map<String, Integer> perKind = new LinkedHashMap<>();
            List<StoredFinding> findings = new ArrayList<>();
            for (ToolKind kind : ToolKind.values()) {
                if (kind.isMetric() && !includeMetrics) {
                    continue;
                }
                List<StoredFinding> ofKind = queries.findings(kind, root);
                perKind.put(kind.label(), ofKind.size());
                findings.addAll(ofKind);
            }

            if (findings.isEmpty()) {
                log.debug("No findings for root '{}', skipping", root);
                continue;
            }

            Path directory = directoryFor(base, root);
            Files.createDirectories(directory);
            Path file = directory.resolve(FILE_NAME);
            objectMapper.writeValue(file.toFile(),
                new ExportDocument(root, Instant.now(), includeMetrics, perKind, findings));

            log.info("Exported {} findings for '{}' to {}", findings.size(), root, file);
            counts.put(root, findings.size());
            files.add(file);
        }

        return new ExportReport(files, counts);
    }

    /**
     * Resolves the export directory of a root, which must stay a direct child of the base.
     *
     * @throws ConfigurationException if the root is not a single path segment
     */
    static Path directoryFor(Path base, String root) {
        Path directory = base.resolve(root.isEmpty() ? "_" : root).normalize();
        if (!base.equals(directory.getParent())) {
            throw new ConfigurationException("Root must be a single directory name: " + root);
        }
        return directory;
    }

    /**
     * Shape of one exported file.
     */
    public record ExportDocument(
        String root,
        Instant generatedAt,
        boolean includeMetrics,
        Map<String, Integer> counts,
        List<StoredFinding> findings
    ) {
    }

    /**
     * Result of an export run.
     *
     * @param files files written
     * @param findingsPerRoot exported finding count per root
     */
    public record ExportReport(List<Path> files, Map<String, Integer> findingsPerRoot) {

        public int total() {
            return findingsPerRoot.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
