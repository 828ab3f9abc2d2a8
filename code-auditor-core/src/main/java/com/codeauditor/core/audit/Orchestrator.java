package com.codeauditor.core.audit;

import com.codeauditor.core.config.AuditorConfig;
import com.codeauditor.core.config.ConfigurationException;
import com.codeauditor.core.convert.ResultConverter;
import com.codeauditor.core.model.ConversionResult;
import com.codeauditor.core.model.PersistOutcome;
import com.codeauditor.core.model.ScanMetadata;
import com.codeauditor.core.model.ToolKind;
import com.codeauditor.core.model.ToolRunResult;
import com.codeauditor.core.registry.ToolRegistry;
import com.codeauditor.core.store.PersistenceException;
import com.codeauditor.core.store.PersistenceGateway;
import com.codeauditor.core.tool.ToolRunner;
import com.codeauditor.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans tool invocations out over a bounded worker pool and records every outcome.
 *
 * <p>Workers only run analyzers. Conversion and persistence happen on the calling
 * thread as each invocation completes, so the database handle is never shared
 * between threads. In workspace mode projects are audited one after another.
 *
 * <p>With stop-on-error, the first failing invocation raises a shared flag;
 * invocations that have not started yet see it and are recorded as cancelled
 * without launching, while invocations already running finish normally.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final ToolRegistry registry;
    private final ToolRunner runner;
    private final ResultConverter converter;
    private final PersistenceGateway gateway;
    private final AuditorConfig config;

    public Orchestrator(ToolRegistry registry, ToolRunner runner, ResultConverter converter,
                        PersistenceGateway gateway, AuditorConfig config) {
        this.registry = registry;
        this.runner = runner;
        this.converter = converter;
        this.gateway = gateway;
        this.config = config;
    }

    /**
     * Runs an audit.
     *
     * @param request audit parameters
     * @return per-tool outcomes and totals
     * @throws ConfigurationException if a tool id is unknown or the root is unusable;
     *         raised before any process is launched
     */
    public AuditSummary audit(AuditRequest request) {
        List<String> toolIds = request.toolIds().isEmpty() ? registry.ids() : request.toolIds();
        List<Path> projects = resolveProjects(request, toolIds);

        AtomicBoolean stop = new AtomicBoolean(false);
        List<ToolOutcome> outcomes = new ArrayList<>();

        for (Path project : projects) {
            String label = FileUtils.rootLabel(project.toString());
            if (stop.get()) {
                log.info("Skipping project {}: stopped after an earlier failure", label);
                for (String toolId : toolIds) {
                    outcomes.add(ToolOutcome.cancelled(label, toolId, kindOf(toolId)));
                }
                continue;
            }
            log.info("Auditing {} with {}", project, toolIds);
            outcomes.addAll(auditProject(project, label, toolIds, request, stop));
        }

        AuditSummary summary = new AuditSummary(outcomes, stop.get(), config.reporting().effectiveCountMetricsAsIssues());
        log.info("Audit finished: {} invocations, {} failed, {} cancelled, {} issues",
            outcomes.size(), summary.failures().size(), summary.cancelled().size(), summary.issueTotal());
        return summary;
    }

    private List<Path> resolveProjects(AuditRequest request, List<String> toolIds) {
        registry.requireKnown(toolIds);

        Path root = request.root().toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            throw new ConfigurationException("Target does not exist: " + root);
        }
        if (!request.multi()) {
            return List.of(root);
        }
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Workspace mode requires a directory: " + root);
        }

        try {
            List<Path> projects = ProjectDiscovery.discover(root, config.audit().effectiveExcludedDirectories());
            if (projects.isEmpty()) {
                log.warn("No projects found under {}", root);
            } else {
                log.info("Discovered {} projects under {}", projects.size(), root);
            }
            return projects;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list workspace " + root + ": " + e.getMessage());
        }
    }

    private List<ToolOutcome> auditProject(Path project, String label, List<String> toolIds,
                                           AuditRequest request, AtomicBoolean stop) {
        int poolSize = Math.max(1, Math.min(request.jobs(), toolIds.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreads(label));
        CompletionService<Invocation> completion = new ExecutorCompletionService<>(pool);

        for (String toolId : toolIds) {
            log.debug("{}/{}: {}", label, toolId, InvocationState.PENDING);
            completion.submit(() -> invoke(toolId, project, label, request, stop));
        }

        List<ToolOutcome> outcomes = new ArrayList<>(toolIds.size());
        try {
            for (int i = 0; i < toolIds.size(); i++) {
                Future<Invocation> future = completion.take();
                outcomes.add(record(label, future.get()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Audit of " + label + " interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Worker failed while auditing " + label, e.getCause());
        } finally {
            pool.shutdownNow();
        }
        return outcomes;
    }

    /**
     * Runs on a worker thread. Only launches the analyzer; never touches the database.
     */
    private Invocation invoke(String toolId, Path project, String label, AuditRequest request, AtomicBoolean stop) {
        if (request.stopOnError() && stop.get()) {
            log.debug("{}/{}: {}", label, toolId, InvocationState.CANCELLED);
            return Invocation.cancelled(toolId);
        }

        log.debug("{}/{}: {}", label, toolId, InvocationState.RUNNING);
        ToolRunResult run;
        try {
            run = runner.run(toolId, project, request.timeout());
        } catch (RuntimeException e) {
            log.error("{}/{}: runner error: {}", label, toolId, e.getMessage(), e);
            run = ToolRunResult.launchFailed(toolId, List.of(), project.toString(), 0, String.valueOf(e.getMessage()));
        }

        boolean failed = runner.isFailure(run);
        if (failed && request.stopOnError() && stop.compareAndSet(false, true)) {
            log.warn("{}/{} failed; cancelling invocations not yet started", label, toolId);
        }
        return new Invocation(toolId, run, failed);
    }

    /**
     * Runs on the orchestrating thread: converts and persists one completed invocation.
     */
    private ToolOutcome record(String label, Invocation invocation) {
        String toolId = invocation.toolId();
        ToolKind kind = kindOf(toolId);
        if (invocation.run() == null) {
            return ToolOutcome.cancelled(label, toolId, kind);
        }

        ToolRunResult run = invocation.run();
        InvocationState state = InvocationState.of(run.status());
        log.debug("{}/{}: {}", label, toolId, state);

        ConversionResult conversion = convert(toolId, run, kind);
        ScanMetadata scan = conversion.scan();
        try {
            PersistOutcome persisted = gateway.persist(scan, conversion.rows());
            return new ToolOutcome(label, toolId, kind, state, run.exitCode(), invocation.failed(),
                persisted.submitted(), persisted.newlyPersisted(), scan.failureSummary());
        } catch (PersistenceException e) {
            log.error("{}/{}: {}", label, toolId, e.getMessage());
            return new ToolOutcome(label, toolId, kind, state, run.exitCode(), true,
                conversion.rows().size(), 0, scan.withFailure("persistence failed: " + e.getMessage()).failureSummary());
        }
    }

    private ConversionResult convert(String toolId, ToolRunResult run, ToolKind kind) {
        try {
            return converter.convert(toolId, run);
        } catch (RuntimeException e) {
            log.error("{}: conversion error: {}", toolId, e.getMessage(), e);
            return ConversionResult.withoutFindings(
                ScanMetadata.fromRun(run, kind).withFailure("conversion failed: " + e.getMessage()));
        }
    }

    private ToolKind kindOf(String toolId) {
        return registry.binding(toolId).tool().getKind();
    }

    private static ThreadFactory workerThreads(String label) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "audit-" + label + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Invocation(String toolId, ToolRunResult run, boolean failed) {

        static Invocation cancelled(String toolId) {
            return new Invocation(toolId, null, false);
        }
    }
}
