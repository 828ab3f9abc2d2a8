package com.codeauditor.core.tool;

import com.codeauditor.core.model.ToolRunResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Launches one analyzer command as a child process with a hard wall-clock timeout.
 *
 * <p>stdout and stderr are drained on background threads so a chatty tool cannot
 * block on a full pipe. A process still alive at the deadline is destroyed
 * forcibly and reported as timed out; a command that cannot be started is
 * reported as a launch failure with the OS error in stderr. Exit codes are never
 * interpreted here.
 */
public class ProcessExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);

    private static final long READER_JOIN_MILLIS = 5_000;
    private static final long KILL_WAIT_MILLIS = 5_000;

    private final ObjectMapper objectMapper;

    public ProcessExecutor() {
        this(new ObjectMapper());
    }

    public ProcessExecutor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Runs the invocation and captures its outcome.
     *
     * @param toolId tool identifier recorded in the result
     * @param invocation command to launch
     * @param timeout wall-clock budget
     * @return run result in one of the three terminal states
     */
    public ToolRunResult execute(String toolId, ToolInvocation invocation, Duration timeout) {
        List<String> command = invocation.command();
        String cwd = invocation.workingDirectory().toAbsolutePath().toString();
        long timeoutMillis = Math.max(1, timeout.toMillis());

        log.debug("Launching {} in {}: {}", toolId, cwd, String.join(" ", command));

        long startNanos = System.nanoTime();
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(invocation.workingDirectory().toFile());
            builder.redirectErrorStream(false);
            builder.environment().putAll(invocation.environment());
            process = builder.start();
        } catch (IOException e) {
            log.warn("Failed to launch {}: {}", toolId, e.getMessage());
            return ToolRunResult.launchFailed(toolId, command, cwd, elapsedMillis(startNanos), e.getMessage());
        }

        closeStdin(process, toolId);

        OutputCollector stdout = OutputCollector.start(process.getInputStream(), toolId + "-stdout");
        OutputCollector stderr = OutputCollector.start(process.getErrorStream(), toolId + "-stderr");

        boolean finished;
        try {
            finished = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + toolId, e);
        }

        if (!finished) {
            process.destroyForcibly();
            awaitKill(process, toolId);
            stdout.join(READER_JOIN_MILLIS);
            stderr.join(READER_JOIN_MILLIS);
            log.warn("{} timed out after {} ms", toolId, timeoutMillis);
            String stderrText = stderr.text() + "\n[TIMEOUT after " + timeoutMillis + " ms]";
            return ToolRunResult.timedOut(toolId, command, cwd, timeoutMillis, stdout.text(), stderrText);
        }

        long duration = Math.min(elapsedMillis(startNanos), timeoutMillis);
        stdout.join(READER_JOIN_MILLIS);
        stderr.join(READER_JOIN_MILLIS);

        int exitCode = process.exitValue();
        String stdoutText = stdout.text();
        JsonNode parsed = invocation.expectsJson() ? parseJson(toolId, invocation.jsonOutputFile(), stdoutText) : null;

        log.debug("{} exited with code {} after {} ms ({} bytes stdout)", toolId, exitCode, duration, stdoutText.length());
        return ToolRunResult.completed(toolId, command, cwd, exitCode, duration, stdoutText, stderr.text(), parsed);
    }

    /**
     * Best-effort JSON parse of the tool output.
     *
     * <p>Reads the designated output file when one exists, stdout otherwise. Anything that
     * does not look like a JSON object or array, or fails to parse, yields {@code null}.
     */
    JsonNode parseJson(String toolId, Path outputFile, String stdout) {
        String text = stdout;
        if (outputFile != null && Files.isRegularFile(outputFile)) {
            try {
                text = Files.readString(outputFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Could not read JSON output file of {}: {}", toolId, e.getMessage());
                return null;
            }
        }

        String trimmed = text == null ? "" : text.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return null;
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.debug("Output of {} is not valid JSON: {}", toolId, e.getOriginalMessage());
            return null;
        }
    }

    private static void closeStdin(Process process, String toolId) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", toolId, e.getMessage());
        }
    }

    private static void awaitKill(Process process, String toolId) {
        try {
            if (!process.waitFor(KILL_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("{} did not exit within {} ms of being killed", toolId, KILL_WAIT_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Drains one process stream into memory on a daemon thread.
     */
    private static final class OutputCollector implements Runnable {

        private final InputStream stream;
        private final StringBuilder buffer = new StringBuilder();
        private Thread thread;

        private OutputCollector(InputStream stream) {
            this.stream = stream;
        }

        static OutputCollector start(InputStream stream, String name) {
            OutputCollector collector = new OutputCollector(stream);
            collector.thread = new Thread(collector, name);
            collector.thread.setDaemon(true);
            collector.thread.start();
            return collector;
        }

        @Override
        public void run() {
            char[] chunk = new char[8192];
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                int read;
                while ((read = reader.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.append(chunk, 0, read);
                    }
                }
            } catch (IOException e) {
                // Stream closes abruptly when the process is killed.
                log.debug("Stream {} closed: {}", Thread.currentThread().getName(), e.getMessage());
            }
        }

        void join(long millis) {
            try {
                thread.join(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString();
            }
        }
    }
}
