package com.awsmcp.mcp.telemetry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Telemetry logger for tracking tool usage, success rates and failure patterns.
 * Writes one JSON event per line to a dated file and keeps per-tool counters for the session summary.
 * Telemetry problems are logged and never reach tool callers.
 */
public class TelemetryLogger {
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryLogger.class);

    private static final String LOG_FILE_PREFIX = "mcp_telemetry_";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Gson gson;
    private final Path telemetryDir;
    private final String serverName;
    private final Map<String, ToolMetrics> toolMetrics;
    private final AtomicLong sessionRequestCount;
    private final String sessionId;
    private final long sessionStartTime;

    /**
     * Metrics tracked for each tool
     */
    private static class ToolMetrics {
        final AtomicLong invocationCount = new AtomicLong(0);
        final AtomicLong successCount = new AtomicLong(0);
        final AtomicLong failureCount = new AtomicLong(0);
        final AtomicLong totalDurationMs = new AtomicLong(0);
        final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
        final AtomicLong maxDurationMs = new AtomicLong(0);
        final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();
    }

    /**
     * Telemetry event structure
     */
    static class TelemetryEvent {
        final String timestamp = Instant.now().toString();
        final String sessionId;
        final String server;
        final String eventType;
        final String toolName;
        final Map<String, Object> arguments;
        final boolean success;
        final String errorType;
        final String errorMessage;
        final long durationMs;
        final Map<String, Object> metadata;

        TelemetryEvent(String sessionId, String server, String eventType, String toolName,
                       Map<String, Object> arguments, boolean success, String errorType, String errorMessage,
                       long durationMs, Map<String, Object> metadata) {
            this.sessionId = sessionId;
            this.server = server;
            this.eventType = eventType;
            this.toolName = toolName;
            this.arguments = arguments;
            this.success = success;
            this.errorType = errorType;
            this.errorMessage = errorMessage;
            this.durationMs = durationMs;
            this.metadata = metadata;
        }
    }

    public TelemetryLogger(String telemetryDirPath, String serverName) {
        this.gson = new GsonBuilder().create(); // no pretty printing for JSONL
        this.telemetryDir = Paths.get(telemetryDirPath);
        this.serverName = serverName;
        this.toolMetrics = new ConcurrentHashMap<>();
        this.sessionRequestCount = new AtomicLong(0);
        this.sessionStartTime = System.currentTimeMillis();
        this.sessionId = "session_" + sessionStartTime + "_" + UUID.randomUUID().toString().substring(0, 8);

        try {
            Files.createDirectories(telemetryDir);
            LOG.info("Telemetry directory created/verified at: {}", telemetryDir);
        } catch (IOException e) {
            LOG.error("Failed to create telemetry directory {}", telemetryDir, e);
        }
    }

    /**
     * Write the session start event. Call once after construction.
     */
    public void init() {
        logSessionEvent("SESSION_START", null);
    }

    /**
     * Log the start of a tool invocation
     *
     * @return start time to pass to the matching success or failure call
     */
    public long logToolStart(String toolName, Map<String, Object> arguments) {
        long startTime = System.currentTimeMillis();
        long requestNumber = sessionRequestCount.incrementAndGet();

        ToolMetrics metrics = toolMetrics.computeIfAbsent(toolName, k -> new ToolMetrics());
        long invocations = metrics.invocationCount.incrementAndGet();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionRequestNumber", requestNumber);
        metadata.put("totalInvocations", invocations);

        writeEvent(new TelemetryEvent(sessionId, serverName, "TOOL_START", toolName,
            arguments, true, null, null, 0, metadata));
        return startTime;
    }

    /**
     * Log successful tool completion
     */
    public void logToolSuccess(String toolName, long startTime, Object payload) {
        long duration = System.currentTimeMillis() - startTime;

        ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics != null) {
            metrics.successCount.incrementAndGet();
            record(metrics, duration);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", calculateSuccessRate(toolName));
        metadata.put("avgDurationMs", calculateAvgDuration(toolName));
        metadata.put("responseSize", estimateSize(payload));

        writeEvent(new TelemetryEvent(sessionId, serverName, "TOOL_SUCCESS", toolName,
            null, true, null, null, duration, metadata));
    }

    /**
     * Log tool failure
     */
    public void logToolFailure(String toolName, long startTime, String errorType, String errorMessage) {
        long duration = System.currentTimeMillis() - startTime;
        String errorKey = errorType != null ? errorType : "UNKNOWN_ERROR";

        ToolMetrics metrics = toolMetrics.get(toolName);
        long errorTypeCount = 0;
        if (metrics != null) {
            metrics.failureCount.incrementAndGet();
            record(metrics, duration);
            errorTypeCount = metrics.errorCounts.computeIfAbsent(errorKey, k -> new AtomicLong(0)).incrementAndGet();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", calculateSuccessRate(toolName));
        metadata.put("failureRate", calculateFailureRate(toolName));
        metadata.put("errorTypeCount", errorTypeCount);

        writeEvent(new TelemetryEvent(sessionId, serverName, "TOOL_FAILURE", toolName,
            null, false, errorKey, errorMessage, duration, metadata));
    }

    /**
     * Log session-level events
     */
    public void logSessionEvent(String eventType, Map<String, Object> metadata) {
        Map<String, Object> sessionMetadata = new LinkedHashMap<>();
        sessionMetadata.put("sessionDurationMs", System.currentTimeMillis() - sessionStartTime);
        sessionMetadata.put("totalRequests", sessionRequestCount.get());
        sessionMetadata.put("uniqueToolsUsed", toolMetrics.size());
        if (metadata != null) {
            sessionMetadata.putAll(metadata);
        }

        writeEvent(new TelemetryEvent(sessionId, serverName, eventType, null,
            null, true, null, null, 0, sessionMetadata));
    }

    /**
     * Snapshot of the session's per-tool counters.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("date", DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC)));
        summary.put("server", serverName);
        summary.put("sessionId", sessionId);
        summary.put("totalRequests", sessionRequestCount.get());
        summary.put("sessionDurationMs", System.currentTimeMillis() - sessionStartTime);

        Map<String, Object> toolSummaries = new LinkedHashMap<>();
        for (Map.Entry<String, ToolMetrics> entry : toolMetrics.entrySet()) {
            String toolName = entry.getKey();
            ToolMetrics metrics = entry.getValue();

            Map<String, Object> toolSummary = new LinkedHashMap<>();
            toolSummary.put("invocations", metrics.invocationCount.get());
            toolSummary.put("successes", metrics.successCount.get());
            toolSummary.put("failures", metrics.failureCount.get());
            toolSummary.put("successRate", calculateSuccessRate(toolName));
            toolSummary.put("avgDurationMs", calculateAvgDuration(toolName));
            toolSummary.put("minDurationMs",
                metrics.minDurationMs.get() == Long.MAX_VALUE ? 0 : metrics.minDurationMs.get());
            toolSummary.put("maxDurationMs", metrics.maxDurationMs.get());

            Map<String, Long> errorTypes = new LinkedHashMap<>();
            metrics.errorCounts.forEach((type, count) -> errorTypes.put(type, count.get()));
            toolSummary.put("errorTypes", errorTypes);

            toolSummaries.put(toolName, toolSummary);
        }
        summary.put("tools", toolSummaries);
        return summary;
    }

    /**
     * Append the pretty-printed session summary to the day's summary file.
     */
    public void writeSummary() {
        Path summaryFile = telemetryDir.resolve("summary_" + DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC)) + ".json");
        try (Writer writer = Files.newBufferedWriter(summaryFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            new GsonBuilder().setPrettyPrinting().create().toJson(summary(), writer);
            writer.write("\n");
            LOG.info("Telemetry summary written to: {}", summaryFile);
        } catch (IOException e) {
            LOG.error("Failed to write telemetry summary {}", summaryFile, e);
        }
    }

    /**
     * Shutdown telemetry and write the final reports
     */
    public void shutdown() {
        logSessionEvent("SESSION_END", null);
        writeSummary();
    }

    public long getInvocationCount(String toolName) {
        ToolMetrics metrics = toolMetrics.get(toolName);
        return metrics != null ? metrics.invocationCount.get() : 0;
    }

    public Path getTelemetryDir() {
        return telemetryDir;
    }

    public String getSessionId() {
        return sessionId;
    }

    // Helper methods

    private synchronized void writeEvent(TelemetryEvent event) {
        Path logFile = telemetryDir.resolve(LOG_FILE_PREFIX + DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC)) + ".jsonl");
        try {
            String jsonLine = gson.toJson(event) + "\n";
            Files.write(logFile, jsonLine.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to write telemetry event {} for {}", event.eventType, event.toolName, e);
        }
    }

    private void record(ToolMetrics metrics, long duration) {
        metrics.totalDurationMs.addAndGet(duration);
        metrics.minDurationMs.updateAndGet(min -> Math.min(min, duration));
        metrics.maxDurationMs.updateAndGet(max -> Math.max(max, duration));
    }

    private double calculateSuccessRate(String toolName) {
        ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics == null || metrics.invocationCount.get() == 0) {
            return 0.0;
        }
        return (double) metrics.successCount.get() / metrics.invocationCount.get();
    }

    private double calculateFailureRate(String toolName) {
        ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics == null || metrics.invocationCount.get() == 0) {
            return 0.0;
        }
        return (double) metrics.failureCount.get() / metrics.invocationCount.get();
    }

    private double calculateAvgDuration(String toolName) {
        ToolMetrics metrics = toolMetrics.get(toolName);
        long completed = metrics == null ? 0 : metrics.successCount.get() + metrics.failureCount.get();
        if (completed == 0) {
            return 0.0;
        }
        return (double) metrics.totalDurationMs.get() / completed;
    }

    private long estimateSize(Object payload) {
        if (payload == null) return 0;
        if (payload instanceof String string) {
            return string.length();
        }
        try {
            return gson.toJson(payload).length();
        } catch (RuntimeException e) {
            LOG.debug("Could not size telemetry payload", e);
            return -1;
        }
    }
}
