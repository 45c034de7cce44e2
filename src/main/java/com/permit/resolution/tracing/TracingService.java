package com.permit.resolution.tracing;

/**
 * Spans for resolution runs and their stages. The default {@link NoOpTracingService}
 * keeps the library usable without a tracing backend.
 */
public interface TracingService {

    String RUN_SPAN = "permit.resolution.run";

    /**
     * Root span of one run, tagged with {@code runId} and {@code mode}.
     */
    Span startRun(String runId, String mode);

    /**
     * Span of one pipeline stage, e.g. {@code cascade} or {@code commit}.
     */
    Span startStage(String stage);

    static String stageSpanName(String stage) {
        return "permit.resolution." + stage;
    }
}
