package com.permit.resolution.tracing;

/**
 * One traced pipeline stage. Closing the span ends it, so stages are written as
 * try-with-resources blocks:
 *
 * <pre>
 * try (Span span = tracing.startStage("cascade")) {
 *     span.setAttribute("mentions", mentions.size());
 *     ...
 *     span.succeeded();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    /**
     * Marks the stage as completed normally.
     */
    void succeeded();

    /**
     * Marks the stage as failed and records the cause.
     */
    void failed(Throwable cause);

    @Override
    void close();
}
