package com.permit.resolution.tracing;

import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 * Run attributes are set on the builder so samplers can see them.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startRun(String runId, String mode) {
        return new StageSpan(tracer.spanBuilder(RUN_SPAN)
                .setAttribute("runId", runId)
                .setAttribute("mode", mode)
                .startSpan());
    }

    @Override
    public Span startStage(String stage) {
        return new StageSpan(tracer.spanBuilder(TracingService.stageSpanName(stage)).startSpan());
    }

    private static final class StageSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        StageSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void succeeded() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void failed(Throwable cause) {
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, cause.getClass().getSimpleName());
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
