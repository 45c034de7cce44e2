package com.permit.resolution.anomaly;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes anomaly reports as JSON for the validation surface.
 */
public class AnomalyReportWriter {

    private final ObjectMapper mapper;

    public AnomalyReportWriter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public AnomalyReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(AnomalyReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize anomaly report", e);
        }
    }

    public void write(AnomalyReport report, Writer out) {
        try {
            mapper.writeValue(out, report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write anomaly report", e);
        }
    }
}
