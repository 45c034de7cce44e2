package com.permit.resolution.bulk;

import java.util.List;

/**
 * Result of a mention import.
 *
 * @param totalRecords   data rows read
 * @param mentionsLoaded rows appended to the store
 * @param duplicates     rows whose mention id was already present
 * @param errors         rows that could not be turned into a mention
 */
public record ImportResult(
        long totalRecords,
        long mentionsLoaded,
        long duplicates,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that failed to import.
     *
     * @param lineNumber the line number in the input (1-based), 0 for stream-level failures
     * @param rawName    the name found on the row, if any
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String rawName, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", loaded=" + mentionsLoaded +
                ", duplicates=" + duplicates +
                ", errors=" + errors.size() + '}';
    }
}
