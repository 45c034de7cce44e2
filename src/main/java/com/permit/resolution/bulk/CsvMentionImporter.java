package com.permit.resolution.bulk;

import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.store.InMemoryMentionStore;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CSV mention importer.
 *
 * <p>The first line is a header; columns are looked up by name through the source's
 * {@link SourceColumnMapping}. For a Building export:</p>
 * <pre>
 * first_name,last_name,firm_name,role,permit_number,block,lot,observed_at
 * Jane,Doe,Doe Architects LLC,Architect,P1,3512,001,2024-03-01T10:00:00Z
 * </pre>
 */
public class CsvMentionImporter implements MentionImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvMentionImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private final InMemoryMentionStore store;
    private final MentionRowMapper mapper;

    public CsvMentionImporter(InMemoryMentionStore store, SourceTag source) {
        this(store, SourceColumnMapping.forSource(source));
    }

    public CsvMentionImporter(InMemoryMentionStore store, SourceColumnMapping mapping) {
        this.store = store;
        this.mapper = new MentionRowMapper(mapping);
    }

    @Override
    public ImportResult importMentions(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();

        long totalRecords = 0;
        long loaded = 0;
        long duplicates = 0;

        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord row : parser) {
                totalRecords++;
                // Header is row 1; empty lines are not counted.
                long lineNumber = totalRecords + 1;
                try {
                    Mention mention = mapper.toMention(column -> value(row, column));
                    if (store.append(mention)) {
                        loaded++;
                    } else {
                        duplicates++;
                    }
                } catch (RuntimeException e) {
                    String name = mapper.name(column -> value(row, column));
                    errors.add(new ImportResult.ImportError(lineNumber, name, e.getMessage()));
                    log.warn("import.error line={} name='{}' error={}", lineNumber, name, e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " rows");
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "Read error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRecords, loaded, duplicates, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed format=csv result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static Optional<String> value(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return Optional.empty();
        }
        return Optional.ofNullable(record.get(column));
    }
}
