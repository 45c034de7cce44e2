package com.permit.resolution.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.permit.resolution.core.model.Mention;
import com.permit.resolution.core.model.SourceTag;
import com.permit.resolution.store.InMemoryMentionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON Lines (JSONL) mention importer.
 *
 * <p>Expected format: one JSON object per line, keyed like the source's CSV columns.</p>
 * <pre>
 * {"name": "J. Doe", "role": "Applicant", "record_id": "P1", "observed_at": "2024-04-02"}
 * {"name": "Acme Consulting", "role": "Consultant", "record_id": "P1", "observed_at": "2024-04-02"}
 * </pre>
 */
public class JsonMentionImporter implements MentionImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonMentionImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final InMemoryMentionStore store;
    private final MentionRowMapper mapper;
    private final ObjectMapper objectMapper;

    public JsonMentionImporter(InMemoryMentionStore store, SourceTag source) {
        this(store, SourceColumnMapping.forSource(source), new ObjectMapper());
    }

    public JsonMentionImporter(InMemoryMentionStore store, SourceColumnMapping mapping, ObjectMapper objectMapper) {
        this.store = store;
        this.mapper = new MentionRowMapper(mapping);
        this.objectMapper = objectMapper;
    }

    @Override
    public ImportResult importMentions(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();

        long totalRecords = 0;
        long loaded = 0;
        long duplicates = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                totalRecords++;

                JsonNode node;
                try {
                    node = objectMapper.readTree(line);
                } catch (JsonProcessingException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, "", "Invalid JSON: " + e.getOriginalMessage()));
                    log.warn("import.error line={} error={}", lineNumber, e.getOriginalMessage());
                    continue;
                }
                if (!node.isObject()) {
                    errors.add(new ImportResult.ImportError(lineNumber, "", "Expected a JSON object"));
                    continue;
                }
                JsonNode row = node;

                try {
                    Mention mention = mapper.toMention(field -> value(row, field));
                    if (store.append(mention)) {
                        loaded++;
                    } else {
                        duplicates++;
                    }
                } catch (RuntimeException e) {
                    String name = mapper.name(field -> value(row, field));
                    errors.add(new ImportResult.ImportError(lineNumber, name, e.getMessage()));
                    log.warn("import.error line={} name='{}' error={}", lineNumber, name, e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRecords, loaded, duplicates, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed format=jsonl result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "jsonl";
    }

    private static Optional<String> value(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
