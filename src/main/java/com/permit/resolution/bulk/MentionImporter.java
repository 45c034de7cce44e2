package com.permit.resolution.bulk;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Reads one source's mention export into a mention store.
 * Rows that cannot become a mention are reported, not thrown.
 */
public interface MentionImporter {

    /**
     * Imports mentions from a reader.
     *
     * @param reader   the reader to read from
     * @param callback optional progress callback
     * @return the import result
     */
    ImportResult importMentions(Reader reader, ProgressCallback callback);

    /**
     * Imports UTF-8 encoded mentions from an input stream.
     */
    default ImportResult importMentions(InputStream input, ProgressCallback callback) {
        return importMentions(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * Returns the format supported by this importer (e.g., "csv", "jsonl").
     */
    String getFormat();
}
