package com.filestorm.ingest.stream;

import java.util.Collections;
import java.util.Map;

/**
 * One entry read or claimed from the upload stream.
 * <p>
 * A claimed entry that was deleted from the stream while still pending has no fields.
 */
public class StreamEntry {
    private final String id;
    private final Map<String, String> fields;

    public StreamEntry(String id, Map<String, String> fields) {
        this.id = id;
        this.fields = fields != null ? Collections.unmodifiableMap(fields) : null;
    }

    public String getId() {
        return id;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public boolean isDeleted() {
        return fields == null;
    }
}
