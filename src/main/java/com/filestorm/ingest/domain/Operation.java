package com.filestorm.ingest.domain;

import java.util.Locale;

/**
 * File operation carried by an upload event.
 */
public enum Operation {

    UPLOAD;

    /**
     * Resolves an operation name from the wire, case-insensitively.
     *
     * @param raw operation name, may be null or blank
     * @return the operation, {@link #UPLOAD} when absent
     * @throws MalformedEventException if the name is not a known operation
     */
    public static Operation fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return UPLOAD;
        }
        try {
            return Operation.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("Unknown operation: " + raw);
        }
    }
}
