package com.topostat.core.ingest;

import com.topostat.core.error.ErrorKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of ingesting one envelope.
 *
 * @param envelope  envelope timestamp used as its identifier in logs, {@code null} if unparseable
 * @param rejection why the whole envelope was discarded, {@code null} when it was processed
 * @param message   human readable rejection detail
 * @param received  records contained in the payload
 * @param stored    records committed as facts
 * @param invalid   discarded records per error kind
 */
public record IngestReport(
        String envelope,
        ErrorKind rejection,
        String message,
        int received,
        int stored,
        Map<ErrorKind, Integer> invalid
) {

    public IngestReport {
        Map<ErrorKind, Integer> copy = new EnumMap<>(ErrorKind.class);
        copy.putAll(invalid);
        invalid = Collections.unmodifiableMap(copy);
    }

    public static IngestReport rejected(String envelope, ErrorKind rejection, String message) {
        return new IngestReport(envelope, rejection, message, 0, 0, Map.of());
    }

    public boolean accepted() {
        return rejection == null;
    }

    public int invalidCount() {
        return invalid.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int invalidCount(ErrorKind kind) {
        return invalid.getOrDefault(kind, 0);
    }
}
