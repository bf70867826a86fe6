package com.cloudferry.orchestrator.service;

import java.time.temporal.Temporal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Builds timeline metadata maps. Unlike Map.of, keeps insertion order and
 * allows null values. Enums, UUIDs and timestamps are stored as strings.
 */
final class Metadata {

    private Metadata() {}

    static Map<String, Object> of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Metadata needs key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], plain(keysAndValues[i + 1]));
        }
        return map;
    }

    private static Object plain(Object value) {
        if (value instanceof Enum<?> || value instanceof UUID || value instanceof Temporal) {
            return value.toString();
        }
        return value;
    }
}
