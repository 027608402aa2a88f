package com.gamecatalog.dumpimport.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accepted record: the dump identity plus typed values in schema order ({@code null} for absent).
 */
public record ParsedRecord(String id, Map<String, Object> values) {

    public ParsedRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String field) {
        return values.get(field);
    }
}
