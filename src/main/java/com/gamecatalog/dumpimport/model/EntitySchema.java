package com.gamecatalog.dumpimport.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered field declaration of one catalog entity.
 * Type tokens are kept verbatim so that an unregistered token can be reported rather than dropped.
 */
public record EntitySchema(String entity, Map<String, String> fieldTypes) {

    public static final String ID_COLUMN = "id";
    public static final String UPDATED_AT_COLUMN = "updated_at";

    public EntitySchema {
        fieldTypes = Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
    }

    public List<String> columns() {
        return List.copyOf(fieldTypes.keySet());
    }

    public boolean hasColumn(String field) {
        return fieldTypes.containsKey(field);
    }

    public boolean hasUpdatedAt() {
        return hasColumn(UPDATED_AT_COLUMN);
    }
}
