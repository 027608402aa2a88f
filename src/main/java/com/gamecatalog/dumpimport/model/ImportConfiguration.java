package com.gamecatalog.dumpimport.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable import settings built once at startup: entity schemas in declaration order,
 * per-entity exclusion filters, and the target table naming and batching used by the writer.
 */
public record ImportConfiguration(Map<String, EntitySchema> schemas,
                                  Map<String, FilterRule> filters,
                                  String tablePrefix,
                                  int batchSize) {

    public ImportConfiguration {
        schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
    }

    public List<String> entities() {
        return List.copyOf(schemas.keySet());
    }

    public Optional<EntitySchema> schemaFor(String entity) {
        return Optional.ofNullable(schemas.get(entity));
    }

    public Optional<FilterRule> filterFor(String entity) {
        return Optional.ofNullable(filters.get(entity));
    }

    public String tableName(String entity) {
        return tablePrefix + entity;
    }
}
