package com.gamecatalog.dumpimport.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Excluded integer values per field for one entity.
 */
public record FilterRule(String entity, Map<String, Set<Long>> excludedValues) {

    public FilterRule {
        Map<String, Set<Long>> copy = new LinkedHashMap<>();
        excludedValues.forEach((field, values) -> copy.put(field, Set.copyOf(values)));
        excludedValues = Collections.unmodifiableMap(copy);
    }

    public boolean covers(String field) {
        return excludedValues.containsKey(field);
    }

    public Set<Long> excludedFor(String field) {
        return excludedValues.getOrDefault(field, Set.of());
    }
}
