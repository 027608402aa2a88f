package com.gamecatalog.dumpimport.service;

import com.gamecatalog.dumpimport.model.FilterRule;
import com.gamecatalog.dumpimport.model.ImportConfiguration;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates per-entity exclusion rules against parsed values.
 * Scalars and arrays are compared the same way: as a set of integers intersected with the excluded set.
 */
@Component
public class FilterEngine {

    private final ImportConfiguration configuration;

    public FilterEngine(ImportConfiguration configuration) {
        this.configuration = configuration;
    }

    public boolean isFiltered(String entity, String field, Object parsedValue) {
        return findMatch(entity, field, parsedValue).isPresent();
    }

    /**
     * First value of {@code parsedValue} that the entity's rule excludes for {@code field}.
     */
    public Optional<Long> findMatch(String entity, String field, Object parsedValue) {
        Optional<FilterRule> rule = configuration.filterFor(entity);
        if (rule.isEmpty() || !rule.get().covers(field)) {
            return Optional.empty();
        }
        Set<Long> excluded = rule.get().excludedFor(field);
        return toValueSet(parsedValue).stream()
                .filter(excluded::contains)
                .findFirst();
    }

    static Set<Long> toValueSet(Object parsedValue) {
        if (parsedValue == null) {
            return Collections.emptySet();
        }
        if (parsedValue instanceof Collection<?>) {
            Set<Long> values = new LinkedHashSet<>();
            for (Object element : (Collection<?>) parsedValue) {
                toLong(element).ifPresent(values::add);
            }
            return values;
        }
        return toLong(parsedValue).map(Set::of).orElse(Collections.emptySet());
    }

    // fractional values never equal an excluded integer
    private static Optional<Long> toLong(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d)) {
                return Optional.of((long) d);
            }
        }
        return Optional.empty();
    }
}
