package com.gamecatalog.dumpimport.service;

import com.gamecatalog.dumpimport.model.EntitySchema;
import com.gamecatalog.dumpimport.model.ImportConfiguration;
import com.gamecatalog.dumpimport.model.SemanticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the semantic type of every declared field once, at construction.
 */
@Component
public class TypeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TypeRegistry.class);

    private final Map<String, Map<String, SemanticType>> typesByEntity;

    public TypeRegistry(ImportConfiguration configuration) {
        Map<String, Map<String, SemanticType>> resolved = new HashMap<>();
        for (EntitySchema schema : configuration.schemas().values()) {
            Map<String, SemanticType> fieldTypes = new HashMap<>();
            schema.fieldTypes().forEach((field, token) -> {
                Optional<SemanticType> type = SemanticType.fromToken(token);
                if (type.isPresent()) {
                    fieldTypes.put(field, type.get());
                } else {
                    logger.warn("Field '{}' of entity '{}' declares type '{}' which has no parser; values will pass through unparsed.",
                            field, schema.entity(), token);
                }
            });
            resolved.put(schema.entity(), Collections.unmodifiableMap(fieldTypes));
        }
        this.typesByEntity = Collections.unmodifiableMap(resolved);
    }

    /**
     * Semantic type of {@code field}; empty for an undeclared field or an unregistered type token.
     */
    public Optional<SemanticType> typeOf(String entity, String field) {
        Map<String, SemanticType> fieldTypes = typesByEntity.get(entity);
        if (fieldTypes == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(fieldTypes.get(field));
    }
}
