package com.gamecatalog.dumpimport.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamecatalog.dumpimport.model.EntitySchema;
import com.gamecatalog.dumpimport.model.FilterRule;
import com.gamecatalog.dumpimport.model.ImportConfiguration;
import com.gamecatalog.dumpimport.model.SemanticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the immutable {@link ImportConfiguration} from the catalog schema file.
 *
 * The file declares, per entity, an ordered {@code fields} object (name to type token) and an optional
 * {@code filters} object (name to excluded integers). Declaration order becomes column order.
 */
@Configuration
public class ImportConfigurationLoader {

    private static final Logger logger = LoggerFactory.getLogger(ImportConfigurationLoader.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    @Bean
    public ImportConfiguration importConfiguration(ResourceLoader resourceLoader,
                                                   ObjectMapper objectMapper,
                                                   @Value("${app.import.schema-path:classpath:catalog-schema.json}") String schemaPath,
                                                   @Value("${app.import.entities:}") String enabledEntities,
                                                   @Value("${app.import.table-prefix:igdb_}") String tablePrefix,
                                                   @Value("${app.import.batch-size:5000}") int batchSize) {
        Resource resource = resourceLoader.getResource(schemaPath);
        if (!resource.exists()) {
            throw new IllegalStateException("Catalog schema not found at " + schemaPath);
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            ImportConfiguration configuration = parse(root, parseEntityList(enabledEntities), tablePrefix, batchSize);
            logger.info("Loaded catalog schema from {}: entities={}, filtered entities={}",
                    schemaPath, configuration.entities(), configuration.filters().keySet());
            return configuration;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read catalog schema " + schemaPath, e);
        }
    }

    static ImportConfiguration parse(JsonNode root, Set<String> enabledEntities, String tablePrefix, int batchSize) {
        JsonNode entitiesNode = root.path("entities");
        if (!entitiesNode.isObject() || entitiesNode.isEmpty()) {
            throw new IllegalStateException("Catalog schema declares no entities");
        }
        requireIdentifier(tablePrefix, "table prefix");

        Map<String, EntitySchema> schemas = new LinkedHashMap<>();
        Map<String, FilterRule> filters = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entities = entitiesNode.fields();
        while (entities.hasNext()) {
            Map.Entry<String, JsonNode> entry = entities.next();
            String entity = entry.getKey();
            if (!enabledEntities.isEmpty() && !enabledEntities.contains(entity)) {
                continue;
            }
            requireIdentifier(entity, "entity name");
            EntitySchema schema = parseSchema(entity, entry.getValue().path("fields"));
            schemas.put(entity, schema);

            JsonNode filtersNode = entry.getValue().path("filters");
            if (filtersNode.isObject() && !filtersNode.isEmpty()) {
                filters.put(entity, parseFilter(schema, filtersNode));
            }
        }

        Set<String> unknown = enabledEntities.stream()
                .filter(entity -> !schemas.containsKey(entity))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!unknown.isEmpty()) {
            throw new IllegalStateException("app.import.entities names entities missing from the schema: " + unknown);
        }
        return new ImportConfiguration(schemas, filters, tablePrefix, batchSize);
    }

    private static EntitySchema parseSchema(String entity, JsonNode fieldsNode) {
        if (!fieldsNode.isObject() || fieldsNode.isEmpty()) {
            throw new IllegalStateException("Entity " + entity + " declares no fields");
        }
        Map<String, String> fieldTypes = new LinkedHashMap<>();
        fieldsNode.fields().forEachRemaining(field -> {
            requireIdentifier(field.getKey(), "field name of " + entity);
            fieldTypes.put(field.getKey(), field.getValue().asText());
        });
        if (!fieldTypes.containsKey(EntitySchema.ID_COLUMN)) {
            throw new IllegalStateException("Entity " + entity + " must declare an id field");
        }
        return new EntitySchema(entity, fieldTypes);
    }

    private static FilterRule parseFilter(EntitySchema schema, JsonNode filtersNode) {
        Map<String, Set<Long>> excluded = new LinkedHashMap<>();
        filtersNode.fields().forEachRemaining(filter -> {
            String field = filter.getKey();
            if (!schema.hasColumn(field)) {
                throw new IllegalStateException("Filter on " + schema.entity() + "." + field + " references an undeclared field");
            }
            Optional<SemanticType> type = SemanticType.fromToken(schema.fieldTypes().get(field));
            if (type.isEmpty() || (type.get() != SemanticType.INTEGER && type.get() != SemanticType.INTEGER_ARRAY)) {
                throw new IllegalStateException("Filter on " + schema.entity() + "." + field
                        + " requires an int or int_array field, found '" + schema.fieldTypes().get(field) + "'");
            }
            if (!filter.getValue().isArray()) {
                throw new IllegalStateException("Filter on " + schema.entity() + "." + field + " must be an array of integers");
            }
            Set<Long> values = new LinkedHashSet<>();
            for (JsonNode value : filter.getValue()) {
                if (!value.canConvertToLong() || !value.isIntegralNumber()) {
                    throw new IllegalStateException("Filter on " + schema.entity() + "." + field + " has non-integer value " + value);
                }
                values.add(value.asLong());
            }
            excluded.put(field, values);
        });
        return new FilterRule(schema.entity(), excluded);
    }

    static Set<String> parseEntityList(String property) {
        if (property == null || property.isBlank()) {
            return Set.of();
        }
        List<String> names = Arrays.stream(property.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        return new LinkedHashSet<>(names);
    }

    private static void requireIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalStateException("Invalid " + what + ": '" + name + "'");
        }
    }
}
