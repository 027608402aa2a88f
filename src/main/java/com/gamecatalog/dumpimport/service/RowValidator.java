package com.gamecatalog.dumpimport.service;

import com.gamecatalog.dumpimport.model.EntitySchema;
import com.gamecatalog.dumpimport.model.FieldParseResult;
import com.gamecatalog.dumpimport.model.ImportConfiguration;
import com.gamecatalog.dumpimport.model.ParsedRecord;
import com.gamecatalog.dumpimport.model.RejectedRecord;
import com.gamecatalog.dumpimport.model.RejectionReason;
import com.gamecatalog.dumpimport.model.SemanticType;
import com.gamecatalog.dumpimport.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses and filters the raw records of one entity dump and partitions them into accepted and rejected.
 *
 * Each record is evaluated field by field in schema order; the first parse failure or filter match
 * rejects it without looking at the remaining fields. Records with no usable {@code id} are skipped
 * and counted in neither partition.
 */
@Service
public class RowValidator {

    private static final Logger logger = LoggerFactory.getLogger(RowValidator.class);

    private final ImportConfiguration configuration;
    private final TypeRegistry typeRegistry;
    private final FilterEngine filterEngine;

    public RowValidator(ImportConfiguration configuration, TypeRegistry typeRegistry, FilterEngine filterEngine) {
        this.configuration = configuration;
        this.typeRegistry = typeRegistry;
        this.filterEngine = filterEngine;
    }

    public ValidationOutcome validate(String entity, List<Map<String, String>> rawRecords) {
        EntitySchema schema = configuration.schemaFor(entity)
                .orElseThrow(() -> new IllegalArgumentException("No schema declared for entity: " + entity));

        List<ParsedRecord> valid = new ArrayList<>();
        List<RejectedRecord> invalid = new ArrayList<>();
        int skipped = 0;
        int position = 0;
        int total = rawRecords.size();

        for (Map<String, String> raw : rawRecords) {
            position++;
            String id = raw.get(EntitySchema.ID_COLUMN);
            if (FieldParsers.isSentinel(id)) {
                skipped++;
                continue;
            }
            logger.debug("Validating {} row id {} ({} of {})", entity, id, position, total);

            Map<String, Object> values = new LinkedHashMap<>();
            RejectedRecord rejection = null;
            for (String field : schema.columns()) {
                String rawValue = raw.get(field);
                Optional<SemanticType> type = typeRegistry.typeOf(entity, field);
                if (type.isEmpty()) {
                    logger.debug("No parser for field '{}' of {}; passing raw value through for id {}", field, entity, id);
                    values.put(field, FieldParsers.isSentinel(rawValue) ? null : rawValue);
                    continue;
                }

                FieldParseResult result = FieldParsers.parse(type.get(), rawValue);
                if (result.isFailure()) {
                    logger.info("Found bad data at id: {}, entity: {}, column: {}, data type: {}",
                            id, entity, field, type.get().token());
                    rejection = new RejectedRecord(id, RejectionReason.PARSE_ERROR, field, type.get().token());
                    break;
                }

                Optional<Long> match = filterEngine.findMatch(entity, field, result.value());
                if (match.isPresent()) {
                    logger.info("Filtered out row id: {}, entity: {}, column: {} contains excluded value {}",
                            id, entity, field, match.get());
                    rejection = new RejectedRecord(id, RejectionReason.FILTER_MATCH, field, String.valueOf(match.get()));
                    break;
                }
                values.put(field, result.value());
            }

            if (rejection != null) {
                invalid.add(rejection);
            } else {
                valid.add(new ParsedRecord(id, values));
            }
        }

        logger.info("Validated {}: valid rows={}, invalid rows={}, skipped without id={}",
                entity, valid.size(), invalid.size(), skipped);
        return new ValidationOutcome(entity, valid, invalid, skipped);
    }
}
