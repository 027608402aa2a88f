package com.gamecatalog.dumpimport.service;

import com.gamecatalog.dumpimport.model.EntitySchema;
import com.gamecatalog.dumpimport.model.ImportConfiguration;
import com.gamecatalog.dumpimport.model.ParsedRecord;
import com.gamecatalog.dumpimport.model.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Merges accepted records into {@code <prefix><entity>} keyed by {@code id}.
 *
 * Conflicting rows are overwritten only when the incoming {@code updated_at} is strictly newer than the
 * stored one; entities without {@code updated_at} always overwrite. Replaying the same records is a no-op.
 */
@Service
public class UpsertWriter {

    private static final Logger logger = LoggerFactory.getLogger(UpsertWriter.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final ImportConfiguration configuration;

    public UpsertWriter(JdbcTemplate jdbcTemplate, ImportConfiguration configuration) {
        this.jdbcTemplate = jdbcTemplate;
        this.configuration = configuration;
    }

    /**
     * Upserts using the entity's declared columns, committing when the call returns.
     */
    @Transactional
    public UpsertResult upsert(String entity, List<ParsedRecord> records) {
        EntitySchema schema = configuration.schemaFor(entity)
                .orElseThrow(() -> new IllegalArgumentException("No schema declared for entity: " + entity));
        if (records == null || records.isEmpty()) {
            logger.info("No accepted rows to upsert for {}", entity);
            return UpsertResult.empty(entity);
        }
        List<String> columns = schema.columns();
        List<ParsedRecord> rows = deduplicate(records, schema.hasUpdatedAt());
        int duplicates = records.size() - rows.size();
        if (duplicates > 0) {
            logger.info("Dropped {} superseded duplicate id(s) from {} before upsert", duplicates, entity);
        }

        String sql = buildUpsertSql(configuration.tableName(entity), columns);
        logger.debug("Upsert statement for {}: {}", entity, sql);

        int[][] counts = jdbcTemplate.batchUpdate(sql, rows, configuration.batchSize(),
                (ps, row) -> bindRow(ps, row, columns));

        int affected = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                if (count > 0) {
                    affected += count;
                }
            }
        }
        logger.info("Upserted {} rows into {} in {} batch(es); {} row(s) inserted or updated",
                rows.size(), configuration.tableName(entity), counts.length, affected);
        return new UpsertResult(entity, rows.size(), duplicates, affected);
    }

    /**
     * Collapses records sharing an id to the one that would survive applying them one after another
     * under the conflict rule: with the gate, a later record replaces an earlier one only when its
     * {@code updated_at} is strictly newer; without it, the last record wins.
     */
    List<ParsedRecord> deduplicate(List<ParsedRecord> records, boolean gated) {
        Map<String, ParsedRecord> byId = new LinkedHashMap<>();
        for (ParsedRecord record : records) {
            String key = identityKey(record);
            ParsedRecord existing = byId.get(key);
            if (existing == null || !gated || isNewer(record, existing)) {
                byId.put(key, record);
            }
        }
        return new ArrayList<>(byId.values());
    }

    String buildUpsertSql(String table, List<String> columns) {
        requireIdentifier(table);
        columns.forEach(this::requireIdentifier);
        if (!columns.contains(EntitySchema.ID_COLUMN)) {
            throw new IllegalArgumentException("Column list for " + table + " must contain " + EntitySchema.ID_COLUMN);
        }

        String columnList = String.join(", ", columns);
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String updates = columns.stream()
                .filter(c -> !EntitySchema.ID_COLUMN.equals(c))
                .map(c -> c + " = EXCLUDED." + c)
                .collect(Collectors.joining(", "));

        StringBuilder sql = new StringBuilder()
                .append("INSERT INTO ").append(table).append(" (").append(columnList).append(")")
                .append(" VALUES (").append(placeholders).append(")")
                .append(" ON CONFLICT (").append(EntitySchema.ID_COLUMN).append(")");
        if (updates.isEmpty()) {
            return sql.append(" DO NOTHING").toString();
        }
        sql.append(" DO UPDATE SET ").append(updates);
        if (columns.contains(EntitySchema.UPDATED_AT_COLUMN)) {
            sql.append(" WHERE ").append(table).append('.').append(EntitySchema.UPDATED_AT_COLUMN)
                    .append(" < EXCLUDED.").append(EntitySchema.UPDATED_AT_COLUMN);
        }
        return sql.toString();
    }

    private void bindRow(PreparedStatement ps, ParsedRecord row, List<String> columns) throws SQLException {
        for (int i = 0; i < columns.size(); i++) {
            Object value = row.get(columns.get(i));
            int index = i + 1;
            if (value == null || (value instanceof String && ((String) value).isEmpty())) {
                ps.setObject(index, null);
            } else if (value instanceof Collection<?>) {
                Array array = ps.getConnection().createArrayOf("bigint", ((Collection<?>) value).toArray());
                ps.setArray(index, array);
            } else {
                ps.setObject(index, value);
            }
        }
    }

    private String identityKey(ParsedRecord record) {
        Object id = record.get(EntitySchema.ID_COLUMN);
        return id != null ? id.toString() : record.id();
    }

    private boolean isNewer(ParsedRecord incoming, ParsedRecord existing) {
        Object incomingTs = incoming.get(EntitySchema.UPDATED_AT_COLUMN);
        Object existingTs = existing.get(EntitySchema.UPDATED_AT_COLUMN);
        // NULL on either side never compares greater
        if (incomingTs instanceof LocalDateTime && existingTs instanceof LocalDateTime) {
            return ((LocalDateTime) incomingTs).isAfter((LocalDateTime) existingTs);
        }
        return false;
    }

    private void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
    }
}
