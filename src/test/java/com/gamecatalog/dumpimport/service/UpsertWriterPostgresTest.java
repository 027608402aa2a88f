package com.gamecatalog.dumpimport.service;

import com.gamecatalog.dumpimport.model.EntitySchema;
import com.gamecatalog.dumpimport.model.ImportConfiguration;
import com.gamecatalog.dumpimport.model.ParsedRecord;
import com.gamecatalog.dumpimport.model.UpsertResult;
import com.gamecatalog.dumpimport.model.ValidationOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Array;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the generated upsert statements against a real PostgreSQL instance.
 */
@Testcontainers(disabledWithoutDocker = true)
class UpsertWriterPostgresTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private JdbcTemplate jdbcTemplate;

    private ImportConfiguration configuration;

    private UpsertWriter upsertWriter;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("DROP TABLE IF EXISTS igdb_games");
        jdbcTemplate.execute("DROP TABLE IF EXISTS igdb_covers");
        jdbcTemplate.execute("CREATE TABLE igdb_games (id bigint PRIMARY KEY, name text, themes bigint[], updated_at timestamp)");
        jdbcTemplate.execute("CREATE TABLE igdb_covers (id bigint PRIMARY KEY, url text)");

        Map<String, String> gameFields = new LinkedHashMap<>();
        gameFields.put("id", "int");
        gameFields.put("name", "text");
        gameFields.put("themes", "int_array");
        gameFields.put("updated_at", "timestamp");
        Map<String, String> coverFields = new LinkedHashMap<>();
        coverFields.put("id", "int");
        coverFields.put("url", "text");

        configuration = new ImportConfiguration(
                Map.of("games", new EntitySchema("games", gameFields),
                        "covers", new EntitySchema("covers", coverFields)),
                Map.of(), "igdb_", 2);
        upsertWriter = new UpsertWriter(jdbcTemplate, configuration);
    }

    @Test
    void insertsNewRowWithArrayColumn() throws Exception {
        upsertWriter.upsert("games", List.of(game(5001L, "Test Game", List.of(1L, 2L), LocalDateTime.of(2020, 1, 1, 0, 0))));

        Map<String, Object> row = jdbcTemplate.queryForMap("SELECT * FROM igdb_games WHERE id = 5001");
        assertThat(row.get("name")).isEqualTo("Test Game");
        assertThat((Object[]) ((Array) row.get("themes")).getArray()).containsExactly(1L, 2L);
    }

    @Test
    void validatedDumpRowIsStoredWithItsParsedValues() throws Exception {
        RowValidator rowValidator = new RowValidator(configuration, new TypeRegistry(configuration),
                new FilterEngine(configuration));
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("id", "5001");
        raw.put("name", "Test Game");
        raw.put("themes", "{1,2}");
        raw.put("updated_at", "2020-01-01T00:00:00Z");

        ValidationOutcome outcome = rowValidator.validate("games", List.of(raw));
        upsertWriter.upsert("games", outcome.valid());

        Map<String, Object> row = jdbcTemplate.queryForMap("SELECT * FROM igdb_games WHERE id = 5001");
        assertThat(row.get("id")).isEqualTo(5001L);
        assertThat(row.get("name")).isEqualTo("Test Game");
        assertThat((Object[]) ((Array) row.get("themes")).getArray()).containsExactly(1L, 2L);
        assertThat(((Timestamp) row.get("updated_at")).toLocalDateTime()).isEqualTo(LocalDateTime.of(2020, 1, 1, 0, 0));
    }

    @Test
    void duplicateIdsAcrossBatchesEndLikeSequentialRuns() {
        List<ParsedRecord> records = List.of(
                game(1L, "first", List.of(), LocalDateTime.of(2020, 1, 1, 0, 0)),
                game(2L, "other", List.of(), LocalDateTime.of(2020, 1, 1, 0, 0)),
                game(1L, "tie", List.of(), LocalDateTime.of(2020, 1, 1, 0, 0)),
                game(3L, "dated", List.of(), LocalDateTime.of(2020, 1, 1, 0, 0)),
                game(1L, "older", List.of(), LocalDateTime.of(2019, 1, 1, 0, 0)),
                game(3L, "undated", List.of(), null));

        upsertWriter.upsert("games", records);
        Map<Long, String> singleRun = namesById();

        jdbcTemplate.execute("TRUNCATE igdb_games");
        for (ParsedRecord record : records) {
            upsertWriter.upsert("games", List.of(record));
        }

        assertThat(singleRun).containsEntry(1L, "first").containsEntry(3L, "dated");
        assertThat(namesById()).isEqualTo(singleRun);
    }

    @Test
    void replayingSameRecordsIsIdempotent() {
        List<ParsedRecord> records = List.of(
                game(1L, "a", List.of(), LocalDateTime.of(2020, 1, 1, 0, 0)),
                game(2L, "b", List.of(), LocalDateTime.of(2020, 1, 1, 0, 0)),
                game(3L, "c", List.of(), LocalDateTime.of(2020, 1, 1, 0, 0)));

        upsertWriter.upsert("games", records);
        UpsertResult replay = upsertWriter.upsert("games", records);

        assertThat(replay.affectedRows()).isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM igdb_games", Integer.class)).isEqualTo(3);
    }

    @Test
    void olderUpdatesNeverOverwriteNewerRows() {
        upsertWriter.upsert("games", List.of(game(7L, "2020", List.of(), LocalDateTime.of(2020, 1, 1, 0, 0))));

        upsertWriter.upsert("games", List.of(game(7L, "2019", List.of(), LocalDateTime.of(2019, 1, 1, 0, 0))));
        assertThat(nameOf(7L)).isEqualTo("2020");

        upsertWriter.upsert("games", List.of(game(7L, "2021", List.of(), LocalDateTime.of(2021, 1, 1, 0, 0))));
        assertThat(nameOf(7L)).isEqualTo("2021");
    }

    @Test
    void entitiesWithoutUpdatedAtAlwaysOverwrite() {
        upsertWriter.upsert("covers", List.of(cover(9L, "a.jpg")));
        upsertWriter.upsert("covers", List.of(cover(9L, "b.jpg")));

        assertThat(jdbcTemplate.queryForObject("SELECT url FROM igdb_covers WHERE id = 9", String.class))
                .isEqualTo("b.jpg");
    }

    private Map<Long, String> namesById() {
        Map<Long, String> names = new LinkedHashMap<>();
        jdbcTemplate.query("SELECT id, name FROM igdb_games ORDER BY id",
                rs -> {
                    names.put(rs.getLong("id"), rs.getString("name"));
                });
        return names;
    }

    private String nameOf(long id) {
        return jdbcTemplate.queryForObject("SELECT name FROM igdb_games WHERE id = ?", String.class, id);
    }

    private ParsedRecord game(Long id, String name, List<Long> themes, LocalDateTime updatedAt) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", id);
        values.put("name", name);
        values.put("themes", themes);
        values.put("updated_at", updatedAt);
        return new ParsedRecord(String.valueOf(id), values);
    }

    private ParsedRecord cover(Long id, String url) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", id);
        values.put("url", url);
        return new ParsedRecord(String.valueOf(id), values);
    }
}
