package com.gamecatalog.dumpimport.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DumpCsvReaderTest {

    private final DumpCsvReader reader = new DumpCsvReader();

    @Test
    void readsRecordsKeyedByHeaderIncludingBlankColumn() {
        String csv = "id,name,themes,\n"
                + "5001,Test Game,\"{1,2}\",\n"
                + "5002,\"Comma, Inc\",{},\n";

        List<Map<String, String>> records = reader.read(new StringReader(csv));

        assertThat(records).hasSize(2);
        assertThat(records.get(0)).containsEntry("id", "5001")
                .containsEntry("name", "Test Game")
                .containsEntry("themes", "{1,2}");
        assertThat(records.get(1)).containsEntry("name", "Comma, Inc");
    }

    @Test
    void emptyPayloadYieldsNoRecords() {
        assertThat(reader.read(new StringReader(""))).isEmpty();
    }

    @Test
    void readsStoredFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("genres.csv");
        Files.writeString(file, "id,name\n1,Point-and-click\n", StandardCharsets.UTF_8);

        assertThat(reader.read(file)).containsExactly(Map.of("id", "1", "name", "Point-and-click"));
    }

    @Test
    void missingFileIsReportedAsUncheckedIo(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.read(dir.resolve("missing.csv")))
                .isInstanceOf(UncheckedIOException.class);
    }
}
