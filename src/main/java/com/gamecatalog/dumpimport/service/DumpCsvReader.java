package com.gamecatalog.dumpimport.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited dump into raw records keyed by header name.
 * Extra and blank-named columns are kept; the validator only consumes declared fields.
 */
@Service
public class DumpCsvReader {

    private static final Logger logger = LoggerFactory.getLogger(DumpCsvReader.class);

    private static final CSVFormat DUMP_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .build();

    public List<Map<String, String>> read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dump file " + path, e);
        }
    }

    public List<Map<String, String>> read(Reader reader) {
        try (CSVParser parser = DUMP_FORMAT.parse(reader)) {
            List<String> headerNames = parser.getHeaderNames();
            if (headerNames.isEmpty()) {
                logger.warn("Dump has no header row; no records read");
                return List.of();
            }
            List<Map<String, String>> records = new ArrayList<>();
            for (CSVRecord csvRecord : parser) {
                records.add(csvRecord.toMap());
            }
            logger.debug("Read {} records with columns {}", records.size(), headerNames);
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse dump payload", e);
        }
    }
}
