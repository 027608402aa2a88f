package com.gamecatalog.dumpimport.service;

import com.gamecatalog.dumpimport.client.AccessTokenProvider;
import com.gamecatalog.dumpimport.client.DumpRetrievalClient;
import com.gamecatalog.dumpimport.client.DumpRetrievalException;
import com.gamecatalog.dumpimport.model.EntityImportSummary;
import com.gamecatalog.dumpimport.model.ImportConfiguration;
import com.gamecatalog.dumpimport.model.ImportStatus;
import com.gamecatalog.dumpimport.model.UpsertResult;
import com.gamecatalog.dumpimport.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an import: for each entity in turn, refresh the stored dump, validate it, then upsert it.
 *
 * Each entity commits on its own. A store failure aborts the remaining entities while earlier
 * commits stand; retrieval failures only mean the last stored dump is used.
 */
@Service
public class DumpImportService {

    private static final Logger logger = LoggerFactory.getLogger(DumpImportService.class);

    private final ImportConfiguration configuration;
    private final AccessTokenProvider accessTokenProvider;
    private final DumpRetrievalClient dumpRetrievalClient;
    private final DumpFileStore dumpFileStore;
    private final DumpCsvReader dumpCsvReader;
    private final RowValidator rowValidator;
    private final UpsertWriter upsertWriter;
    private final boolean downloadEnabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DumpImportService(ImportConfiguration configuration,
                             AccessTokenProvider accessTokenProvider,
                             DumpRetrievalClient dumpRetrievalClient,
                             DumpFileStore dumpFileStore,
                             DumpCsvReader dumpCsvReader,
                             RowValidator rowValidator,
                             UpsertWriter upsertWriter,
                             @Value("${app.import.download-enabled:true}") boolean downloadEnabled) {
        this.configuration = configuration;
        this.accessTokenProvider = accessTokenProvider;
        this.dumpRetrievalClient = dumpRetrievalClient;
        this.dumpFileStore = dumpFileStore;
        this.dumpCsvReader = dumpCsvReader;
        this.rowValidator = rowValidator;
        this.upsertWriter = upsertWriter;
        this.downloadEnabled = downloadEnabled;
    }

    public List<EntityImportSummary> importAll() {
        return importEntities(configuration.entities());
    }

    /**
     * Imports the given entities in order.
     *
     * @throws IllegalArgumentException      if an entity has no schema
     * @throws ImportAlreadyRunningException if another import is already running
     * @throws StoreFailureException         if an upsert fails; remaining entities are not attempted
     */
    public List<EntityImportSummary> importEntities(List<String> entities) {
        for (String entity : entities) {
            if (configuration.schemaFor(entity).isEmpty()) {
                throw new IllegalArgumentException("Unknown entity: " + entity);
            }
        }
        if (!running.compareAndSet(false, true)) {
            throw new ImportAlreadyRunningException();
        }
        try {
            logger.info("Starting dump import for entities {}", entities);
            String accessToken = downloadEnabled ? obtainAccessToken() : null;
            List<EntityImportSummary> summaries = new ArrayList<>();
            for (String entity : entities) {
                summaries.add(importEntity(entity, accessToken, summaries));
            }
            logger.info("Dump import finished: {}", summaries);
            return summaries;
        } finally {
            running.set(false);
        }
    }

    private EntityImportSummary importEntity(String entity, String accessToken, List<EntityImportSummary> completed) {
        if (accessToken != null) {
            refreshDump(entity, accessToken);
        }

        Optional<Path> payload = dumpFileStore.find(entity);
        if (payload.isEmpty()) {
            logger.warn("No stored dump available for {}; skipping entity", entity);
            return EntityImportSummary.withoutPayload(entity, ImportStatus.MISSING_PAYLOAD);
        }

        List<Map<String, String>> rawRecords;
        try {
            rawRecords = dumpCsvReader.read(payload.get());
        } catch (UncheckedIOException e) {
            logger.error("Stored dump for {} at {} could not be read; skipping entity", entity, payload.get(), e);
            return EntityImportSummary.withoutPayload(entity, ImportStatus.UNREADABLE_PAYLOAD);
        }
        logger.info("Loaded {} rows of {} from {}", rawRecords.size(), entity, payload.get());

        ValidationOutcome outcome = rowValidator.validate(entity, rawRecords);

        UpsertResult upsert;
        try {
            upsert = upsertWriter.upsert(entity, outcome.valid());
        } catch (DataAccessException e) {
            logger.error("Upsert failed for {}; aborting remaining entities. Committed so far: {}", entity, completed, e);
            throw new StoreFailureException(entity, completed, e);
        }
        return EntityImportSummary.of(outcome, upsert);
    }

    private String obtainAccessToken() {
        try {
            return accessTokenProvider.fetchAccessToken();
        } catch (DumpRetrievalException e) {
            logger.error("Could not obtain access token; importing previously stored dumps only", e);
            return null;
        }
    }

    private void refreshDump(String entity, String accessToken) {
        try {
            byte[] payload = dumpRetrievalClient.fetchDump(entity, accessToken);
            dumpFileStore.save(entity, payload);
        } catch (DumpRetrievalException e) {
            logger.error("Retrieval failed for {}; falling back to the previously stored dump", entity, e);
        } catch (UncheckedIOException e) {
            logger.error("Downloaded dump for {} could not be stored; falling back to the previously stored dump", entity, e);
        }
    }
}
