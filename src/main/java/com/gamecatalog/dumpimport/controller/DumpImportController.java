package com.gamecatalog.dumpimport.controller;

import com.gamecatalog.dumpimport.model.EntityImportSummary;
import com.gamecatalog.dumpimport.model.ImportConfiguration;
import com.gamecatalog.dumpimport.model.ImportFailureResponse;
import com.gamecatalog.dumpimport.service.DumpImportService;
import com.gamecatalog.dumpimport.service.ImportAlreadyRunningException;
import com.gamecatalog.dumpimport.service.StoreFailureException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/imports")
@Tag(name = "Dump Import", description = "Trigger catalog dump imports and inspect the configured entities")
public class DumpImportController {

    private static final Logger logger = LoggerFactory.getLogger(DumpImportController.class);

    private final DumpImportService dumpImportService;
    private final ImportConfiguration configuration;

    public DumpImportController(DumpImportService dumpImportService, ImportConfiguration configuration) {
        this.dumpImportService = dumpImportService;
        this.configuration = configuration;
    }

    @Operation(summary = "List configured entities", description = "Returns each configured entity with its column count.")
    @GetMapping("/entities")
    public Map<String, Integer> listEntities() {
        Map<String, Integer> entities = new LinkedHashMap<>();
        configuration.schemas().forEach((name, schema) -> entities.put(name, schema.columns().size()));
        return entities;
    }

    @Operation(
            summary = "Import all entities",
            description = "Downloads, validates and upserts every configured entity, one at a time."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Import finished; per-entity summary returned"),
            @ApiResponse(responseCode = "409", description = "Another import is already running"),
            @ApiResponse(responseCode = "500", description = "Upsert failed; remaining entities were not imported")
    })
    @PostMapping
    public ResponseEntity<?> importAll() {
        logger.info("Received request to import all entities");
        return runImport("all entities", dumpImportService::importAll);
    }

    @Operation(summary = "Import one entity", description = "Downloads, validates and upserts a single entity.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Import finished; summary returned"),
            @ApiResponse(responseCode = "404", description = "Entity is not configured"),
            @ApiResponse(responseCode = "409", description = "Another import is already running"),
            @ApiResponse(responseCode = "500", description = "Upsert failed")
    })
    @PostMapping("/{entity}")
    public ResponseEntity<?> importEntity(
            @Parameter(description = "Entity name, e.g. games", required = true)
            @PathVariable("entity") String entity) {
        if (configuration.schemaFor(entity).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Entity is not configured: " + entity);
        }
        logger.info("Received request to import entity {}", entity);
        return runImport(entity, () -> dumpImportService.importEntities(List.of(entity)));
    }

    private ResponseEntity<?> runImport(String description, Supplier<List<EntityImportSummary>> run) {
        try {
            return ResponseEntity.ok(run.get());
        } catch (ImportAlreadyRunningException e) {
            logger.warn("Import of {} rejected: {}", description, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        } catch (StoreFailureException e) {
            logger.error("Import of {} aborted: {}", description, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ImportFailureResponse(e.getEntity(), e.getMessage(), e.getCompleted()));
        }
    }
}
