package com.gamecatalog.dumpimport.service;

import com.gamecatalog.dumpimport.model.EntityImportSummary;
import lombok.Getter;

import java.util.List;

/**
 * Raised when an entity's upsert fails. Entities listed in {@link #getCompleted()} were already committed.
 */
@Getter
public class StoreFailureException extends RuntimeException {

    private final String entity;
    private final List<EntityImportSummary> completed;

    public StoreFailureException(String entity, List<EntityImportSummary> completed, Throwable cause) {
        super("Upsert failed for entity " + entity + ": " + cause.getMessage(), cause);
        this.entity = entity;
        this.completed = List.copyOf(completed);
    }
}
