package com.gamecatalog.dumpimport.model;

public record UpsertResult(String entity, int submittedRows, int duplicatesDropped, int affectedRows) {

    public static UpsertResult empty(String entity) {
        return new UpsertResult(entity, 0, 0, 0);
    }
}
