package com.gamecatalog.dumpimport.model;

/**
 * Per-entity outcome codes reported in an import run summary.
 */
public final class ImportStatus {

    private ImportStatus() {
    }

    public static final String IMPORTED = "IMPORTED";
    public static final String NO_VALID_ROWS = "NO_VALID_ROWS";
    public static final String MISSING_PAYLOAD = "MISSING_PAYLOAD";
    public static final String UNREADABLE_PAYLOAD = "UNREADABLE_PAYLOAD";

}
