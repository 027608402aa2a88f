package com.gamecatalog.dumpimport.model;

/**
 * Record dropped during validation. {@code detail} carries the semantic type for parse errors
 * and the matched excluded value for filter matches.
 */
public record RejectedRecord(String id, RejectionReason reason, String field, String detail) {
}
