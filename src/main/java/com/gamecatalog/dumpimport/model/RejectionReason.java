package com.gamecatalog.dumpimport.model;

public enum RejectionReason {
    PARSE_ERROR,
    FILTER_MATCH
}
