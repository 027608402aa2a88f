package com.gamecatalog.dumpimport.model;

/**
 * Outcome of parsing one raw field value: a typed value, an absent value, or a failure.
 */
public final class FieldParseResult {

    private static final FieldParseResult ABSENT = new FieldParseResult(null, false);
    private static final FieldParseResult FAILURE = new FieldParseResult(null, true);

    private final Object value;
    private final boolean failed;

    private FieldParseResult(Object value, boolean failed) {
        this.value = value;
        this.failed = failed;
    }

    public static FieldParseResult of(Object value) {
        return value == null ? ABSENT : new FieldParseResult(value, false);
    }

    public static FieldParseResult absent() {
        return ABSENT;
    }

    public static FieldParseResult failure() {
        return FAILURE;
    }

    public boolean isFailure() {
        return failed;
    }

    public boolean isAbsent() {
        return !failed && value == null;
    }

    /**
     * Typed value, or {@code null} when absent or failed.
     */
    public Object value() {
        return value;
    }

    @Override
    public String toString() {
        if (failed) {
            return "FieldParseResult[failure]";
        }
        return value == null ? "FieldParseResult[absent]" : "FieldParseResult[" + value + "]";
    }
}
