package com.gamecatalog.dumpimport.model;

import java.util.List;

/**
 * Partition of one entity's dump into accepted and rejected records.
 * Records without a usable id appear only in {@code skippedCount}.
 */
public record ValidationOutcome(String entity,
                                List<ParsedRecord> valid,
                                List<RejectedRecord> invalid,
                                int skippedCount) {

    public ValidationOutcome {
        valid = List.copyOf(valid);
        invalid = List.copyOf(invalid);
    }

    public int validCount() {
        return valid.size();
    }

    public int invalidCount() {
        return invalid.size();
    }
}
