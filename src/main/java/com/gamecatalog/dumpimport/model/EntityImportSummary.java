package com.gamecatalog.dumpimport.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of importing one catalog entity")
public record EntityImportSummary(
        @Schema(description = "Entity name", example = "games") String entity,
        @Schema(description = "Outcome code", example = "IMPORTED") String status,
        @Schema(description = "Records that passed validation") int validCount,
        @Schema(description = "Records rejected by a parse error or a filter match") int invalidCount,
        @Schema(description = "Records without a usable id") int skippedCount,
        @Schema(description = "Rows submitted to the store after de-duplication") int writtenCount,
        @Schema(description = "Accepted records superseded by another record with the same id") int duplicatesDropped
) {

    public static EntityImportSummary withoutPayload(String entity, String status) {
        return new EntityImportSummary(entity, status, 0, 0, 0, 0, 0);
    }

    public static EntityImportSummary of(ValidationOutcome outcome, UpsertResult upsert) {
        String status = outcome.validCount() == 0 ? ImportStatus.NO_VALID_ROWS : ImportStatus.IMPORTED;
        return new EntityImportSummary(outcome.entity(), status,
                outcome.validCount(), outcome.invalidCount(), outcome.skippedCount(),
                upsert.submittedRows(), upsert.duplicatesDropped());
    }
}
