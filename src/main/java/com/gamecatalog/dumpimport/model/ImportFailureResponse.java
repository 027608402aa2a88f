package com.gamecatalog.dumpimport.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Body returned when an upsert aborts the run")
public class ImportFailureResponse {

    @Schema(description = "Entity whose upsert failed", example = "games")
    private String failedEntity;

    @Schema(description = "Failure message from the store")
    private String message;

    @Schema(description = "Entities committed before the failure")
    private List<EntityImportSummary> completed;
}
