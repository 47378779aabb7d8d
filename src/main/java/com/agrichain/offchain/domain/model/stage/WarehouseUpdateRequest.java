package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;


/**
 * Stage 3: periodic warehouse state with IoT sensor readings.  Its state hash
 * covers the storage address of the record itself, so it can only be
 * computed after upload.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WarehouseUpdateRequest(
        @NotBlank String warehouseId,
        @NotBlank String batchId,
        @NotNull String storageLocation,
        Double temperatureCelsius,
        Double humidityPercentage,
        Double co2LevelPpm,
        String iotLogsUrl,
        List<String> inspectionReports,
        @Valid PestInspection pestInspection,
        Double qualityDegradation
) implements StagePayload {

    public WarehouseUpdateRequest {
        inspectionReports = Lists.orEmpty(inspectionReports);
    }
}
