package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;


/**
 * Stage 5: an input batch is transformed into one or more output batches.
 * Every output batch id gets its own hash.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessBatchRequest(
        @NotBlank String inputBatchId,
        @NotBlank String processorName,
        @NotNull ProcessingType processingType,
        @NotNull Double inputQuantityKg,
        @NotNull Double outputQuantityKg,
        @NotNull Double yieldPercentage,
        @NotNull Double wastePercentage,
        List<String> labResultsUrl,
        List<String> certifications,
        List<String> outputBatchIds,
        @Valid ProcessingParameters processingParameters
) implements StagePayload {

    public ProcessBatchRequest {
        labResultsUrl = Lists.orEmpty(labResultsUrl);
        certifications = Lists.orEmpty(certifications);
        outputBatchIds = Lists.orEmpty(outputBatchIds);
    }
}
