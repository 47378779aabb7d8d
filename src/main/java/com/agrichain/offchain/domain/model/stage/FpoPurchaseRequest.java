package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;


/** Stage 2: a farmer producer organisation buys a batch from a registered farmer. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FpoPurchaseRequest(
        @NotBlank String farmerDid,
        @NotBlank String fpoName,
        @NotNull String batchId,
        @NotNull Double quantityKg,
        @NotNull Double pricePerKg,
        @NotNull String qualityGrade,
        String qualityReportUrl,
        String weightSlipUrl,
        List<String> photos,
        Double moistureContent,
        Double impurityPercentage,
        String paymentReference
) implements StagePayload {

    public FpoPurchaseRequest {
        photos = Lists.orEmpty(photos);
    }
}
