package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;


/**
 * Stage 6: retail units are packaged from a parent batch.  When
 * {@code merkleProof} is present its entries are the merkle leaves, otherwise
 * the SKU id alone is.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateSkuRequest(
        @NotBlank String skuId,
        @NotBlank String parentBatchId,
        @NotBlank String productName,
        @NotNull String brand,
        @NotNull Double unitWeightGrams,
        @NotNull @PositiveOrZero Long unitsPackaged,
        @NotNull String packageType,
        String barcode,
        String qrCode,
        String nutritionalInfoUrl,
        List<String> regulatoryCertifications,
        List<String> labelImages,
        Instant expiryDate,
        Instant bestBeforeDate,
        List<String> merkleProof
) implements StagePayload {

    public CreateSkuRequest {
        regulatoryCertifications = Lists.orEmpty(regulatoryCertifications);
        labelImages = Lists.orEmpty(labelImages);
        merkleProof = merkleProof == null ? null : Lists.copy(merkleProof);
    }
}
