package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;


/**
 * Stage 7: model scores for a batch.  The whole payload is committed through
 * commit-reveal, so its JSON property order is fixed here.  {@code features}
 * and {@code predictions} hold arbitrary JSON.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
        "batch_id", "quality_score", "sustainability_score", "traceability_score",
        "model_name", "model_version", "features", "predictions", "confidence",
        "model_artifacts_url", "training_data_hash"
})
public record AiScoreRequest(
        @NotBlank String batchId,
        @NotNull Double qualityScore,
        @NotNull Double sustainabilityScore,
        @NotNull Double traceabilityScore,
        @NotNull String modelName,
        @NotNull String modelVersion,
        Object features,
        Object predictions,
        @NotNull Double confidence,
        String modelArtifactsUrl,
        String trainingDataHash
) implements StagePayload {
}
