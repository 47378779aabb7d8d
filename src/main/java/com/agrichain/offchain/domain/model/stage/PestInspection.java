package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;


@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PestInspection(
        @NotNull Instant inspectedAt,
        boolean pestFound,
        String pestType,
        String treatmentApplied
) {
}
