package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;


@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessingParameters(
        Double temperatureCelsius,
        Double pressureBar,
        Integer durationMinutes,
        @NotNull String method
) {
}
