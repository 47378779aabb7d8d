package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;


@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GpsCoordinates(
        @NotNull Double latitude,
        @NotNull Double longitude,
        Double altitude
) {
}
