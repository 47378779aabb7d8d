package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;


/** Stage 4: a shipment reaches a milestone.  The full GPS trail stays off-chain. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LogisticsMilestoneRequest(
        @NotBlank String shipmentId,
        @NotNull String currentLocation,
        @NotNull @Valid GpsCoordinates gpsCoordinates,
        @NotNull MilestoneType milestoneType,
        String gpsHistoryUrl,
        @NotNull String carrierName,
        @NotNull String vehicleId,
        String driverName,
        String temperatureLog,
        List<@Valid ShockEvent> shockEvents,
        Instant estimatedArrival,
        @JsonProperty("is_delivered") boolean isDelivered
) implements StagePayload {

    public LogisticsMilestoneRequest {
        shockEvents = Lists.orEmpty(shockEvents);
    }
}
