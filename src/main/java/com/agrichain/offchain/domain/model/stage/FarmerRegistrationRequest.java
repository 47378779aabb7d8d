package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;


/**
 * Stage 1: a farmer joins the network.  The KYC, land and soil documents stay
 * off-chain; only the crop identity hash is anchored.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FarmerRegistrationRequest(
        @NotBlank String farmerName,
        @NotBlank String cropType,
        @NotNull Double landAreaHectares,
        @NotBlank String location,
        @Valid GpsCoordinates gpsCoordinates,
        String kycDocumentUrl,
        List<String> landOwnershipDocs,
        String satelliteImageryUrl,
        String soilTestReport,
        String phoneNumber,
        String email
) implements StagePayload {

    public FarmerRegistrationRequest {
        landOwnershipDocs = Lists.orEmpty(landOwnershipDocs);
    }
}
