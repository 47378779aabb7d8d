package com.agrichain.offchain.web.dto;

import com.agrichain.offchain.domain.model.stage.AiScoreRequest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;


@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AiScoreVerifyRequest(String nonce, String revealHash, String commitHash, AiScoreRequest scoreData) {
}
