package com.agrichain.offchain.domain.model.receipt;

import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.Digest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;


/**
 * Carries the nonce alongside both commit-reveal hashes so the holder can
 * later prove the score was fixed at {@code scoredAt}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AiScoreReceipt(
        Digest batchHash,
        Digest commitHash,
        Digest revealHash,
        String nonce,
        ContentAddress ipfsCid,
        Instant scoredAt
) implements Receipt {

    @Override
    public Instant timestamp() {
        return scoredAt;
    }
}
