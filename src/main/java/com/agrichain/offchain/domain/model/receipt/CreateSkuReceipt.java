package com.agrichain.offchain.domain.model.receipt;

import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.Digest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;


/**
 * {@code merkleRoot} is a plain string: for a single leaf it is the leaf
 * itself, which need not be a digest.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateSkuReceipt(
        String skuId,
        Digest parentBatchHash,
        String merkleRoot,
        ContentAddress ipfsCid,
        Instant packagedAt
) implements Receipt {

    @Override
    public Instant timestamp() {
        return packagedAt;
    }
}
