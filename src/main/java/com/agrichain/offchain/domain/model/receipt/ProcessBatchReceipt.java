package com.agrichain.offchain.domain.model.receipt;

import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.Digest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;


@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessBatchReceipt(
        Digest inputBatchHash,
        Digest transformHash,
        List<Digest> outputBatchHashes,
        ContentAddress ipfsCid,
        Instant processedAt
) implements Receipt {

    public ProcessBatchReceipt {
        outputBatchHashes = List.copyOf(outputBatchHashes);
    }

    @Override
    public Instant timestamp() {
        return processedAt;
    }
}
