package com.agrichain.offchain.domain.model.receipt;

import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.Digest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;


@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WarehouseUpdateReceipt(
        String warehouseId,
        Digest stateHash,
        ContentAddress ipfsCid,
        Instant updatedAt
) implements Receipt {

    @Override
    public Instant timestamp() {
        return updatedAt;
    }
}
