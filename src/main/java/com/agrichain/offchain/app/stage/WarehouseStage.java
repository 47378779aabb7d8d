package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.domain.hash.AnchorFieldFormat;
import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.DerivedHashes;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.StageType;
import com.agrichain.offchain.domain.model.receipt.WarehouseUpdateReceipt;
import com.agrichain.offchain.domain.model.stage.WarehouseUpdateRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static com.agrichain.offchain.app.stage.StageRecords.*;


/**
 * Warehouse state.  The state hash binds the sensor readings to the stored
 * record: {@code keccak(warehouseId-batchId-Some(t)-Some(h)-cid)}, so nothing
 * is hashed before upload and the stored record carries an empty state hash.
 */
public class WarehouseStage implements StageDefinition<WarehouseUpdateRequest, WarehouseUpdateReceipt> {

    public static final String STATE_HASH = "state_hash";

    @Override
    public StageType type() {
        return StageType.WAREHOUSE;
    }

    @Override
    public DerivedHashes preHash(RecordEnvelope<WarehouseUpdateRequest> draft, StageHashing hashing) {
        return DerivedHashes.empty();
    }

    @Override
    public DerivedHashes postHash(RecordEnvelope<WarehouseUpdateRequest> persisted, StageHashing hashing) {
        WarehouseUpdateRequest p = persisted.payload();
        var input = hashing.input()
                .add(p.warehouseId())
                .add(p.batchId())
                .add(AnchorFieldFormat.optionalDecimal(p.temperatureCelsius()))
                .add(AnchorFieldFormat.optionalDecimal(p.humidityPercentage()))
                .add(persisted.requireContentAddress().value());
        return DerivedHashes.empty().with(STATE_HASH, hashing.solidity(input));
    }

    @Override
    public ObjectNode toRecord(RecordEnvelope<WarehouseUpdateRequest> envelope, CanonicalJson json) {
        ObjectNode node = json.newObject();
        node.put("warehouse_id", envelope.payload().warehouseId());
        node.put(STATE_HASH, hashOrEmpty(envelope, STATE_HASH));
        node.set("warehouse_data", json.toTree(envelope.payload()));
        node.put("updated_at", timestamp(envelope));
        node.put(IPFS_CID, cidOrEmpty(envelope));
        return node;
    }

    @Override
    public WarehouseUpdateReceipt receipt(RecordEnvelope<WarehouseUpdateRequest> envelope) {
        return new WarehouseUpdateReceipt(
                envelope.payload().warehouseId(),
                envelope.derivedHashes().digest(STATE_HASH),
                envelope.requireContentAddress(),
                envelope.createdAt());
    }

    @Override
    public String describe(WarehouseUpdateRequest payload) {
        return "warehouse " + payload.warehouseId();
    }
}
