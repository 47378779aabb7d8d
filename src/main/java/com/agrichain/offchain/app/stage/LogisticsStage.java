package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.DerivedHashes;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.StageType;
import com.agrichain.offchain.domain.model.receipt.LogisticsMilestoneReceipt;
import com.agrichain.offchain.domain.model.stage.LogisticsMilestoneRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static com.agrichain.offchain.app.stage.StageRecords.*;


/** Logistics milestone: {@code keccak(shipmentId-currentLocation-lat-lon)}. */
public class LogisticsStage implements StageDefinition<LogisticsMilestoneRequest, LogisticsMilestoneReceipt> {

    public static final String LOCATION_HASH = "location_hash";

    @Override
    public StageType type() {
        return StageType.LOGISTICS;
    }

    @Override
    public DerivedHashes preHash(RecordEnvelope<LogisticsMilestoneRequest> draft, StageHashing hashing) {
        LogisticsMilestoneRequest p = draft.payload();
        var input = hashing.input()
                .add(p.shipmentId())
                .add(p.currentLocation())
                .add(p.gpsCoordinates().latitude())
                .add(p.gpsCoordinates().longitude());
        return DerivedHashes.empty().with(LOCATION_HASH, hashing.solidity(input));
    }

    @Override
    public ObjectNode toRecord(RecordEnvelope<LogisticsMilestoneRequest> envelope, CanonicalJson json) {
        ObjectNode node = json.newObject();
        node.put("shipment_id", envelope.payload().shipmentId());
        node.put(LOCATION_HASH, hashOrEmpty(envelope, LOCATION_HASH));
        node.set("milestone_data", json.toTree(envelope.payload()));
        node.put("recorded_at", timestamp(envelope));
        node.put(IPFS_CID, cidOrEmpty(envelope));
        return node;
    }

    @Override
    public LogisticsMilestoneReceipt receipt(RecordEnvelope<LogisticsMilestoneRequest> envelope) {
        return new LogisticsMilestoneReceipt(
                envelope.payload().shipmentId(),
                envelope.derivedHashes().digest(LOCATION_HASH),
                envelope.requireContentAddress(),
                envelope.createdAt());
    }

    @Override
    public String describe(LogisticsMilestoneRequest payload) {
        return "shipment " + payload.shipmentId();
    }
}
