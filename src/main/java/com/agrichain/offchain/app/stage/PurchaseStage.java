package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.DerivedHashes;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.StageType;
import com.agrichain.offchain.domain.model.receipt.FpoPurchaseReceipt;
import com.agrichain.offchain.domain.model.stage.FpoPurchaseRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static com.agrichain.offchain.app.stage.StageRecords.*;


/** FPO purchase: {@code keccak(farmerDid-batchId-quantityKg-fpoName)}. */
public class PurchaseStage implements StageDefinition<FpoPurchaseRequest, FpoPurchaseReceipt> {

    public static final String BATCH_HASH = "batch_hash";

    @Override
    public StageType type() {
        return StageType.PURCHASE;
    }

    @Override
    public DerivedHashes preHash(RecordEnvelope<FpoPurchaseRequest> draft, StageHashing hashing) {
        FpoPurchaseRequest p = draft.payload();
        var input = hashing.input()
                .add(p.farmerDid())
                .add(p.batchId())
                .add(p.quantityKg())
                .add(p.fpoName());
        return DerivedHashes.empty().with(BATCH_HASH, hashing.solidity(input));
    }

    @Override
    public ObjectNode toRecord(RecordEnvelope<FpoPurchaseRequest> envelope, CanonicalJson json) {
        ObjectNode node = json.newObject();
        node.put(BATCH_HASH, hashOrEmpty(envelope, BATCH_HASH));
        node.set("purchase_data", json.toTree(envelope.payload()));
        node.put("purchased_at", timestamp(envelope));
        node.put(IPFS_CID, cidOrEmpty(envelope));
        return node;
    }

    @Override
    public FpoPurchaseReceipt receipt(RecordEnvelope<FpoPurchaseRequest> envelope) {
        return new FpoPurchaseReceipt(
                envelope.derivedHashes().digest(BATCH_HASH),
                envelope.requireContentAddress(),
                envelope.createdAt());
    }

    @Override
    public String describe(FpoPurchaseRequest payload) {
        return "purchase of batch " + payload.batchId();
    }
}
