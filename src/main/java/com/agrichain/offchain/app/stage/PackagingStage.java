package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.DerivedHashes;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.StageType;
import com.agrichain.offchain.domain.model.receipt.CreateSkuReceipt;
import com.agrichain.offchain.domain.model.stage.CreateSkuRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.agrichain.offchain.app.stage.StageRecords.*;


/**
 * SKU creation.  Parent hash {@code keccak(parentBatchId-productName)} plus a
 * merkle root over the supplied proof list, or over {@code [skuId]} when no
 * proof is given (in which case the root is the SKU id itself).
 */
public class PackagingStage implements StageDefinition<CreateSkuRequest, CreateSkuReceipt> {

    public static final String PARENT_BATCH_HASH = "parent_batch_hash";
    public static final String MERKLE_ROOT = "merkle_root";

    @Override
    public StageType type() {
        return StageType.PACKAGING;
    }

    @Override
    public Set<String> check(CreateSkuRequest payload) {
        Set<String> errors = new LinkedHashSet<>();
        if (payload.merkleProof() != null) {
            for (int i = 0; i < payload.merkleProof().size(); i++) {
                if (payload.merkleProof().get(i) == null) {
                    errors.add("merkle_proof[" + i + "]: must not be null");
                }
            }
        }
        return errors;
    }

    @Override
    public DerivedHashes preHash(RecordEnvelope<CreateSkuRequest> draft, StageHashing hashing) {
        CreateSkuRequest p = draft.payload();
        var parent = hashing.input()
                .add(p.parentBatchId())
                .add(p.productName());
        List<String> leaves = p.merkleProof() != null ? p.merkleProof() : List.of(p.skuId());
        return DerivedHashes.empty()
                .with(PARENT_BATCH_HASH, hashing.solidity(parent))
                .withValue(MERKLE_ROOT, hashing.merkleRoot(leaves));
    }

    @Override
    public ObjectNode toRecord(RecordEnvelope<CreateSkuRequest> envelope, CanonicalJson json) {
        ObjectNode node = json.newObject();
        node.put("sku_id", envelope.payload().skuId());
        node.put(PARENT_BATCH_HASH, hashOrEmpty(envelope, PARENT_BATCH_HASH));
        node.put(MERKLE_ROOT, hashOrEmpty(envelope, MERKLE_ROOT));
        node.set("sku_data", json.toTree(envelope.payload()));
        node.put("packaged_at", timestamp(envelope));
        node.put(IPFS_CID, cidOrEmpty(envelope));
        return node;
    }

    @Override
    public CreateSkuReceipt receipt(RecordEnvelope<CreateSkuRequest> envelope) {
        return new CreateSkuReceipt(
                envelope.payload().skuId(),
                envelope.derivedHashes().digest(PARENT_BATCH_HASH),
                envelope.derivedHashes().value(MERKLE_ROOT),
                envelope.requireContentAddress(),
                envelope.createdAt());
    }

    @Override
    public String describe(CreateSkuRequest payload) {
        return "SKU " + payload.skuId();
    }
}
