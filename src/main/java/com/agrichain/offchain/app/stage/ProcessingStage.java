package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.DerivedHashes;
import com.agrichain.offchain.domain.model.Digest;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.StageType;
import com.agrichain.offchain.domain.model.receipt.ProcessBatchReceipt;
import com.agrichain.offchain.domain.model.stage.ProcessBatchRequest;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.agrichain.offchain.app.stage.StageRecords.*;


/**
 * Processing of an input batch into output batches.  Three independent hash
 * families per call:
 * <ul>
 *   <li>input: {@code keccak(inputBatchId-processorName-inputQuantityKg)}</li>
 *   <li>one per output, in request order: {@code keccak(outputId-outputQuantityKg)}</li>
 *   <li>transform: {@code keccak(ProcessingType-yieldPercentage-wastePercentage)}</li>
 * </ul>
 */
public class ProcessingStage implements StageDefinition<ProcessBatchRequest, ProcessBatchReceipt> {

    public static final String INPUT_BATCH_HASH = "input_batch_hash";
    public static final String TRANSFORM_HASH = "transform_hash";
    public static final String OUTPUT_BATCH_HASHES = "output_batch_hashes";

    @Override
    public StageType type() {
        return StageType.PROCESSING;
    }

    @Override
    public Set<String> check(ProcessBatchRequest payload) {
        Set<String> errors = new LinkedHashSet<>();
        List<String> outputs = payload.outputBatchIds();
        for (int i = 0; i < outputs.size(); i++) {
            String id = outputs.get(i);
            if (id == null || id.isBlank()) {
                errors.add("output_batch_ids[" + i + "]: must not be blank");
            }
        }
        return errors;
    }

    @Override
    public DerivedHashes preHash(RecordEnvelope<ProcessBatchRequest> draft, StageHashing hashing) {
        ProcessBatchRequest p = draft.payload();
        Digest input = hashing.solidity(hashing.input()
                .add(p.inputBatchId())
                .add(p.processorName())
                .add(p.inputQuantityKg()));

        List<Digest> outputs = new ArrayList<>(p.outputBatchIds().size());
        for (String outputId : p.outputBatchIds()) {
            outputs.add(hashing.solidity(hashing.input()
                    .add(outputId)
                    .add(p.outputQuantityKg())));
        }

        Digest transform = hashing.solidity(hashing.input()
                .add(p.processingType().variantName())
                .add(p.yieldPercentage())
                .add(p.wastePercentage()));

        return DerivedHashes.empty()
                .with(INPUT_BATCH_HASH, input)
                .with(TRANSFORM_HASH, transform)
                .withAll(OUTPUT_BATCH_HASHES, outputs);
    }

    @Override
    public ObjectNode toRecord(RecordEnvelope<ProcessBatchRequest> envelope, CanonicalJson json) {
        ObjectNode node = json.newObject();
        node.put(INPUT_BATCH_HASH, hashOrEmpty(envelope, INPUT_BATCH_HASH));
        node.put(TRANSFORM_HASH, hashOrEmpty(envelope, TRANSFORM_HASH));
        ArrayNode outputs = node.putArray(OUTPUT_BATCH_HASHES);
        if (envelope.derivedHashes().contains(OUTPUT_BATCH_HASHES)) {
            envelope.derivedHashes().digests(OUTPUT_BATCH_HASHES).forEach(d -> outputs.add(d.value()));
        }
        node.set("process_data", json.toTree(envelope.payload()));
        node.put("processed_at", timestamp(envelope));
        node.put(IPFS_CID, cidOrEmpty(envelope));
        return node;
    }

    @Override
    public ProcessBatchReceipt receipt(RecordEnvelope<ProcessBatchRequest> envelope) {
        return new ProcessBatchReceipt(
                envelope.derivedHashes().digest(INPUT_BATCH_HASH),
                envelope.derivedHashes().digest(TRANSFORM_HASH),
                envelope.derivedHashes().digests(OUTPUT_BATCH_HASHES),
                envelope.requireContentAddress(),
                envelope.createdAt());
    }

    @Override
    public String describe(ProcessBatchRequest payload) {
        return "batch " + payload.inputBatchId();
    }
}
