package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.CommitRevealPair;
import com.agrichain.offchain.domain.model.DerivedHashes;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.StageType;
import com.agrichain.offchain.domain.model.receipt.AiScoreReceipt;
import com.agrichain.offchain.domain.model.stage.AiScoreRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static com.agrichain.offchain.app.stage.StageRecords.*;


/**
 * AI scoring.  The whole payload is committed with commit-reveal; the batch
 * and model are anchored separately as {@code keccak(batchId-modelName)}.
 */
public class AiScoreStage implements StageDefinition<AiScoreRequest, AiScoreReceipt> {

    public static final String BATCH_HASH = "batch_hash";
    public static final String COMMIT_HASH = "commit_hash";
    public static final String REVEAL_HASH = "reveal_hash";
    public static final String NONCE = "nonce";

    @Override
    public StageType type() {
        return StageType.AI_SCORE;
    }

    @Override
    public DerivedHashes preHash(RecordEnvelope<AiScoreRequest> draft, StageHashing hashing) {
        AiScoreRequest p = draft.payload();
        var batch = hashing.input()
                .add(p.batchId())
                .add(p.modelName());
        CommitRevealPair pair = hashing.commit(p);
        return DerivedHashes.empty()
                .with(BATCH_HASH, hashing.solidity(batch))
                .with(COMMIT_HASH, pair.commitHash())
                .with(REVEAL_HASH, pair.revealHash())
                .withValue(NONCE, pair.nonce());
    }

    @Override
    public ObjectNode toRecord(RecordEnvelope<AiScoreRequest> envelope, CanonicalJson json) {
        ObjectNode node = json.newObject();
        node.put(BATCH_HASH, hashOrEmpty(envelope, BATCH_HASH));
        node.put(COMMIT_HASH, hashOrEmpty(envelope, COMMIT_HASH));
        node.put(REVEAL_HASH, hashOrEmpty(envelope, REVEAL_HASH));
        node.put(NONCE, hashOrEmpty(envelope, NONCE));
        node.set("score_data", json.toTree(envelope.payload()));
        node.put("scored_at", timestamp(envelope));
        node.put(IPFS_CID, cidOrEmpty(envelope));
        return node;
    }

    @Override
    public AiScoreReceipt receipt(RecordEnvelope<AiScoreRequest> envelope) {
        return new AiScoreReceipt(
                envelope.derivedHashes().digest(BATCH_HASH),
                envelope.derivedHashes().digest(COMMIT_HASH),
                envelope.derivedHashes().digest(REVEAL_HASH),
                envelope.derivedHashes().value(NONCE),
                envelope.requireContentAddress(),
                envelope.createdAt());
    }

    @Override
    public String describe(AiScoreRequest payload) {
        return "AI score for batch " + payload.batchId();
    }
}
