package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.app.IdGenerator;
import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.DerivedHashes;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.StageType;
import com.agrichain.offchain.domain.model.receipt.Receipt;
import com.agrichain.offchain.domain.model.stage.StagePayload;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Set;


/**
 * One custody stage: which identifiers it mints, which digests it computes
 * before and after storage, how its record is laid out and what its receipt
 * holds.  Implementations are stateless; field order inside each hash input
 * is fixed by the implementation.
 *
 * @param <P> accepted payload
 * @param <R> receipt returned on success
 */
public interface StageDefinition<P extends StagePayload, R extends Receipt> {

    StageType type();

    /** Checks beyond bean validation.  Returns one message per problem. */
    default Set<String> check(P payload) {
        return Set.of();
    }

    /** Identifiers minted for this record, e.g. a farmer DID. */
    default Map<String, String> identify(P payload, IdGenerator ids) {
        return Map.of();
    }

    /** Digests computable from the payload, identifiers and timestamp alone. */
    DerivedHashes preHash(RecordEnvelope<P> draft, StageHashing hashing);

    /** Digests that cover the content address; {@code persisted} always has one. */
    default DerivedHashes postHash(RecordEnvelope<P> persisted, StageHashing hashing) {
        return DerivedHashes.empty();
    }

    /**
     * The stored JSON record.  Values that depend on storage and are not known
     * yet are rendered as empty strings.
     */
    ObjectNode toRecord(RecordEnvelope<P> envelope, CanonicalJson json);

    R receipt(RecordEnvelope<P> envelope);

    /** Short name used in logs. */
    default String describe(P payload) {
        return type().label();
    }
}
