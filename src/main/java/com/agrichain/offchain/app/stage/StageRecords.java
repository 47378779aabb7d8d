package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.RecordEnvelope;


/** Helpers for rendering storage-dependent fields of a stored record. */
final class StageRecords {

    static final String IPFS_CID = "ipfs_cid";

    private StageRecords() {}

    static String cidOrEmpty(RecordEnvelope<?> envelope) {
        return envelope.contentAddress().map(ContentAddress::value).orElse("");
    }

    static String hashOrEmpty(RecordEnvelope<?> envelope, String name) {
        return envelope.derivedHashes().contains(name) ? envelope.derivedHashes().value(name) : "";
    }

    static String timestamp(RecordEnvelope<?> envelope) {
        return envelope.createdAt().toString();
    }
}
