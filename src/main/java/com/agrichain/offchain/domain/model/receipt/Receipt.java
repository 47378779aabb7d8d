package com.agrichain.offchain.domain.model.receipt;

import com.agrichain.offchain.domain.model.ContentAddress;

import java.time.Instant;


/**
 * The only externally visible result of a stage: identifiers, digests, the
 * content address and the record timestamp.  Receipts are built once, after
 * the record is stored and pinned, and never change.
 */
public interface Receipt {

    ContentAddress ipfsCid();

    Instant timestamp();
}
