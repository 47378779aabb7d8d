package com.agrichain.offchain.domain.model.receipt;

import com.agrichain.offchain.domain.model.ContentAddress;


/** Result of a generic upload not tied to a stage. */
public record UploadReceipt(ContentAddress cid, long size, boolean pinned) {
}
