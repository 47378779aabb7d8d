package com.agrichain.offchain.domain.model.receipt;

import com.agrichain.offchain.domain.model.ContentAddress;


public record PinStatus(ContentAddress cid, boolean pinned) {
}
