package com.agrichain.offchain.domain.model;


/**
 * Result of a successful upload: where the bytes live and how many bytes the
 * backend reports for them.
 */
public record StoredContent(ContentAddress address, long size) {
}
