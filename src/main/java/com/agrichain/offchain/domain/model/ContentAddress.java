package com.agrichain.offchain.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;


/**
 * Identifier returned by the storage collaborator for uploaded bytes (an IPFS
 * CID for the IPFS backend).  Callers must not assume it is derived from the
 * content alone.
 */
public record ContentAddress(String value) {

    public ContentAddress {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("content address must not be blank");
        }
        value = value.trim();
    }

    public static ContentAddress of(String value) {
        return new ContentAddress(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
