package com.agrichain.offchain.web.dto;

import com.fasterxml.jackson.databind.JsonNode;


/** Arbitrary JSON to store; {@code pin} defaults to true. */
public record IpfsUploadRequest(JsonNode data, Boolean pin) {

    public boolean pinOrDefault() {
        return pin == null || pin;
    }
}
