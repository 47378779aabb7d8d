package com.agrichain.offchain.domain.model.receipt;

import com.agrichain.offchain.domain.model.ContentAddress;
import com.fasterxml.jackson.databind.JsonNode;


public record FetchedContent(ContentAddress cid, JsonNode data) {
}
