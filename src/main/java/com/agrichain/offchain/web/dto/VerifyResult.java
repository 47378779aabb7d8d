package com.agrichain.offchain.web.dto;


public record VerifyResult(boolean valid) {
}
