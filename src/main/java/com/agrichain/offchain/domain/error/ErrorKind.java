package com.agrichain.offchain.domain.error;


/**
 * Error classes surfaced to callers.  The code is the stable identifier placed
 * in error responses.
 */
public enum ErrorKind {
    VALIDATION("validation_error"),
    STORAGE_UNAVAILABLE("storage_unavailable"),
    PIN_FAILED("pin_failed"),
    NOT_FOUND("not_found"),
    INTERNAL("internal_error");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
