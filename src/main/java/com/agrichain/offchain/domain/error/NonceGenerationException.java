package com.agrichain.offchain.domain.error;


/** The secure entropy source for commit-reveal nonces is unavailable. */
public class NonceGenerationException extends ProvenanceException {

    public NonceGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }
}
