package com.agrichain.offchain.domain.error;


/**
 * Base of every failure a stage or storage operation reports.  Each subclass
 * maps to exactly one {@link ErrorKind}; no receipt is produced once one of
 * these is raised.
 */
public abstract class ProvenanceException extends RuntimeException {

    protected ProvenanceException(String message) {
        super(message);
    }

    protected ProvenanceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
