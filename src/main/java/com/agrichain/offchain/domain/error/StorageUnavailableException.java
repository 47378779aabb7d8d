package com.agrichain.offchain.domain.error;


/** Upload, fetch or pin-status call to the storage backend failed or timed out.  Retryable. */
public class StorageUnavailableException extends ProvenanceException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORAGE_UNAVAILABLE;
    }
}
