package com.agrichain.offchain.domain.error;


/**
 * JSON could not be written or read back: a record failed to render as
 * canonical JSON, or stored content is not JSON.  Retrying cannot help.
 */
public class SerializationException extends ProvenanceException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }
}
