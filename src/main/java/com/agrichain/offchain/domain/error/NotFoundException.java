package com.agrichain.offchain.domain.error;

import com.agrichain.offchain.domain.model.ContentAddress;


public class NotFoundException extends ProvenanceException {

    public NotFoundException(ContentAddress address) {
        super("Content not found: " + address);
    }

    public NotFoundException(ContentAddress address, Throwable cause) {
        super("Content not found: " + address, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
