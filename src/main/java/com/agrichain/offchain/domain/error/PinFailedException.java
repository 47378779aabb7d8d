package com.agrichain.offchain.domain.error;

import com.agrichain.offchain.domain.model.ContentAddress;


/**
 * The content was stored but could not be pinned, so its durability is not
 * guaranteed.  Callers may retry the pin alone using {@link #getAddress()}.
 */
public class PinFailedException extends ProvenanceException {

    private final ContentAddress address;

    public PinFailedException(ContentAddress address, Throwable cause) {
        super("Pinning " + address + " failed: " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.address = address;
    }

    public ContentAddress getAddress() {
        return address;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PIN_FAILED;
    }
}
