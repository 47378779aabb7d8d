package com.agrichain.offchain.app;


/** Source of decentralized identifiers for newly registered parties. */
@FunctionalInterface
public interface IdGenerator {

    /** Returns a fresh {@code did:<method>:<unique>} identifier. */
    String did(String method);
}
