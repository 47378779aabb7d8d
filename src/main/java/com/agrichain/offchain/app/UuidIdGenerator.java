package com.agrichain.offchain.app;

import java.util.UUID;


/** {@code did:<method>:<random UUID>}. */
public class UuidIdGenerator implements IdGenerator {

    @Override
    public String did(String method) {
        return "did:" + method + ":" + UUID.randomUUID();
    }
}
