package com.agrichain.offchain.domain.model;


/**
 * The two hash families produced by the pipeline.  Digests of both families
 * are 256 bits wide and share the same {@code 0x}-prefixed hex rendering; the
 * family is carried on the {@link Digest} value so callers can tell an
 * on-chain verifiable fingerprint from an internal chaining digest.
 */
public enum DigestFamily {

    /** Keccak-256, identical to the EVM {@code keccak256} primitive. */
    SOLIDITY_COMPATIBLE,

    /** SHA-256, used for merkle nodes and commit-reveal chaining. */
    GENERAL_PURPOSE
}
