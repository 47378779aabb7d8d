package com.agrichain.offchain.domain.model;

import java.util.Objects;


/**
 * Commitment to a payload.  {@code revealHash} is the digest of the canonical
 * payload and {@code commitHash} the digest of {@code revealHash || nonce};
 * anyone holding the nonce and the reveal hash can recompute the commitment.
 */
public record CommitRevealPair(String nonce, Digest revealHash, Digest commitHash) {

    public CommitRevealPair {
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(revealHash, "revealHash");
        Objects.requireNonNull(commitHash, "commitHash");
    }
}
