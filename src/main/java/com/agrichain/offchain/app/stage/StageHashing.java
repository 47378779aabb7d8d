package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.domain.hash.CommitRevealCodec;
import com.agrichain.offchain.domain.hash.HashInput;
import com.agrichain.offchain.domain.hash.HashInputEncoding;
import com.agrichain.offchain.domain.hash.Hasher;
import com.agrichain.offchain.domain.hash.MerkleAggregator;
import com.agrichain.offchain.domain.model.CommitRevealPair;
import com.agrichain.offchain.domain.model.Digest;

import java.util.List;
import java.util.Objects;


/**
 * Hashing toolbox handed to every stage: hash inputs in the configured
 * encoding, the solidity-compatible digest, merkle aggregation and
 * commit-reveal.  Stateless apart from its configuration.
 */
public class StageHashing {

    private final HashInputEncoding encoding;
    private final CommitRevealCodec commitReveal;

    public StageHashing(HashInputEncoding encoding, CommitRevealCodec commitReveal) {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
        this.commitReveal = Objects.requireNonNull(commitReveal, "commitReveal");
    }

    public HashInput input() {
        return HashInput.of(encoding);
    }

    public Digest solidity(HashInput input) {
        return Hasher.solidityHash(input.toBytes());
    }

    public String merkleRoot(List<String> leaves) {
        return MerkleAggregator.root(leaves);
    }

    public CommitRevealPair commit(Object payload) {
        return commitReveal.commit(payload);
    }
}
