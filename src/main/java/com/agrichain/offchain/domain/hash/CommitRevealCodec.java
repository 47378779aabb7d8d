package com.agrichain.offchain.domain.hash;

import com.agrichain.offchain.domain.error.NonceGenerationException;
import com.agrichain.offchain.domain.model.CommitRevealPair;
import com.agrichain.offchain.domain.model.Digest;
import org.apache.commons.codec.binary.Hex;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Objects;


/**
 * Commit-reveal over canonical payload JSON.
 *
 * <pre>
 *   reveal_hash = generalHash(canonicalJson(payload))
 *   commit_hash = generalHash(reveal_hash || nonce)
 * </pre>
 *
 * Both operands of the commit are concatenated in their string forms, the
 * reveal hash including its {@code 0x} prefix.  Nonces are 128 bits from a
 * {@link SecureRandom}, hex encoded, and a fresh one is drawn per commit.
 * Thread-safe.
 */
public class CommitRevealCodec {

    public static final int NONCE_BYTES = 16;

    private final CanonicalJson json;
    private final SecureRandom random;

    public CommitRevealCodec(CanonicalJson json, SecureRandom random) {
        this.json = Objects.requireNonNull(json, "json");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Codec backed by the JDK's DRBG.
     *
     * @throws NonceGenerationException if no DRBG is available; there is no
     *         fallback to a weaker source
     */
    public static CommitRevealCodec withDrbg(CanonicalJson json) {
        try {
            return new CommitRevealCodec(json, SecureRandom.getInstance("DRBG"));
        } catch (NoSuchAlgorithmException e) {
            throw new NonceGenerationException("DRBG entropy source unavailable", e);
        }
    }

    public CommitRevealPair commit(Object payload) {
        String nonce = newNonce();
        Digest reveal = revealHash(payload);
        return new CommitRevealPair(nonce, reveal, commitHash(reveal, nonce));
    }

    /**
     * Recomputes both hashes from {@code payload} and the pair's nonce.
     *
     * @return {@code true} iff both equal the ones stored in {@code pair}
     */
    public boolean verify(CommitRevealPair pair, Object payload) {
        Digest reveal = revealHash(payload);
        if (!reveal.value().equals(pair.revealHash().value())) {
            return false;
        }
        return commitHash(pair.revealHash(), pair.nonce()).value().equals(pair.commitHash().value());
    }

    public Digest revealHash(Object payload) {
        return Hasher.generalHash(json.toBytes(payload));
    }

    public static Digest commitHash(Digest revealHash, String nonce) {
        return Hasher.generalHash(revealHash.value() + nonce);
    }

    private String newNonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException e) {
            throw new NonceGenerationException("secure random failed to produce a nonce", e);
        }
        return Hex.encodeHexString(bytes);
    }
}
