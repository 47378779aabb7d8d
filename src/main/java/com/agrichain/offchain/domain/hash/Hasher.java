package com.agrichain.offchain.domain.hash;

import com.agrichain.offchain.domain.model.Digest;
import com.agrichain.offchain.domain.model.DigestFamily;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.bouncycastle.crypto.digests.KeccakDigest;

import java.nio.charset.StandardCharsets;


/**
 * The two hash families used for anchoring.  Both are pure functions of the
 * input bytes: any byte string is accepted and identical input always yields
 * the identical digest.
 */
public final class Hasher {

    private static final int KECCAK_BITS = 256;

    private Hasher() {}

    /**
     * Keccak-256 over {@code data}, matching the EVM {@code keccak256}
     * primitive (original Keccak padding, not FIPS-202 SHA3-256).
     */
    public static Digest solidityHash(byte[] data) {
        // KeccakDigest is stateful, one per call
        KeccakDigest keccak = new KeccakDigest(KECCAK_BITS);
        keccak.update(data, 0, data.length);
        byte[] out = new byte[keccak.getDigestSize()];
        keccak.doFinal(out, 0);
        return new Digest(DigestFamily.SOLIDITY_COMPATIBLE, Hex.encodeHexString(out));
    }

    public static Digest solidityHash(String data) {
        return solidityHash(data.getBytes(StandardCharsets.UTF_8));
    }

    /** SHA-256 over {@code data}. */
    public static Digest generalHash(byte[] data) {
        return new Digest(DigestFamily.GENERAL_PURPOSE, DigestUtils.sha256Hex(data));
    }

    public static Digest generalHash(String data) {
        return generalHash(data.getBytes(StandardCharsets.UTF_8));
    }
}
