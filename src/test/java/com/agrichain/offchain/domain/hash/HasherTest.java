package com.agrichain.offchain.domain.hash;

import com.agrichain.offchain.domain.model.DigestFamily;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HasherTest {

    @Test
    void keccakMatchesEvmVectors() {
        assertThat(Hasher.solidityHash("").value())
                .isEqualTo("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
        assertThat(Hasher.solidityHash("abc").value())
                .isEqualTo("0x4e03657aea45a94fc7d47ba826c8d667c0d1e6e33a64a036ec44f58fa12d6c45");
    }

    @Test
    void sha256MatchesKnownVectors() {
        assertThat(Hasher.generalHash("").value())
                .isEqualTo("0xe3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(Hasher.generalHash("abc").value())
                .isEqualTo("0xba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void digestsCarryTheirFamily() {
        assertThat(Hasher.solidityHash("x").family()).isEqualTo(DigestFamily.SOLIDITY_COMPATIBLE);
        assertThat(Hasher.generalHash("x").family()).isEqualTo(DigestFamily.GENERAL_PURPOSE);
    }

    @Test
    void sameBytesSameDigest() {
        byte[] data = "did:farmer:1-wheat-2024-01-01 00:00:00 UTC".getBytes(StandardCharsets.UTF_8);
        assertThat(Hasher.solidityHash(data)).isEqualTo(Hasher.solidityHash(data.clone()));
        assertThat(Hasher.solidityHash(data)).isNotEqualTo(Hasher.solidityHash("other"));
    }

    @Test
    void stringOverloadHashesUtf8() {
        String s = "किसान-गेहूँ";
        assertThat(Hasher.solidityHash(s)).isEqualTo(Hasher.solidityHash(s.getBytes(StandardCharsets.UTF_8)));
        assertThat(Hasher.generalHash(s)).isEqualTo(Hasher.generalHash(s.getBytes(StandardCharsets.UTF_8)));
    }
}
