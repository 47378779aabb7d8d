package com.agrichain.offchain.domain.hash;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HashInputTest {

    @Test
    void delimitedJoinsWithDash() {
        byte[] bytes = HashInput.delimited().add("did:farmer:1").add("B-7").add(500.0).add("Green FPO").toBytes();
        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("did:farmer:1-B-7-500-Green FPO");
    }

    @Test
    void delimitedCannotSeparateAmbiguousFields() {
        byte[] a = HashInput.delimited().add("a-b").add("c").toBytes();
        byte[] b = HashInput.delimited().add("a").add("b-c").toBytes();
        assertThat(a).isEqualTo(b);
    }

    @Test
    void lengthPrefixedKeepsFieldBoundaries() {
        byte[] a = HashInput.of(HashInputEncoding.LENGTH_PREFIXED).add("a-b").add("c").toBytes();
        byte[] b = HashInput.of(HashInputEncoding.LENGTH_PREFIXED).add("a").add("b-c").toBytes();
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void lengthPrefixedFraming() {
        byte[] bytes = HashInput.of(HashInputEncoding.LENGTH_PREFIXED).add("ab").add("").toBytes();
        assertThat(bytes).containsExactly(0, 0, 0, 2, 'a', 'b', 0, 0, 0, 0);
    }

    @Test
    void fieldOrderMatters() {
        assertThat(HashInput.delimited().add("x").add("y").toBytes())
                .isNotEqualTo(HashInput.delimited().add("y").add("x").toBytes());
    }
}
