package com.agrichain.offchain.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;


/**
 * A 256-bit hash value tagged with the family that produced it.  On the wire
 * a digest is always the lowercase hex string prefixed with {@code 0x}.
 */
public record Digest(DigestFamily family, String hex) {

    public static final String PREFIX = "0x";

    private static final Pattern HEX_64 = Pattern.compile("[0-9a-f]{64}");

    public Digest {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(hex, "hex");
        hex = hex.toLowerCase(Locale.ROOT);
        if (!HEX_64.matcher(hex).matches()) {
            throw new IllegalArgumentException("not a 32-byte hex digest: " + hex);
        }
    }

    /**
     * Parses a {@code 0x}-prefixed (or bare) hex string back into a digest of
     * the given family.
     */
    public static Digest parse(DigestFamily family, String value) {
        Objects.requireNonNull(value, "value");
        String hex = value.startsWith(PREFIX) ? value.substring(PREFIX.length()) : value;
        return new Digest(family, hex);
    }

    /** The wire form, {@code 0x} followed by 64 hex chars. */
    @JsonValue
    public String value() {
        return PREFIX + hex;
    }

    @Override
    public String toString() {
        return value();
    }
}
