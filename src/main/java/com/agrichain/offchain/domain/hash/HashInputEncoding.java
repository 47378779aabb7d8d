package com.agrichain.offchain.domain.hash;


/**
 * How a stage's formatted fields are framed into the bytes that get hashed.
 *
 * <p>{@link #DELIMITED} reproduces the hashes already anchored on chain byte for
 * byte, but two different field lists can collide when a value contains the
 * delimiter ({@code "a-b","c"} vs {@code "a","b-c"}).  {@link #LENGTH_PREFIXED}
 * is unambiguous and yields different digests, so switching is a deliberate
 * break with previously anchored hashes.
 */
public enum HashInputEncoding {

    /** Fields joined with {@code '-'}. */
    DELIMITED,

    /** Each field as a 4-byte big-endian length followed by its UTF-8 bytes. */
    LENGTH_PREFIXED
}
