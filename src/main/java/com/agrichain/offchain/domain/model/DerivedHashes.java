package com.agrichain.offchain.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;


/**
 * Immutable, insertion-ordered set of stage-specific derived values: single
 * digests, digest lists (one per processing output), merkle roots and the
 * commit-reveal nonce.  Every mutator returns a new instance.
 */
public final class DerivedHashes {

    private static final DerivedHashes EMPTY = new DerivedHashes(Map.of());

    private final Map<String, Object> values;

    private DerivedHashes(Map<String, Object> values) {
        this.values = values;
    }

    public static DerivedHashes empty() {
        return EMPTY;
    }

    public DerivedHashes with(String name, Digest digest) {
        return put(name, Objects.requireNonNull(digest, name));
    }

    public DerivedHashes withAll(String name, List<Digest> digests) {
        return put(name, List.copyOf(digests));
    }

    /** Adds a plain string value such as a merkle root over raw leaves or a nonce. */
    public DerivedHashes withValue(String name, String value) {
        return put(name, Objects.requireNonNull(value, name));
    }

    public DerivedHashes merge(DerivedHashes other) {
        DerivedHashes out = this;
        for (Map.Entry<String, Object> e : other.values.entrySet()) {
            out = out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Digest digest(String name) {
        Object v = values.get(name);
        if (v instanceof Digest d) {
            return d;
        }
        throw new IllegalArgumentException("no digest named '" + name + "' in " + values.keySet());
    }

    @SuppressWarnings("unchecked")
    public List<Digest> digests(String name) {
        Object v = values.get(name);
        if (v instanceof List<?> list) {
            return (List<Digest>) list;
        }
        throw new IllegalArgumentException("no digest list named '" + name + "' in " + values.keySet());
    }

    public String value(String name) {
        Object v = values.get(name);
        if (v == null) {
            throw new IllegalArgumentException("no value named '" + name + "' in " + values.keySet());
        }
        return v.toString();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private DerivedHashes put(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (values.containsKey(name)) {
            throw new IllegalStateException("derived value already set: " + name);
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new DerivedHashes(Collections.unmodifiableMap(copy));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DerivedHashes other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "DerivedHashes" + values;
    }
}
