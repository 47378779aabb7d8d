package com.agrichain.offchain.domain.model;

import com.agrichain.offchain.domain.model.stage.StagePayload;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;


/**
 * Canonical record for one stage invocation.  Wraps the accepted payload with
 * generated identifiers, the creation timestamp and the derived hashes.  The
 * content address is absent until the record has been stored and can be set
 * exactly once; instances are otherwise immutable and live for a single
 * request.
 */
public final class RecordEnvelope<P extends StagePayload> {

    private final StageType stage;
    private final P payload;
    private final Map<String, String> identifiers;
    private final Instant createdAt;
    private final DerivedHashes derivedHashes;
    private final ContentAddress contentAddress;

    private RecordEnvelope(StageType stage, P payload, Map<String, String> identifiers,
                           Instant createdAt, DerivedHashes derivedHashes, ContentAddress contentAddress) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.identifiers = identifiers;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.derivedHashes = Objects.requireNonNull(derivedHashes, "derivedHashes");
        this.contentAddress = contentAddress;
    }

    public static <P extends StagePayload> RecordEnvelope<P> create(
            StageType stage, P payload, Map<String, String> identifiers, Instant createdAt) {
        return new RecordEnvelope<>(stage, payload, Map.copyOf(identifiers), createdAt,
                DerivedHashes.empty(), null);
    }

    /** Returns a copy carrying the given derived values in addition to the current ones. */
    public RecordEnvelope<P> withDerived(DerivedHashes more) {
        return new RecordEnvelope<>(stage, payload, identifiers, createdAt,
                derivedHashes.merge(more), contentAddress);
    }

    /**
     * Returns a copy bound to the storage location of this record.
     *
     * @throws IllegalStateException if the address was already set
     */
    public RecordEnvelope<P> persistedAt(ContentAddress address) {
        Objects.requireNonNull(address, "address");
        if (contentAddress != null) {
            throw new IllegalStateException(
                    "content address already set to " + contentAddress + " for " + stage.label());
        }
        return new RecordEnvelope<>(stage, payload, identifiers, createdAt, derivedHashes, address);
    }

    public StageType stage() {
        return stage;
    }

    public P payload() {
        return payload;
    }

    public String identifier(String name) {
        String id = identifiers.get(name);
        if (id == null) {
            throw new IllegalArgumentException("no identifier '" + name + "' on " + stage.label() + " record");
        }
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public DerivedHashes derivedHashes() {
        return derivedHashes;
    }

    public Optional<ContentAddress> contentAddress() {
        return Optional.ofNullable(contentAddress);
    }

    public boolean isPersisted() {
        return contentAddress != null;
    }

    /**
     * The content address of a persisted record.
     *
     * @throws IllegalStateException if the record has not been stored yet
     */
    public ContentAddress requireContentAddress() {
        if (contentAddress == null) {
            throw new IllegalStateException(stage.label() + " record is not persisted yet");
        }
        return contentAddress;
    }

    @Override
    public String toString() {
        return "RecordEnvelope{" + stage + ", createdAt=" + createdAt
                + ", derived=" + derivedHashes.asMap().keySet()
                + ", cid=" + contentAddress + '}';
    }
}
