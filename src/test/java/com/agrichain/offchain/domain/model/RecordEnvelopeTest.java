package com.agrichain.offchain.domain.model;

import com.agrichain.offchain.domain.hash.Hasher;
import com.agrichain.offchain.domain.model.stage.FpoPurchaseRequest;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordEnvelopeTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private static RecordEnvelope<FpoPurchaseRequest> draft() {
        FpoPurchaseRequest payload = new FpoPurchaseRequest("did:farmer:1", "Green FPO", "B-1", 500.0, 21.5,
                "A", null, null, null, null, null, null);
        return RecordEnvelope.create(StageType.PURCHASE, payload, Map.of(), NOW);
    }

    @Test
    void draftHasNoContentAddress() {
        RecordEnvelope<FpoPurchaseRequest> env = draft();
        assertThat(env.isPersisted()).isFalse();
        assertThat(env.contentAddress()).isEmpty();
        assertThatThrownBy(env::requireContentAddress).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void contentAddressIsSetExactlyOnce() {
        RecordEnvelope<FpoPurchaseRequest> stored = draft().persistedAt(ContentAddress.of("QmFirst"));
        assertThat(stored.requireContentAddress().value()).isEqualTo("QmFirst");
        assertThatThrownBy(() -> stored.persistedAt(ContentAddress.of("QmSecond")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("QmFirst");
    }

    @Test
    void derivedValuesAccumulateWithoutMutatingTheOriginal() {
        RecordEnvelope<FpoPurchaseRequest> env = draft();
        RecordEnvelope<FpoPurchaseRequest> hashed = env.withDerived(
                DerivedHashes.empty().with("batch_hash", Hasher.solidityHash("x")));
        assertThat(env.derivedHashes().isEmpty()).isTrue();
        assertThat(hashed.derivedHashes().digest("batch_hash")).isEqualTo(Hasher.solidityHash("x"));
        assertThat(hashed.createdAt()).isEqualTo(NOW);
    }

    @Test
    void missingIdentifierIsAnError() {
        assertThatThrownBy(() -> draft().identifier("farmer_did")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void absentListsBindAsEmpty() {
        assertThat(draft().payload().photos()).isEqualTo(List.of());
    }
}
