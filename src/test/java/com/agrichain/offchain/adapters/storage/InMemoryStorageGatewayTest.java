package com.agrichain.offchain.adapters.storage;

import com.agrichain.offchain.domain.error.NotFoundException;
import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.StoredContent;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStorageGatewayTest {

    private final InMemoryStorageGateway gateway = new InMemoryStorageGateway();

    @Test
    void storesAndReturnsCopies() {
        byte[] data = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
        StoredContent stored = gateway.upload(data).block();
        data[0] = 'X';

        assertThat(stored.address().value()).startsWith("mem:");
        assertThat(stored.size()).isEqualTo(7);
        assertThat(new String(gateway.fetch(stored.address()).block(), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
    }

    @Test
    void pinLifecycle() {
        ContentAddress cid = gateway.upload(new byte[]{1, 2}).block().address();

        assertThat(gateway.isPinned(cid).block()).isFalse();
        gateway.pin(cid).block();
        gateway.pin(cid).block();
        assertThat(gateway.isPinned(cid).block()).isTrue();
        gateway.unpin(cid).block();
        assertThat(gateway.isPinned(cid).block()).isFalse();
    }

    @Test
    void unknownAddress() {
        ContentAddress cid = ContentAddress.of("mem:unknown");
        assertThatThrownBy(() -> gateway.fetch(cid).block()).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> gateway.pin(cid).block()).isInstanceOf(NotFoundException.class);
    }
}
