package com.agrichain.offchain.app;

import com.agrichain.offchain.adapters.storage.InMemoryStorageGateway;
import com.agrichain.offchain.domain.error.ErrorKind;
import com.agrichain.offchain.domain.error.NotFoundException;
import com.agrichain.offchain.domain.error.PinFailedException;
import com.agrichain.offchain.domain.error.SerializationException;
import com.agrichain.offchain.domain.error.StorageUnavailableException;
import com.agrichain.offchain.domain.error.ValidationException;
import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.StoredContent;
import com.agrichain.offchain.domain.model.receipt.FetchedContent;
import com.agrichain.offchain.domain.model.receipt.UploadReceipt;
import com.agrichain.offchain.domain.ports.StorageGateway;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

import static com.agrichain.offchain.support.StageFixtures.JSON;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StorageServiceTest {

    private final InMemoryStorageGateway memory = new InMemoryStorageGateway();
    private final StorageService service = new StorageService(memory, JSON);

    private static ObjectNode doc() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("lot", "L-1");
        node.put("kg", 12.5);
        return node;
    }

    @Test
    void uploadPinsWhenAsked() {
        UploadReceipt receipt = service.upload(doc(), true).block();

        assertThat(receipt.pinned()).isTrue();
        assertThat(receipt.size()).isPositive();
        assertThat(service.pinStatus(receipt.cid()).block().pinned()).isTrue();
    }

    @Test
    void uploadWithoutPin() {
        UploadReceipt receipt = service.upload(doc(), false).block();

        assertThat(receipt.pinned()).isFalse();
        assertThat(service.pinStatus(receipt.cid()).block().pinned()).isFalse();
    }

    @Test
    void fetchReturnsTheStoredJson() {
        UploadReceipt receipt = service.upload(doc(), false).block();
        FetchedContent content = service.fetch(receipt.cid()).block();

        assertThat(content.data().get("lot").asText()).isEqualTo("L-1");
        assertThat(content.data().get("kg").asDouble()).isEqualTo(12.5);
    }

    @Test
    void fetchUnknownAddress() {
        assertThatThrownBy(() -> service.fetch(ContentAddress.of("mem:missing")).block())
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void nonJsonContentIsNotReportedAsRetryable() {
        StorageGateway raw = Mockito.mock(StorageGateway.class);
        ContentAddress cid = ContentAddress.of("QmNotJson");
        when(raw.fetch(cid)).thenReturn(Mono.just("plain text".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> new StorageService(raw, JSON).fetch(cid).block())
                .isInstanceOfSatisfying(SerializationException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.INTERNAL));
    }

    @Test
    void pinThenUnpin() {
        UploadReceipt receipt = service.upload(doc(), false).block();

        assertThat(service.pin(receipt.cid()).block().pinned()).isTrue();
        assertThat(service.unpin(receipt.cid()).block().pinned()).isFalse();
        assertThat(service.pinStatus(receipt.cid()).block().pinned()).isFalse();
    }

    @Test
    void nullDataIsRejected() {
        assertThatThrownBy(() -> service.upload(null, true).block()).isInstanceOf(ValidationException.class);
    }

    @Test
    void uploadFailureMapsToStorageUnavailable() {
        StorageGateway down = Mockito.mock(StorageGateway.class);
        when(down.upload(any())).thenReturn(Mono.error(new IllegalStateException("boom")));

        assertThatThrownBy(() -> new StorageService(down, JSON).upload(doc(), true).block())
                .isInstanceOf(StorageUnavailableException.class);
        verify(down, never()).pin(any());
    }

    @Test
    void pinFailureOnUploadReportsTheAddress() {
        ContentAddress cid = ContentAddress.of("QmDoc");
        StorageGateway gateway = Mockito.mock(StorageGateway.class);
        when(gateway.upload(any())).thenReturn(Mono.just(new StoredContent(cid, 10)));
        when(gateway.pin(cid)).thenReturn(Mono.error(new IllegalStateException("refused")));

        assertThatThrownBy(() -> new StorageService(gateway, JSON).upload(doc(), true).block())
                .isInstanceOfSatisfying(PinFailedException.class, e -> assertThat(e.getAddress()).isEqualTo(cid));
    }
}
