package com.agrichain.offchain.app;

import com.agrichain.offchain.domain.error.NotFoundException;
import com.agrichain.offchain.domain.error.PinFailedException;
import com.agrichain.offchain.domain.error.ProvenanceException;
import com.agrichain.offchain.domain.error.SerializationException;
import com.agrichain.offchain.domain.error.StorageUnavailableException;
import com.agrichain.offchain.domain.error.ValidationException;
import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.receipt.FetchedContent;
import com.agrichain.offchain.domain.model.receipt.PinStatus;
import com.agrichain.offchain.domain.model.receipt.UploadReceipt;
import com.agrichain.offchain.domain.ports.StorageGateway;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;


/**
 * Generic JSON storage on top of {@link StorageGateway}, without any stage
 * semantics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageService {

    private final StorageGateway storage;
    private final CanonicalJson json;

    /** Stores {@code data} and pins it only when {@code pin} is set. */
    public Mono<UploadReceipt> upload(JsonNode data, boolean pin) {
        return Mono.defer(() -> {
            if (data == null || data.isNull() || data.isMissingNode()) {
                return Mono.error(new ValidationException("data: must not be null"));
            }
            return storage.upload(json.toBytes(data))
                    .onErrorMap(e -> !(e instanceof ProvenanceException),
                            e -> new StorageUnavailableException("Failed to upload content", e))
                    .doOnNext(stored -> log.debug("Uploaded {} bytes as {}", stored.size(), stored.address()))
                    .flatMap(stored -> pin
                            ? pinOrFail(stored.address()).thenReturn(new UploadReceipt(stored.address(), stored.size(), true))
                            : Mono.just(new UploadReceipt(stored.address(), stored.size(), false)));
        });
    }

    public Mono<FetchedContent> fetch(ContentAddress address) {
        return storage.fetch(address)
                .switchIfEmpty(Mono.error(() -> new NotFoundException(address)))
                .map(bytes -> {
                    try {
                        return new FetchedContent(address, json.parse(bytes));
                    } catch (IOException e) {
                        throw new SerializationException("content at " + address + " is not valid JSON", e);
                    }
                })
                .doOnNext(c -> log.debug("Fetched {}", address));
    }

    public Mono<PinStatus> pin(ContentAddress address) {
        return pinOrFail(address)
                .doOnSuccess(v -> log.debug("Pinned {}", address))
                .thenReturn(new PinStatus(address, true));
    }

    public Mono<PinStatus> unpin(ContentAddress address) {
        return storage.unpin(address)
                .onErrorMap(e -> !(e instanceof ProvenanceException),
                        e -> new StorageUnavailableException("Failed to unpin " + address, e))
                .doOnSuccess(v -> log.debug("Unpinned {}", address))
                .thenReturn(new PinStatus(address, false));
    }

    public Mono<PinStatus> pinStatus(ContentAddress address) {
        return storage.isPinned(address)
                .onErrorMap(e -> !(e instanceof ProvenanceException),
                        e -> new StorageUnavailableException("Failed to read pin status of " + address, e))
                .defaultIfEmpty(false)
                .map(pinned -> new PinStatus(address, pinned));
    }

    private Mono<Void> pinOrFail(ContentAddress address) {
        return storage.pin(address)
                .doOnError(e -> log.warn("Pinning {} failed: {}", address, e.toString()))
                .onErrorMap(e -> !(e instanceof PinFailedException), e -> new PinFailedException(address, e));
    }
}
