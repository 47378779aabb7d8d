package com.agrichain.offchain.adapters.storage;

import com.agrichain.offchain.domain.error.NotFoundException;
import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.StoredContent;
import com.agrichain.offchain.domain.ports.StorageGateway;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;


/**
 * Process-local storage for development and tests.  Addresses are
 * {@code mem:<sha256>} of the content; nothing survives a restart.
 */
@Slf4j
public class InMemoryStorageGateway implements StorageGateway {

    private static final String PREFIX = "mem:";

    private final Map<ContentAddress, byte[]> blobs = new ConcurrentHashMap<>();
    private final Set<ContentAddress> pinned = ConcurrentHashMap.newKeySet();

    @Override
    public Mono<StoredContent> upload(byte[] content) {
        return Mono.fromCallable(() -> {
            ContentAddress address = ContentAddress.of(PREFIX + DigestUtils.sha256Hex(content));
            blobs.putIfAbsent(address, content.clone());
            log.debug("Stored {} bytes in memory as {}", content.length, address);
            return new StoredContent(address, content.length);
        });
    }

    @Override
    public Mono<byte[]> fetch(ContentAddress address) {
        return Mono.defer(() -> {
            byte[] content = blobs.get(address);
            return content == null
                    ? Mono.error(new NotFoundException(address))
                    : Mono.just(content.clone());
        });
    }

    @Override
    public Mono<Void> pin(ContentAddress address) {
        return Mono.defer(() -> {
            if (!blobs.containsKey(address)) {
                return Mono.error(new NotFoundException(address));
            }
            pinned.add(address);
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> unpin(ContentAddress address) {
        return Mono.fromRunnable(() -> pinned.remove(address));
    }

    @Override
    public Mono<Boolean> isPinned(ContentAddress address) {
        return Mono.fromCallable(() -> pinned.contains(address));
    }
}
