package com.agrichain.offchain.domain.ports;

import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.StoredContent;
import reactor.core.publisher.Mono;


/**
 * Content-addressed storage collaborator.  One instance is shared by every
 * request and must tolerate concurrent use.  Timeouts, retries and
 * credentials are the implementation's concern.
 *
 * <p>Failures are signalled as
 * {@link com.agrichain.offchain.domain.error.StorageUnavailableException},
 * except for {@link #fetch} of an unknown address which signals
 * {@link com.agrichain.offchain.domain.error.NotFoundException}.  Re-uploading
 * identical bytes is not guaranteed to return the same address.
 */
public interface StorageGateway {

    Mono<StoredContent> upload(byte[] content);

    Mono<byte[]> fetch(ContentAddress address);

    /** Protects the content from garbage collection.  Re-pinning is harmless. */
    Mono<Void> pin(ContentAddress address);

    Mono<Void> unpin(ContentAddress address);

    Mono<Boolean> isPinned(ContentAddress address);
}
