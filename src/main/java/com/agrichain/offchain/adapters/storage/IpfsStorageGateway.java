package com.agrichain.offchain.adapters.storage;

import com.agrichain.offchain.domain.error.NotFoundException;
import com.agrichain.offchain.domain.error.StorageUnavailableException;
import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.StoredContent;
import com.agrichain.offchain.domain.ports.StorageGateway;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;


/**
 * {@link StorageGateway} over the Kubo (go-ipfs) RPC API.  Every call is a
 * {@code POST /api/v0/...}; errors come back as HTTP 500 with a JSON body
 * {@code {"Message": ..., "Code": ..., "Type": "error"}}.
 *
 * <p>The {@link WebClient} is expected to carry the base URL, the response
 * timeout and credentials.  Uploads are sent once; the other calls are
 * retried with exponential backoff on transport and server errors.
 */
@Slf4j
public class IpfsStorageGateway implements StorageGateway {

    private static final String API = "/api/v0";

    private final WebClient client;
    private final ObjectMapper mapper;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryBackoff;

    public IpfsStorageGateway(WebClient client, ObjectMapper mapper,
                              Duration timeout, int maxRetries, Duration retryBackoff) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.maxRetries = maxRetries;
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
    }

    @Override
    public Mono<StoredContent> upload(byte[] content) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", content)
                .filename("record.json")
                .contentType(MediaType.APPLICATION_JSON);
        return client.post()
                .uri(b -> b.path(API + "/add").queryParam("pin", "false").build())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .map(this::parseAdd)
                .onErrorMap(e -> toStorageError("add", null, e));
    }

    @Override
    public Mono<byte[]> fetch(ContentAddress address) {
        return client.post()
                .uri(b -> b.path(API + "/cat").queryParam("arg", address.value()).build())
                .retrieve()
                .bodyToMono(byte[].class)
                .timeout(timeout)
                .switchIfEmpty(Mono.just(new byte[0]))
                .onErrorMap(e -> isMissing(e) ? new NotFoundException(address, e) : toStorageError("cat", address, e))
                .retryWhen(retry("cat", address));
    }

    @Override
    public Mono<Void> pin(ContentAddress address) {
        return call("pin/add", address)
                .then();
    }

    @Override
    public Mono<Void> unpin(ContentAddress address) {
        return call("pin/rm", address)
                .onErrorResume(IpfsStorageGateway::isNotPinned, e -> Mono.just(""))
                .then();
    }

    @Override
    public Mono<Boolean> isPinned(ContentAddress address) {
        return client.post()
                .uri(b -> b.path(API + "/pin/ls")
                        .queryParam("arg", address.value())
                        .queryParam("type", "recursive")
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .map(json -> listsKey(json, address))
                .onErrorResume(IpfsStorageGateway::isNotPinned, e -> Mono.just(false))
                .onErrorMap(e -> toStorageError("pin/ls", address, e))
                .retryWhen(retry("pin/ls", address));
    }

    private Mono<String> call(String command, ContentAddress address) {
        return client.post()
                .uri(b -> b.path(API + "/" + command).queryParam("arg", address.value()).build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .defaultIfEmpty("")
                .onErrorResume(e -> isNotPinned(e) ? Mono.error(e) : Mono.error(toStorageError(command, address, e)))
                .retryWhen(retry(command, address));
    }

    private StoredContent parseAdd(String json) {
        try {
            JsonNode node = mapper.readTree(json);
            String hash = node.path("Hash").asText("");
            if (hash.isBlank()) {
                throw new StorageUnavailableException("IPFS add returned no hash: " + json);
            }
            return new StoredContent(ContentAddress.of(hash), node.path("Size").asLong(0));
        } catch (IOException e) {
            throw new StorageUnavailableException("IPFS add returned malformed JSON", e);
        }
    }

    private boolean listsKey(String json, ContentAddress address) {
        try {
            return mapper.readTree(json).path("Keys").has(address.value());
        } catch (IOException e) {
            throw new StorageUnavailableException("IPFS pin/ls returned malformed JSON", e);
        }
    }

    private Retry retry(String command, ContentAddress address) {
        return Retry.backoff(maxRetries, retryBackoff)
                .filter(e -> e instanceof StorageUnavailableException)
                .doBeforeRetry(s -> log.warn("Retrying IPFS {} {} (attempt {}): {}",
                        command, address, s.totalRetries() + 1, s.failure().getMessage()))
                .onRetryExhaustedThrow((spec, s) -> s.failure());
    }

    private Throwable toStorageError(String command, ContentAddress address, Throwable e) {
        if (e instanceof StorageUnavailableException || e instanceof NotFoundException) {
            return e;
        }
        String target = address == null ? "" : " " + address;
        if (e instanceof TimeoutException) {
            return new StorageUnavailableException("IPFS " + command + target + " timed out after " + timeout, e);
        }
        return new StorageUnavailableException("IPFS " + command + target + " failed: " + errorMessage(e), e);
    }

    private static boolean isNotPinned(Throwable e) {
        return errorMessage(e).toLowerCase(Locale.ROOT).contains("not pinned");
    }

    private static boolean isMissing(Throwable e) {
        if (e instanceof WebClientResponseException w && w.getStatusCode().value() == 404) {
            return true;
        }
        String msg = errorMessage(e).toLowerCase(Locale.ROOT);
        return msg.contains("not found") || msg.contains("invalid path") || msg.contains("invalid cid");
    }

    private static String errorMessage(Throwable e) {
        if (e instanceof WebClientResponseException w) {
            String body = w.getResponseBodyAsString();
            return body.isBlank() ? w.getMessage() : body;
        }
        return String.valueOf(e.getMessage());
    }
}
