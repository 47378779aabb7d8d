package com.agrichain.offchain.config;

import com.agrichain.offchain.adapters.storage.InMemoryStorageGateway;
import com.agrichain.offchain.adapters.storage.IpfsStorageGateway;
import com.agrichain.offchain.domain.ports.StorageGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunctions;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;


/**
 * Wires the single shared {@link StorageGateway}.  The IPFS backend gets one
 * {@link WebClient} with the configured base URL, response timeout and, when
 * configured, basic-auth credentials.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ProvenanceProperties.class)
public class StorageConfig {

    @Bean
    public StorageGateway storageGateway(ProvenanceProperties props, WebClient.Builder builder, ObjectMapper mapper) {
        ProvenanceProperties.Storage storage = props.getStorage();
        if (storage.getBackend() == ProvenanceProperties.Storage.Backend.MEMORY) {
            log.warn("Using in-memory storage; records are lost on restart");
            return new InMemoryStorageGateway();
        }
        ProvenanceProperties.Ipfs ipfs = storage.getIpfs();
        log.info("Using IPFS storage at {}", ipfs.getUrl());
        return new IpfsStorageGateway(ipfsWebClient(ipfs, builder), mapper,
                ipfs.getTimeout(), ipfs.getMaxRetries(), ipfs.getRetryBackoff());
    }

    private static WebClient ipfsWebClient(ProvenanceProperties.Ipfs ipfs, WebClient.Builder builder) {
        WebClient.Builder b = builder.clone()
                .baseUrl(ipfs.getUrl())
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create().responseTimeout(ipfs.getTimeout())))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
        if (ipfs.hasCredentials()) {
            b.filter(ExchangeFilterFunctions.basicAuthentication(ipfs.getProjectId(), ipfs.getProjectSecret()));
        }
        return b.build();
    }
}
