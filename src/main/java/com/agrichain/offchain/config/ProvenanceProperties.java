package com.agrichain.offchain.config;

import com.agrichain.offchain.domain.hash.HashInputEncoding;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;


/**
 * Service configuration.
 *
 * <p>Config keys live under {@code provenance.*}; the IPFS endpoint and
 * environment can also be supplied as {@code IPFS_URL} and
 * {@code ENVIRONMENT} (see {@code application.yml}).
 */
@Validated
@ConfigurationProperties(prefix = "provenance")
public class ProvenanceProperties {

    public enum Environment {
        DEVELOPMENT, PRODUCTION, TEST;

        /** {@code production}/{@code prod} and {@code test} in any case; anything else is development. */
        public static Environment from(String value) {
            String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
            switch (v) {
                case "production":
                case "prod":
                    return PRODUCTION;
                case "test":
                    return TEST;
                default:
                    return DEVELOPMENT;
            }
        }
    }

    /** Reported by the health check. */
    @NotBlank
    private String version = "0.1.0";

    @NotNull
    private Environment environment = Environment.DEVELOPMENT;

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Hashing hashing = new Hashing();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Hashing getHashing() {
        return hashing;
    }

    public void setHashing(Hashing hashing) {
        this.hashing = hashing;
    }

    public static class Storage {

        public enum Backend { IPFS, MEMORY }

        /** Which {@code StorageGateway} is wired. */
        @NotNull
        private Backend backend = Backend.IPFS;

        @Valid
        private Ipfs ipfs = new Ipfs();

        public Backend getBackend() {
            return backend;
        }

        public void setBackend(Backend backend) {
            this.backend = backend;
        }

        public Ipfs getIpfs() {
            return ipfs;
        }

        public void setIpfs(Ipfs ipfs) {
            this.ipfs = ipfs;
        }
    }

    public static class Ipfs {

        /** Base URL of the Kubo RPC API, without the {@code /api/v0} suffix. */
        @NotBlank
        private String url = "http://127.0.0.1:5001";

        /** Per-call response timeout. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /** Retries for fetch and pin calls. Uploads are never retried. */
        @Min(0)
        private int maxRetries = 2;

        @NotNull
        private Duration retryBackoff = Duration.ofMillis(200);

        /** Optional basic-auth credentials for hosted gateways. */
        private String projectId;

        private String projectSecret;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getProjectSecret() {
            return projectSecret;
        }

        public void setProjectSecret(String projectSecret) {
            this.projectSecret = projectSecret;
        }

        public boolean hasCredentials() {
            return projectId != null && !projectId.isBlank()
                    && projectSecret != null && !projectSecret.isBlank();
        }
    }

    public static class Hashing {

        /**
         * How fields are joined before hashing.  {@code DELIMITED} reproduces
         * hashes already anchored on chain; {@code LENGTH_PREFIXED} cannot be
         * confused by delimiters inside values but yields different hashes.
         */
        @NotNull
        private HashInputEncoding inputEncoding = HashInputEncoding.DELIMITED;

        public HashInputEncoding getInputEncoding() {
            return inputEncoding;
        }

        public void setInputEncoding(HashInputEncoding inputEncoding) {
            this.inputEncoding = inputEncoding;
        }
    }
}
