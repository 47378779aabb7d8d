package com.agrichain.offchain.config;

import com.agrichain.offchain.app.IdGenerator;
import com.agrichain.offchain.app.UuidIdGenerator;
import com.agrichain.offchain.app.stage.StageHashing;
import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.hash.CommitRevealCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;


@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CanonicalJson canonicalJson() {
        return new CanonicalJson();
    }

    @Bean
    public CommitRevealCodec commitRevealCodec(CanonicalJson canonicalJson) {
        return CommitRevealCodec.withDrbg(canonicalJson);
    }

    @Bean
    public StageHashing stageHashing(ProvenanceProperties props, CommitRevealCodec commitRevealCodec) {
        log.info("Hash input encoding: {}", props.getHashing().getInputEncoding());
        return new StageHashing(props.getHashing().getInputEncoding(), commitRevealCodec);
    }

    @Bean
    public IdGenerator idGenerator() {
        return new UuidIdGenerator();
    }
}
