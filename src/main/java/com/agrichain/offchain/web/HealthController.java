package com.agrichain.offchain.web;

import com.agrichain.offchain.config.ProvenanceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;


@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE = "offchain-ipfs-service";

    private final ProvenanceProperties props;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE);
        body.put("version", props.getVersion());
        body.put("environment", props.getEnvironment().name().toLowerCase(Locale.ROOT));
        return body;
    }
}
