package com.agrichain.offchain.config;

import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;


/** Binds {@code provenance.environment} leniently, so {@code ENVIRONMENT=prod} still starts the service. */
@Component
@ConfigurationPropertiesBinding
public class EnvironmentConverter implements Converter<String, ProvenanceProperties.Environment> {

    @Override
    public ProvenanceProperties.Environment convert(String source) {
        return ProvenanceProperties.Environment.from(source);
    }
}
