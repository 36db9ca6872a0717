package com.lintmux.child;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ChildConfig {

    @Bean
    @ConditionalOnMissingBean
    public ChildDiscovery manifestChildDiscovery(ObjectMapper objectMapper, ChildProperties properties) {
        return new ManifestChildDiscovery(objectMapper, properties.getManifestName());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChildConnector processChildConnector(ObjectMapper objectMapper, ChildProperties properties) {
        return new ProcessChildConnector(objectMapper, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }
}
