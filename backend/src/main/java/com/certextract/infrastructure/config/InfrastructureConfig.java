package com.certextract.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class InfrastructureConfig {

    @Value("${http.connect-timeout-seconds:5}")
    private long connectTimeoutSeconds;

    @Value("${http.read-timeout-seconds:120}")
    private long readTimeoutSeconds;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared by the REST-based providers. Per-call ceilings come from the resilience pool.
     */
    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
                .build();
    }
}
