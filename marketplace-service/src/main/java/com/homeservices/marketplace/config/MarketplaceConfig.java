package com.homeservices.marketplace.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class MarketplaceConfig {

    /** Booking dates are validated against this clock's "today". */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RestTemplate geocodingRestTemplate(RestTemplateBuilder builder,
                                              @Value("${marketplace.geocoding.connect-timeout-ms:2000}") long connectTimeoutMs,
                                              @Value("${marketplace.geocoding.read-timeout-ms:3000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
