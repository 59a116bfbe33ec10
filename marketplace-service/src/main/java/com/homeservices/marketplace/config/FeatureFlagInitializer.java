package com.homeservices.marketplace.config;

import com.homeservices.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds the marketplace feature flags on startup without overwriting
 * values already present in Redis.
 *
 * Runtime toggles:
 *   redis-cli HSET feature-flags:marketplace double_booking_guard true
 *   redis-cli HSET feature-flags:marketplace booking_kill_switch true
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedFeatureFlags() {
        return args -> {
            featureFlagService.initDefaults(FeatureFlagService.DEFAULT_SCOPE);
            log.info("Feature flags initialised for scope={}", FeatureFlagService.DEFAULT_SCOPE);
        };
    }
}
