package com.ridedispatch.dispatch.config;

import com.ridedispatch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;

/**
 * Seeds default feature flags for this service's scope on startup.
 * Flags already set in Redis are NOT overwritten (putIfAbsent).
 *
 * To toggle a flag at runtime without restart:
 *   redis-cli HSET feature-flags:dispatch-service dispatch_kill_switch true
 *   redis-cli HSET feature-flags:dispatch-service real_time_tracking false
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedFeatureFlags() {
        return args -> {
            try {
                featureFlagService.initDefaults();
                log.info("Feature flags initialised for scope={}", featureFlagService.getScope());
            } catch (DataAccessException e) {
                log.warn("Feature flags not seeded, defaults apply until Redis is reachable: {}", e.getMessage());
            }
        };
    }
}
