package com.ridedispatch.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{scope}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Registered via FeatureFlagAutoConfiguration (Spring Boot auto-config).
 * Set a flag via Redis CLI:
 *   HSET feature-flags:dispatch dispatch_kill_switch true
 *   HSET feature-flags:global real_time_tracking false
 *
 * Redis being unreachable never fails the caller; the default value wins.
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_SCOPE    = "global";

    public static final String DISPATCH_KILL_SWITCH   = "dispatch_kill_switch";
    public static final String REAL_TIME_TRACKING     = "real_time_tracking";

    private final StringRedisTemplate redisTemplate;
    private final String scope;

    /**
     * Returns true if the flag is enabled for this service's scope.
     * Falls back to the global scope, then to the provided default value.
     */
    public boolean isEnabled(String flagName, boolean defaultValue) {
        try {
            Object scoped = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + scope, flagName);
            if (scoped != null) {
                return Boolean.parseBoolean(scoped.toString());
            }
            Object global = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_SCOPE, flagName);
            if (global != null) {
                return Boolean.parseBoolean(global.toString());
            }
        } catch (DataAccessException e) {
            log.warn("Feature flag '{}' unreadable, using default={}: {}", flagName, defaultValue, e.getMessage());
            return defaultValue;
        }
        log.debug("Feature flag '{}' not found for scope='{}', using default={}", flagName, scope, defaultValue);
        return defaultValue;
    }

    public void setFlag(String flagName, boolean value) {
        redisTemplate.opsForHash().put(FLAG_KEY_PREFIX + scope, flagName, String.valueOf(value));
        log.info("Feature flag set: scope={} flag={} value={}", scope, flagName, value);
    }

    /**
     * Initialise default flags if they are not yet set (called at startup).
     */
    public void initDefaults() {
        String key = FLAG_KEY_PREFIX + scope;
        redisTemplate.opsForHash().putIfAbsent(key, DISPATCH_KILL_SWITCH, "false");
        redisTemplate.opsForHash().putIfAbsent(key, REAL_TIME_TRACKING, "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }

    public String getScope() {
        return scope;
    }
}
