package com.homeservices.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{scope}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * A flag set under the service's own scope wins over the same flag under
 * the "global" scope. Toggle at runtime with:
 *   HSET feature-flags:marketplace double_booking_guard true
 *   HSET feature-flags:global booking_kill_switch true
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_SCOPE    = "global";

    public static final String DEFAULT_SCOPE = "marketplace";

    public static final String DOUBLE_BOOKING_GUARD = "double_booking_guard";
    public static final String BOOKING_KILL_SWITCH  = "booking_kill_switch";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Returns true if the flag is enabled for the given scope.
     * Falls back to the global scope, then to the provided default value.
     */
    public boolean isEnabled(String scope, String flagName, boolean defaultValue) {
        Object scopedVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + scope, flagName);
        if (scopedVal != null) {
            return Boolean.parseBoolean(scopedVal.toString());
        }

        Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_SCOPE, flagName);
        if (globalVal != null) {
            return Boolean.parseBoolean(globalVal.toString());
        }

        log.debug("Feature flag '{}' not found for scope='{}', using default={}", flagName, scope, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_SCOPE, flagName, defaultValue);
    }

    /**
     * Seeds defaults without overwriting flags that operators already set.
     */
    public void initDefaults(String scope) {
        String key = FLAG_KEY_PREFIX + scope;
        redisTemplate.opsForHash().putIfAbsent(key, DOUBLE_BOOKING_GUARD, "false");
        redisTemplate.opsForHash().putIfAbsent(key, BOOKING_KILL_SWITCH, "false");
        redisTemplate.expire(key, Duration.ofDays(365));
    }
}
