package com.emergencyalerts.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis is used only as the dedup cache for reactions that are not persisted.
 *
 * <p>All keys are prefixed with "ea:" because the Redis server may be shared.
 *
 * <p>Key schema:
 * <pre>
 *   ea:reaction:dedup:{idempotencyKey} → "1" (TTL = emergency-alerts.reactions.dedup-ttl)
 * </pre>
 */
@Configuration
public class RedisConfig {

    /** Global prefix for all keys. */
    public static final String KEY_PREFIX = "ea:";

    public static final String KEY_PREFIX_REACTION_DEDUP = KEY_PREFIX + "reaction:dedup:";

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory redisConnectionFactory) {
        return new StringRedisTemplate(redisConnectionFactory);
    }
}
