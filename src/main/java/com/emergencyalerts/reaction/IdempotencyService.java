package com.emergencyalerts.reaction;

import com.emergencyalerts.config.RedisConfig;
import com.emergencyalerts.domain.model.ReactionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Claims idempotency keys of broadcast-only reactions in Redis.
 *
 * <p>A claim is a {@code SET NX} with the configured TTL, so the first delivery of a key wins
 * and repeats inside the TTL are dropped. If Redis is unreachable the claim is granted: the
 * broadcast is advisory, so a possible duplicate message beats a lost one.
 *
 * <p>Key schema: {@code ea:reaction:dedup:{idempotencyKey}}
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    public static final String KEY_PREFIX = RedisConfig.KEY_PREFIX_REACTION_DEDUP;

    private final StringRedisTemplate stringRedisTemplate;
    private final ReactionSettings reactionSettings;

    public IdempotencyService(StringRedisTemplate stringRedisTemplate, ReactionSettings reactionSettings) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.reactionSettings = reactionSettings;
    }

    /**
     * @return true if this caller is the first to claim the key within the TTL (or Redis is
     *     unavailable), false if the key was already claimed
     */
    public boolean claim(String idempotencyKey) {
        String redisKey = KEY_PREFIX + idempotencyKey;
        try {
            Boolean claimed = stringRedisTemplate.opsForValue()
                    .setIfAbsent(redisKey, "1", reactionSettings.getDedupTtl());
            if (Boolean.FALSE.equals(claimed)) {
                log.debug("Reaction key already claimed: {}", redisKey);
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("Dedup cache unavailable for {}, proceeding without dedup: {}", redisKey, e.getMessage());
            return true;
        }
    }
}
