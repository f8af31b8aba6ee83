package com.len.kitchen.infra.redis;

import com.len.kitchen.domain.lock.HubTickLockStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 멀티 인스턴스 배포용. SET NX PX로 잡고, 내 토큰일 때만 지운다.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "kitchen.auto-bump.lock-store", havingValue = "redis", matchIfMissing = true)
public class RedisHubTickLockStore implements HubTickLockStore {

    private static final RedisScript<Long> UNLOCK_SCRIPT = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
            Long.class
    );

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> tryLock(String hubId, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Boolean locked = redis.opsForValue().setIfAbsent(KitchenRedisKeys.autoBumpLockKey(hubId), token, ttl);

        // null 이면 실패로 취급
        return Boolean.TRUE.equals(locked) ? Optional.of(token) : Optional.empty();
    }

    @Override
    public void unlock(String hubId, String token) {
        redis.execute(UNLOCK_SCRIPT, List.of(KitchenRedisKeys.autoBumpLockKey(hubId)), token);
    }
}
