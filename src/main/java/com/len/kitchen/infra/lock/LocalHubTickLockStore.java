package com.len.kitchen.infra.lock;

import com.len.kitchen.domain.lock.HubTickLockStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 단일 인스턴스(로컬/테스트)용 in-process 락.
 */
@Component
@ConditionalOnProperty(name = "kitchen.auto-bump.lock-store", havingValue = "local")
public class LocalHubTickLockStore implements HubTickLockStore {

    private final Map<String, Held> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<String> tryLock(String hubId, Duration ttl) {
        String token = UUID.randomUUID().toString();
        long now = System.nanoTime();
        Held mine = new Held(token, now + ttl.toNanos());

        Held result = locks.compute(hubId, (k, current) ->
                (current == null || current.expiresAtNanos() - now <= 0) ? mine : current);

        return result == mine ? Optional.of(token) : Optional.empty();
    }

    @Override
    public void unlock(String hubId, String token) {
        locks.computeIfPresent(hubId, (k, current) -> current.token().equals(token) ? null : current);
    }

    private record Held(String token, long expiresAtNanos) {}
}
