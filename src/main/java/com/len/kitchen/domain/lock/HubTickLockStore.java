package com.len.kitchen.domain.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * 여러 인스턴스가 같은 허브의 auto-bump tick을 동시에 돌지 않도록 하는 락.
 */
public interface HubTickLockStore {

    /**
     * @return 락을 잡았으면 해제용 토큰
     */
    Optional<String> tryLock(String hubId, Duration ttl);

    void unlock(String hubId, String token);
}
