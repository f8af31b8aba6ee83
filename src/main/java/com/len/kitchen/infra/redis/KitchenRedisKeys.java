package com.len.kitchen.infra.redis;

public final class KitchenRedisKeys {

    // auto-bump tick 락 (허브 단위): kitchen:autobump:lock:{hubId}
    public static final String AUTO_BUMP_LOCK_PREFIX = "kitchen:autobump:lock:";

    private KitchenRedisKeys() {}

    public static String autoBumpLockKey(String hubId) {
        return AUTO_BUMP_LOCK_PREFIX + hubId;
    }
}
