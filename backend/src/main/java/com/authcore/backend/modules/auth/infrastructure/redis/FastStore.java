package com.authcore.backend.modules.auth.infrastructure.redis;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value store for short-lived auth state: lockout counters and flags, rate-limit windows, pending
 * purpose tokens and the TOTP replay guard.
 *
 * <p>Every operation either completes or throws {@link com.authcore.backend.global.error.StoreUnavailableException};
 * callers decide whether that fails open or closed.</p>
 */
public interface FastStore {

    /**
     * Atomically increments {@code key} and starts its expiry on the first increment of a window.
     *
     * @return the value after the increment
     */
    long incrementWithExpiry(String key, Duration window);

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Atomically stores {@code value} when {@code key} is absent or holds a smaller number.
     *
     * @return {@code true} if the value was written
     */
    boolean setIfGreater(String key, long value, Duration ttl);

    /**
     * Atomically reads and removes {@code key}.
     */
    Optional<String> getAndDelete(String key);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * Remaining lifetime of {@code key}, or {@link Duration#ZERO} if it is absent or has no expiry.
     */
    Duration timeToLive(String key);
}
