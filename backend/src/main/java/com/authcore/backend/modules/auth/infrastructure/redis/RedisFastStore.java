package com.authcore.backend.modules.auth.infrastructure.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.authcore.backend.global.error.StoreUnavailableException;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

@Component
public class RedisFastStore implements FastStore {

    // INCR then PEXPIRE on the first hit, or when an earlier crash left the key without a TTL
    private static final RedisScript<Long> INCREMENT_WITH_EXPIRY_SCRIPT = new DefaultRedisScript<>("""
            local count = redis.call('INCR', KEYS[1])
            if count == 1 or redis.call('PTTL', KEYS[1]) < 0 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return count
            """, Long.class);

    private static final RedisScript<Long> SET_IF_GREATER_SCRIPT = new DefaultRedisScript<>("""
            local current = tonumber(redis.call('GET', KEYS[1]))
            if current and current >= tonumber(ARGV[1]) then
              return 0
            end
            redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2])
            return 1
            """, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisFastStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long incrementWithExpiry(String key, Duration window) {
        Long count = execute(() -> redisTemplate.execute(
                INCREMENT_WITH_EXPIRY_SCRIPT,
                List.of(key),
                Long.toString(window.toMillis())
        ));
        if (count == null) {
            throw new StoreUnavailableException("Counter script returned no value", null);
        }
        return count;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(execute(() -> redisTemplate.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        execute(() -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfGreater(String key, long value, Duration ttl) {
        Long written = execute(() -> redisTemplate.execute(
                SET_IF_GREATER_SCRIPT,
                List.of(key),
                Long.toString(value),
                Long.toString(ttl.toMillis())
        ));
        return written != null && written == 1L;
    }

    @Override
    public Optional<String> getAndDelete(String key) {
        return Optional.ofNullable(execute(() -> redisTemplate.opsForValue().getAndDelete(key)));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(execute(() -> redisTemplate.delete(key)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute(() -> redisTemplate.hasKey(key)));
    }

    @Override
    public Duration timeToLive(String key) {
        Long millis = execute(() -> redisTemplate.getExpire(key, TimeUnit.MILLISECONDS));
        if (millis == null || millis <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(millis);
    }

    private <T> T execute(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Fast store unavailable", ex);
        }
    }
}
