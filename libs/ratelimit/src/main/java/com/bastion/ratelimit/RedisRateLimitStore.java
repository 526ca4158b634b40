package com.bastion.ratelimit;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * {@link RateLimitStore} backed by Redis. Each bucket is a hash under
 * {@code rate_limit:{tenantId}} with fields {@code tokens} and {@code last_refill}; the whole
 * refill-check-decrement runs server-side in one Lua script, so concurrent gateway nodes
 * cannot interleave on a bucket.
 * <p>
 * The script receives the calling node's clock. Skew between nodes shifts refills by the skew
 * and is bounded by the burst cap. The script replies with a single {@code admitted:tokens}
 * string.
 */
public class RedisRateLimitStore implements RateLimitStore {

    public static final String KEY_PREFIX = "rate_limit:";

    static final String REFILL_AND_DECREMENT_SCRIPT = """
            local rate = tonumber(ARGV[1])
            local burst = tonumber(ARGV[2])
            local now = tonumber(ARGV[3])
            local ttl = tonumber(ARGV[4])
            local state = redis.call('HMGET', KEYS[1], 'tokens', 'last_refill')
            local tokens = tonumber(state[1])
            local last = tonumber(state[2])
            if tokens == nil or last == nil then
              tokens = burst
              last = now
            end
            local elapsed = math.max(0, now - last) / 1000
            tokens = math.min(burst, tokens + elapsed * rate)
            local admitted = 0
            if tokens >= 1 then
              tokens = tokens - 1
              admitted = 1
            end
            redis.call('HSET', KEYS[1], 'tokens', tostring(tokens), 'last_refill', tostring(now))
            redis.call('PEXPIRE', KEYS[1], ttl)
            return tostring(admitted) .. ':' .. tostring(tokens)
            """;

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<String> script;
    private final long stateTtlMillis;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, InMemoryRateLimitStore.DEFAULT_STATE_TTL);
    }

    public RedisRateLimitStore(StringRedisTemplate redisTemplate, Duration stateTtl) {
        if (stateTtl == null || stateTtl.isZero() || stateTtl.isNegative()) {
            throw new IllegalArgumentException("stateTtl must be positive");
        }
        this.redisTemplate = redisTemplate;
        this.script = new DefaultRedisScript<>(REFILL_AND_DECREMENT_SCRIPT, String.class);
        this.stateTtlMillis = stateTtl.toMillis();
    }

    @Override
    public ConsumeResult refillAndDecrement(String key, BucketLimits limits, Instant now) {
        String reply;
        try {
            reply = redisTemplate.execute(script, List.of(KEY_PREFIX + key),
                    Double.toString(limits.ratePerSecond()),
                    Integer.toString(limits.burst()),
                    Long.toString(now.toEpochMilli()),
                    Long.toString(stateTtlMillis));
        } catch (DataAccessException e) {
            throw new RateLimitStoreUnavailableException("Redis rate-limit script failed for " + key, e);
        }
        return parseReply(reply);
    }

    static ConsumeResult parseReply(String reply) {
        String[] parts = reply == null ? new String[0] : reply.split(":", -1);
        if (parts.length != 2) {
            throw new RateLimitStoreUnavailableException("Unexpected rate-limit script reply: " + reply);
        }
        try {
            boolean admitted = "1".equals(parts[0]);
            double tokens = Double.parseDouble(parts[1]);
            return new ConsumeResult(admitted, tokens);
        } catch (NumberFormatException e) {
            throw new RateLimitStoreUnavailableException("Unparseable rate-limit script reply: " + reply, e);
        }
    }

    @Override
    public void ping() {
        try {
            String pong = redisTemplate.execute(connection -> connection.ping(), true);
            if (!"PONG".equalsIgnoreCase(pong)) {
                throw new RateLimitStoreUnavailableException("Unexpected PING reply: " + pong);
            }
        } catch (DataAccessException e) {
            throw new RateLimitStoreUnavailableException("Redis PING failed", e);
        }
    }
}
