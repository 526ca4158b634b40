package com.bastion.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RedisRateLimitStore script reply")
class RedisRateLimitStoreReplyTest {

    @Test
    @DisplayName("parses admitted and remaining tokens")
    void parses() {
        assertThat(RedisRateLimitStore.parseReply("1:2.5")).isEqualTo(new ConsumeResult(true, 2.5));
        assertThat(RedisRateLimitStore.parseReply("0:0")).isEqualTo(new ConsumeResult(false, 0.0));
        assertThat(RedisRateLimitStore.parseReply("1:1e-05").tokens()).isEqualTo(1e-5);
    }

    @Test
    @DisplayName("a missing or malformed reply means the store is unavailable")
    void malformed() {
        assertThatThrownBy(() -> RedisRateLimitStore.parseReply(null))
                .isInstanceOf(RateLimitStoreUnavailableException.class);
        assertThatThrownBy(() -> RedisRateLimitStore.parseReply("1"))
                .isInstanceOf(RateLimitStoreUnavailableException.class);
        assertThatThrownBy(() -> RedisRateLimitStore.parseReply("1:abc"))
                .isInstanceOf(RateLimitStoreUnavailableException.class);
    }
}
