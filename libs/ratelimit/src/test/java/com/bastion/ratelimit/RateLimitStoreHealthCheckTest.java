package com.bastion.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.bastion.observability.ComponentHealth;
import com.bastion.observability.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimitStoreHealthCheck")
class RateLimitStoreHealthCheckTest {

    @Test
    @DisplayName("reports HEALTHY for a reachable store")
    void healthy() {
        ComponentHealth health = new RateLimitStoreHealthCheck(new InMemoryRateLimitStore()).check().join();

        assertThat(health.name()).isEqualTo(RateLimitStoreHealthCheck.NAME);
        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("reports DEGRADED when the store is unreachable")
    void degraded() {
        RateLimitStore store = mock(RateLimitStore.class);
        doThrow(new RateLimitStoreUnavailableException("Redis PING failed")).when(store).ping();

        ComponentHealth health = new RateLimitStoreHealthCheck(store).check().join();

        assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(health.message()).contains("PING");
    }
}
