package com.bastion.ratelimit;

import com.bastion.security.TenantContext;

/**
 * Per-tenant admission control. Never blocks or queues: a request is either admitted now or
 * denied with a retry hint.
 */
public interface RateLimiter {

    RateLimitDecision admit(TenantContext tenant);
}
