package com.bastion.ratelimit;

/**
 * What the limiter does when the rate-limit store is unavailable.
 */
public enum DegradationPolicy {

    /** Admit the request and log the lost enforcement. */
    FAIL_OPEN,

    /** Deny the request with a short retry hint. */
    FAIL_CLOSED
}
