package com.bastion.ratelimit;

/**
 * The rate-limit store did not answer in time or failed. Only the limiter's degradation
 * branch handles this.
 */
public class RateLimitStoreUnavailableException extends RuntimeException {

    public RateLimitStoreUnavailableException(String message) {
        super(message);
    }

    public RateLimitStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
