package com.bastion.tenancy;

/**
 * A tenant lookup that timed out, failed, or could not be scheduled. Distinct from a miss:
 * the directory gave no answer for the candidate.
 */
public class TenantLookupUnavailableException extends RuntimeException {

    public TenantLookupUnavailableException(String message) {
        super(message);
    }

    public TenantLookupUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
