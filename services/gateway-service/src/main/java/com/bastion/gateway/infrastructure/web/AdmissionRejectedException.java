package com.bastion.gateway.infrastructure.web;

import com.bastion.security.AdmissionError;

/**
 * Raised by {@link AdmissionInterceptor} to hand a pipeline rejection to
 * {@link GlobalExceptionHandler}.
 */
public class AdmissionRejectedException extends RuntimeException {

    private final transient AdmissionError error;

    public AdmissionRejectedException(AdmissionError error) {
        super(error.code().name() + ": " + error.detail());
        this.error = error;
    }

    public AdmissionError error() {
        return error;
    }
}
