package com.bastion.admission;

import com.bastion.security.AdmissionError;

/**
 * Either an admitted request with its context or exactly one classified rejection.
 */
public sealed interface PipelineResult permits PipelineResult.Admitted, PipelineResult.Rejected {

    boolean admitted();

    record Admitted(AdmissionContext context) implements PipelineResult {

        @Override
        public boolean admitted() {
            return true;
        }
    }

    record Rejected(AdmissionError error) implements PipelineResult {

        @Override
        public boolean admitted() {
            return false;
        }
    }
}
