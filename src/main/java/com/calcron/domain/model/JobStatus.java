package com.calcron.domain.model;

public enum JobStatus {
    /** Last scheduling attempt was confirmed by the external scheduler. */
    PENDING,
    /** Last schedule or cancel attempt did not confirm; retried next cycle. */
    FAILED
}
