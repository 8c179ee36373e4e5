package com.calcron.domain.port.out;

public enum CancelResult {
    CANCELLED,
    /** The scheduler does not know the handle: already fired or removed externally. */
    NOT_FOUND
}
