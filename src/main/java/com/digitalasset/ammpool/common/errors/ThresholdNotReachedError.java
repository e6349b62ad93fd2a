package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

/**
 * Deposit too small to be worth at least one share unit.
 */
public final class ThresholdNotReachedError extends DomainError {

    public ThresholdNotReachedError(final String details) {
        super("THRESHOLD_NOT_REACHED", details, 422);
    }
}
