package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

/**
 * Deposit amounts do not match the current pool ratio exactly.
 */
public final class NonEquivalentValueError extends DomainError {

    public NonEquivalentValueError(final String details) {
        super("NON_EQUIVALENT_VALUE", details, 422);
    }
}
