package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

/**
 * The caller asked to spend more of a token or share than they hold.
 */
public final class InsufficientAmountError extends DomainError {

    public InsufficientAmountError(final String details) {
        super("INSUFFICIENT_AMOUNT", details, 422);
    }
}
