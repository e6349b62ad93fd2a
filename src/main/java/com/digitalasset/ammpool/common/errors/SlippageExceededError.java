package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

/**
 * Reserved for slippage-protected execution; nothing raises it yet.
 */
public final class SlippageExceededError extends DomainError {

    public SlippageExceededError(final String details) {
        super("SLIPPAGE_EXCEEDED", details, 422);
    }
}
