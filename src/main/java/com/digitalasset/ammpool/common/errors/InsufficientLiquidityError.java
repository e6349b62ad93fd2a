package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

/**
 * Reserved for swap execution; nothing in the liquidity flow raises it.
 */
public final class InsufficientLiquidityError extends DomainError {

    public InsufficientLiquidityError(final String details) {
        super("INSUFFICIENT_LIQUIDITY", details, 409);
    }
}
