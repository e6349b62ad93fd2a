package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

/**
 * The pool holds no assets, so no ratio can be derived from it.
 */
public final class ZeroLiquidityError extends DomainError {

    public ZeroLiquidityError(final String details) {
        super("ZERO_LIQUIDITY", details, 409);
    }
}
