package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

public final class ZeroAmountError extends DomainError {

    public ZeroAmountError(final String details) {
        super("ZERO_AMOUNT", details, 400);
    }
}
