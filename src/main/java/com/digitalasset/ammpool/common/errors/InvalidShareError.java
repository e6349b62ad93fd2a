package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

public final class InvalidShareError extends DomainError {

    public InvalidShareError(final String details) {
        super("INVALID_SHARE", details, 400);
    }
}
