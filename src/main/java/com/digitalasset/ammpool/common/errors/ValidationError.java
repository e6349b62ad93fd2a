package com.digitalasset.ammpool.common.errors;

import com.digitalasset.ammpool.common.DomainError;

/**
 * Request-level validation failure raised by the HTTP host, never by the engine.
 */
public final class ValidationError extends DomainError {

    public enum Type {
        REQUEST,
        CALLER
    }

    public ValidationError(final String details) {
        this(details, Type.REQUEST);
    }

    public ValidationError(final String details, final Type type) {
        super(type == Type.CALLER ? "MISSING_CALLER" : "VALIDATION_ERROR", details, 400);
    }
}
