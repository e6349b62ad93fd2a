package com.digitalasset.ammpool.controller;

import com.digitalasset.ammpool.common.DomainError;
import com.digitalasset.ammpool.common.Result;
import com.digitalasset.ammpool.common.errors.ValidationError;
import com.digitalasset.ammpool.constants.PoolConstants;
import com.digitalasset.ammpool.engine.CallerId;

import java.math.BigInteger;

/**
 * Request parsing shared by the pool controllers.
 *
 * The caller header is trusted as-is: authentication happens upstream.
 */
final class CallerResolver {

    private CallerResolver() {
    }

    static Result<CallerId, DomainError> resolve(final String callerHeader) {
        if (callerHeader == null || callerHeader.isBlank()) {
            return Result.err(new ValidationError(
                    PoolConstants.CALLER_HEADER + " header is required", ValidationError.Type.CALLER));
        }
        return Result.ok(CallerId.of(callerHeader));
    }

    static Result<BigInteger, DomainError> unsigned(final String name, final BigInteger value) {
        if (value == null) {
            return Result.err(new ValidationError(name + " is required"));
        }
        if (value.signum() < 0) {
            return Result.err(new ValidationError(name + " must be non-negative, got: " + value));
        }
        return Result.ok(value);
    }

    static <T> T unwrap(final Result<T, DomainError> result) {
        return result.orElseThrow(DomainErrorException::new);
    }
}
