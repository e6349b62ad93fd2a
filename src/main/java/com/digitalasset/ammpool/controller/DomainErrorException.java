package com.digitalasset.ammpool.controller;

import com.digitalasset.ammpool.common.DomainError;
import org.springframework.web.server.ResponseStatusException;

/**
 * Carries a {@link DomainError} out of a controller so the global handler can render its code.
 */
public class DomainErrorException extends ResponseStatusException {

    private final transient DomainError error;

    public DomainErrorException(final DomainError error) {
        super(DomainErrorStatusMapper.map(error), error.code() + ": " + error.message());
        this.error = error;
    }

    public DomainError error() {
        return error;
    }
}
