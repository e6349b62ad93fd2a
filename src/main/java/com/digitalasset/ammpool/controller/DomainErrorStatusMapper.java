package com.digitalasset.ammpool.controller;

import com.digitalasset.ammpool.common.DomainError;
import org.springframework.http.HttpStatus;

/**
 * Centralizes DomainError -> HttpStatus mapping so all controllers respond consistently.
 * Each error type carries its own status; unknown codes become 500.
 */
public final class DomainErrorStatusMapper {

    private DomainErrorStatusMapper() {
    }

    public static HttpStatus map(final DomainError error) {
        HttpStatus derived = HttpStatus.resolve(error.httpStatus());
        return derived != null ? derived : HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
