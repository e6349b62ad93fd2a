// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.common;

/**
 * Base type for domain-level errors.
 *
 * Every expected failure of a pool operation is one of these: a stable code,
 * a message for the caller and the HTTP status a host should answer with.
 */
public abstract class DomainError {

    private final String code;
    private final String message;
    private final int httpStatus;

    protected DomainError(final String code, final String message, final int httpStatus) {
        this.code = code;
        this.message = message;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }

    public int httpStatus() {
        return httpStatus;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
