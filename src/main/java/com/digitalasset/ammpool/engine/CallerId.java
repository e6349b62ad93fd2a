// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import java.util.Objects;

/**
 * Opaque caller identity. Two callers are the same account iff their values are equal.
 */
public record CallerId(String value) {

    public CallerId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("caller id must not be blank");
        }
    }

    public static CallerId of(final String value) {
        Objects.requireNonNull(value, "value");
        return new CallerId(value.trim());
    }

    @Override
    public String toString() {
        return value;
    }
}
