// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Guards for unsigned integer quantities.
 */
public final class Amounts {

    private Amounts() {
        // Utility class
    }

    /**
     * @return {@code amount}, once checked to be non-null and non-negative
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    public static BigInteger requireUnsigned(final BigInteger amount, final String name) {
        Objects.requireNonNull(amount, name);
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + amount);
        }
        return amount;
    }

    public static boolean isZero(final BigInteger amount) {
        return amount.signum() == 0;
    }
}
