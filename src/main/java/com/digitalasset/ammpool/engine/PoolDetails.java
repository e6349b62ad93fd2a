// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import java.math.BigInteger;

/**
 * Snapshot of the pool totals and fee parameter.
 */
public record PoolDetails(BigInteger totalToken1, BigInteger totalToken2, BigInteger totalShares, long feeBasisPoints) {

    /**
     * Constant product of the two totals.
     */
    public BigInteger k() {
        return totalToken1.multiply(totalToken2);
    }

    public boolean active() {
        return k().signum() != 0;
    }
}
