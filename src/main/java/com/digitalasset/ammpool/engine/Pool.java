// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import com.digitalasset.ammpool.constants.PoolConstants;

import java.math.BigInteger;

/**
 * The pool aggregate: locked token totals, issued shares, the fee parameter
 * and the ledger of every account that ever touched the pool.
 *
 * Totals and balances are only changed by {@link LiquidityManager}. Not thread-safe.
 */
public final class Pool {

    private final long feeBasisPoints;
    private final AssetLedger accounts = new AssetLedger();
    private BigInteger totalShares = BigInteger.ZERO;
    private BigInteger totalToken1 = BigInteger.ZERO;
    private BigInteger totalToken2 = BigInteger.ZERO;

    /**
     * @param feeBasisPoints valid interval is [0, 1000); anything at or above 1000 is stored as 0
     */
    public Pool(final long feeBasisPoints) {
        if (feeBasisPoints < 0) {
            throw new IllegalArgumentException("feeBasisPoints must not be negative, got: " + feeBasisPoints);
        }
        this.feeBasisPoints = clampFee(feeBasisPoints);
    }

    static long clampFee(final long feeBasisPoints) {
        return feeBasisPoints >= PoolConstants.FEE_BPS_LIMIT ? 0 : feeBasisPoints;
    }

    public long feeBasisPoints() {
        return feeBasisPoints;
    }

    public BigInteger totalShares() {
        return totalShares;
    }

    public BigInteger totalToken1() {
        return totalToken1;
    }

    public BigInteger totalToken2() {
        return totalToken2;
    }

    AssetLedger accounts() {
        return accounts;
    }

    public PoolDetails details() {
        return new PoolDetails(totalToken1, totalToken2, totalShares, feeBasisPoints);
    }

    void deposit(final BigInteger amountToken1, final BigInteger amountToken2, final BigInteger shares) {
        totalToken1 = totalToken1.add(amountToken1);
        totalToken2 = totalToken2.add(amountToken2);
        totalShares = totalShares.add(shares);
    }

    void release(final BigInteger amountToken1, final BigInteger amountToken2, final BigInteger shares) {
        totalToken1 = subtractChecked(totalToken1, amountToken1, "totalToken1");
        totalToken2 = subtractChecked(totalToken2, amountToken2, "totalToken2");
        totalShares = subtractChecked(totalShares, shares, "totalShares");
    }

    private static BigInteger subtractChecked(final BigInteger total, final BigInteger amount, final String name) {
        BigInteger remaining = total.subtract(amount);
        if (remaining.signum() < 0) {
            throw new IllegalStateException(name + " would underflow: " + total + " - " + amount);
        }
        return remaining;
    }
}
