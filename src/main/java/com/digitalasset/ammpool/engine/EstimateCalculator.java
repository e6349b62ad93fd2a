// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import com.digitalasset.ammpool.common.DomainError;
import com.digitalasset.ammpool.common.Result;
import com.digitalasset.ammpool.common.errors.InvalidShareError;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Deposit and withdrawal estimates derived from the current pool ratio.
 *
 * Every method is a pure read and uses floor division; none of them is
 * defined on an empty pool.
 */
public final class EstimateCalculator {

    private final Pool pool;
    private final InvariantEngine invariant;

    public EstimateCalculator(final Pool pool, final InvariantEngine invariant) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.invariant = Objects.requireNonNull(invariant, "invariant");
    }

    /**
     * Amount of token1 matching {@code amountToken2} at the current ratio.
     */
    public Result<BigInteger, DomainError> equivalentToken1For(final BigInteger amountToken2) {
        Amounts.requireUnsigned(amountToken2, "amountToken2");
        return invariant.activePool()
                .map(k -> pool.totalToken1().multiply(amountToken2).divide(pool.totalToken2()));
    }

    /**
     * Amount of token2 matching {@code amountToken1} at the current ratio.
     */
    public Result<BigInteger, DomainError> equivalentToken2For(final BigInteger amountToken1) {
        Amounts.requireUnsigned(amountToken1, "amountToken1");
        return invariant.activePool()
                .map(k -> pool.totalToken2().multiply(amountToken1).divide(pool.totalToken1()));
    }

    /**
     * Token amounts released by burning {@code shareAmount} shares.
     * Fails with {@code INVALID_SHARE} when more shares are asked for than exist.
     */
    public Result<WithdrawEstimate, DomainError> withdrawEstimate(final BigInteger shareAmount) {
        Amounts.requireUnsigned(shareAmount, "shareAmount");
        return invariant.activePool().flatMap(k -> {
            BigInteger totalShares = pool.totalShares();
            if (shareAmount.compareTo(totalShares) > 0) {
                return Result.err(new InvalidShareError(
                        "Share amount " + shareAmount + " exceeds total shares " + totalShares));
            }
            BigInteger amountToken1 = shareAmount.multiply(pool.totalToken1()).divide(totalShares);
            BigInteger amountToken2 = shareAmount.multiply(pool.totalToken2()).divide(totalShares);
            return Result.ok(new WithdrawEstimate(amountToken1, amountToken2));
        });
    }
}
