// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import com.digitalasset.ammpool.common.DomainError;
import com.digitalasset.ammpool.common.Result;
import com.digitalasset.ammpool.common.errors.ZeroLiquidityError;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Constant-product view of a pool: K = totalToken1 * totalToken2.
 *
 * K is used here only as the "pool is funded" gate in front of every
 * ratio-dependent computation.
 */
public final class InvariantEngine {

    private final Pool pool;

    public InvariantEngine(final Pool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    public BigInteger getK() {
        return pool.details().k();
    }

    /**
     * @return K when the pool holds liquidity, {@code ZERO_LIQUIDITY} otherwise
     */
    public Result<BigInteger, DomainError> activePool() {
        BigInteger k = getK();
        if (k.signum() == 0) {
            return Result.err(new ZeroLiquidityError("Pool has no liquidity yet"));
        }
        return Result.ok(k);
    }
}
