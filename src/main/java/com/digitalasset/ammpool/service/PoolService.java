// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.service;

import com.digitalasset.ammpool.common.DomainError;
import com.digitalasset.ammpool.common.Result;
import com.digitalasset.ammpool.engine.CallerId;
import com.digitalasset.ammpool.engine.Holdings;
import com.digitalasset.ammpool.engine.LiquidityManager;
import com.digitalasset.ammpool.engine.PoolDetails;
import com.digitalasset.ammpool.engine.WithdrawEstimate;
import com.digitalasset.ammpool.metrics.LiquidityMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single entry point to the pool for the HTTP host.
 *
 * The engine assumes calls never overlap; every call, reads included, runs under
 * one lock so concurrent requests see a linear sequence of pool states.
 */
@Service
public class PoolService {

    private static final Logger LOG = LoggerFactory.getLogger(PoolService.class);

    private final LiquidityManager liquidityManager;
    private final LiquidityMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock();

    public PoolService(final LiquidityManager liquidityManager, final LiquidityMetrics metrics) {
        this.liquidityManager = liquidityManager;
        this.metrics = metrics;
    }

    /**
     * Committed deposit: shares minted and the pool totals right after this deposit.
     */
    public record Provided(BigInteger shareAmount, PoolDetails poolAfter) {
    }

    /**
     * Committed withdrawal: shares burned, tokens released and the pool totals right after it.
     */
    public record Withdrawn(BigInteger shareAmount, WithdrawEstimate released, PoolDetails poolAfter) {
    }

    public Result<Provided, DomainError> provide(final CallerId caller,
                                                 final BigInteger amountToken1,
                                                 final BigInteger amountToken2) {
        Result<Provided, DomainError> result = locked(() -> liquidityManager.provide(caller, amountToken1, amountToken2)
                .map(share -> new Provided(share, liquidityManager.poolDetails())));
        if (result.isOk()) {
            LOG.info("provide caller={} amountToken1={} amountToken2={} -> shares={}",
                    caller, amountToken1, amountToken2, result.getValueUnsafe().shareAmount());
        } else {
            rejected("provide", caller, result.getErrorUnsafe());
        }
        return result;
    }

    public Result<Withdrawn, DomainError> withdraw(final CallerId caller, final BigInteger shareAmount) {
        Result<Withdrawn, DomainError> result = locked(() -> liquidityManager.withdraw(caller, shareAmount)
                .map(released -> new Withdrawn(shareAmount, released, liquidityManager.poolDetails())));
        if (result.isOk()) {
            WithdrawEstimate released = result.getValueUnsafe().released();
            LOG.info("withdraw caller={} shares={} -> amountToken1={} amountToken2={}",
                    caller, shareAmount, released.amountToken1(), released.amountToken2());
        } else {
            rejected("withdraw", caller, result.getErrorUnsafe());
        }
        return result;
    }

    public Holdings faucet(final CallerId caller, final BigInteger amountToken1, final BigInteger amountToken2) {
        Holdings holdings = locked(() -> {
            liquidityManager.faucet(caller, amountToken1, amountToken2);
            return liquidityManager.holdingsOf(caller);
        });
        LOG.info("faucet caller={} amountToken1={} amountToken2={}", caller, amountToken1, amountToken2);
        return holdings;
    }

    public Holdings holdingsOf(final CallerId caller) {
        return locked(() -> liquidityManager.holdingsOf(caller));
    }

    public PoolDetails poolDetails() {
        return locked(liquidityManager::poolDetails);
    }

    public Result<BigInteger, DomainError> equivalentToken1For(final BigInteger amountToken2) {
        return locked(() -> liquidityManager.equivalentToken1For(amountToken2))
                .peekError(error -> LOG.debug("equivalentToken1For({}) rejected: {}", amountToken2, error.code()));
    }

    public Result<BigInteger, DomainError> equivalentToken2For(final BigInteger amountToken1) {
        return locked(() -> liquidityManager.equivalentToken2For(amountToken1))
                .peekError(error -> LOG.debug("equivalentToken2For({}) rejected: {}", amountToken1, error.code()));
    }

    public Result<WithdrawEstimate, DomainError> withdrawEstimate(final BigInteger shareAmount) {
        return locked(() -> liquidityManager.withdrawEstimate(shareAmount))
                .peekError(error -> LOG.debug("withdrawEstimate({}) rejected: {}", shareAmount, error.code()));
    }

    private void rejected(final String operation, final CallerId caller, final DomainError error) {
        LOG.warn("{} rejected for caller={}: {} - {}", operation, caller, error.code(), error.message());
        metrics.recordRejected(operation, error.code());
    }

    private <T> T locked(final Supplier<T> call) {
        lock.lock();
        try {
            return call.get();
        } finally {
            lock.unlock();
        }
    }
}
