// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.metrics;

import com.digitalasset.ammpool.engine.PoolDetails;
import com.digitalasset.ammpool.engine.PoolEvent;
import com.digitalasset.ammpool.engine.PoolEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer metrics for pool liquidity.
 *
 * Provides:
 * - Counters for committed provides, withdrawals and faucet credits
 * - Counter of rejected operations tagged by operation and error code
 * - Distribution of shares minted and burned
 * - Gauges for both reserves, total shares and K, updated from each event snapshot
 *
 * Gauges are registered once and updated via AtomicReference.
 */
@Component
public class LiquidityMetrics implements PoolEventListener {

    private static final Logger logger = LoggerFactory.getLogger(LiquidityMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Counter provided;
    private final Counter withdrawn;
    private final Counter faucetCredits;
    private final DistributionSummary sharesMinted;
    private final DistributionSummary sharesBurned;

    private final AtomicReference<BigInteger> reserveToken1 = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> reserveToken2 = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> totalShares = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> kInvariant = new AtomicReference<>(BigInteger.ZERO);

    public LiquidityMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.provided = Counter.builder("ammpool.liquidity.provided.total")
            .description("Total number of committed liquidity deposits")
            .register(meterRegistry);

        this.withdrawn = Counter.builder("ammpool.liquidity.withdrawn.total")
            .description("Total number of committed liquidity withdrawals")
            .register(meterRegistry);

        this.faucetCredits = Counter.builder("ammpool.faucet.credited.total")
            .description("Total number of faucet credits")
            .register(meterRegistry);

        this.sharesMinted = DistributionSummary.builder("ammpool.shares.minted")
            .description("Distribution of shares minted per deposit")
            .baseUnit("shares")
            .register(meterRegistry);

        this.sharesBurned = DistributionSummary.builder("ammpool.shares.burned")
            .description("Distribution of shares burned per withdrawal")
            .baseUnit("shares")
            .register(meterRegistry);

        Gauge.builder("ammpool.pool.reserve.amount", reserveToken1, r -> r.get().doubleValue())
            .tag("token", "token1")
            .description("Pool reserve amount")
            .register(meterRegistry);
        Gauge.builder("ammpool.pool.reserve.amount", reserveToken2, r -> r.get().doubleValue())
            .tag("token", "token2")
            .description("Pool reserve amount")
            .register(meterRegistry);
        Gauge.builder("ammpool.pool.shares.total", totalShares, r -> r.get().doubleValue())
            .description("Total shares issued by the pool")
            .register(meterRegistry);
        Gauge.builder("ammpool.pool.k_invariant", kInvariant, r -> r.get().doubleValue())
            .description("Constant product k = totalToken1 * totalToken2")
            .register(meterRegistry);
    }

    @Override
    public void onPoolEvent(PoolEvent event) {
        if (event instanceof PoolEvent.LiquidityProvided providedEvent) {
            provided.increment();
            sharesMinted.record(providedEvent.sharesMinted().doubleValue());
        } else if (event instanceof PoolEvent.LiquidityWithdrawn withdrawnEvent) {
            withdrawn.increment();
            sharesBurned.record(withdrawnEvent.sharesBurned().doubleValue());
        } else if (event instanceof PoolEvent.FaucetCredited) {
            faucetCredits.increment();
        }
        recordPoolState(event.poolAfter());
    }

    /**
     * Record an operation the engine rejected. Error codes are a closed set, so cardinality stays bounded.
     */
    public void recordRejected(String operation, String errorCode) {
        meterRegistry.counter("ammpool.operation.rejected.total",
            "operation", operation,
            "code", errorCode).increment();
    }

    /**
     * Update pool gauges from a snapshot.
     */
    public void recordPoolState(PoolDetails details) {
        reserveToken1.set(details.totalToken1());
        reserveToken2.set(details.totalToken2());
        totalShares.set(details.totalShares());
        kInvariant.set(details.k());
        logger.debug("Pool gauges updated: reserves={}/{} shares={}",
            details.totalToken1(), details.totalToken2(), details.totalShares());
    }
}
