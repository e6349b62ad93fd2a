// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.metrics;

import com.digitalasset.ammpool.engine.CallerId;
import com.digitalasset.ammpool.engine.PoolDetails;
import com.digitalasset.ammpool.engine.PoolEvent;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class LiquidityMetricsTest {

    private static final CallerId ALICE = CallerId.of("alice");

    private SimpleMeterRegistry registry;
    private LiquidityMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LiquidityMetrics(registry);
    }

    private static BigInteger n(long value) {
        return BigInteger.valueOf(value);
    }

    private double gauge(String name) {
        return registry.get(name).gauge().value();
    }

    @Test
    void testGauges_startAtZero() {
        assertThat(registry.get("ammpool.pool.reserve.amount").tag("token", "token1").gauge().value()).isZero();
        assertThat(gauge("ammpool.pool.shares.total")).isZero();
        assertThat(gauge("ammpool.pool.k_invariant")).isZero();
    }

    @Test
    void testProvidedEvent_updatesCountersAndGauges() {
        PoolDetails after = new PoolDetails(n(100), n(400), n(100_000_000), 30);

        metrics.onPoolEvent(new PoolEvent.LiquidityProvided(ALICE, n(100), n(400), n(100_000_000), true, after));

        assertThat(registry.get("ammpool.liquidity.provided.total").counter().count()).isEqualTo(1.0);
        DistributionSummary minted = registry.get("ammpool.shares.minted").summary();
        assertThat(minted.count()).isEqualTo(1);
        assertThat(minted.totalAmount()).isEqualTo(100_000_000.0);
        assertThat(registry.get("ammpool.pool.reserve.amount").tag("token", "token1").gauge().value()).isEqualTo(100.0);
        assertThat(registry.get("ammpool.pool.reserve.amount").tag("token", "token2").gauge().value()).isEqualTo(400.0);
        assertThat(gauge("ammpool.pool.shares.total")).isEqualTo(100_000_000.0);
        assertThat(gauge("ammpool.pool.k_invariant")).isEqualTo(40_000.0);
    }

    @Test
    void testWithdrawnAndFaucetEvents_updateTheirCounters() {
        PoolDetails drained = new PoolDetails(n(0), n(0), n(0), 30);

        metrics.onPoolEvent(new PoolEvent.FaucetCredited(ALICE, n(5), n(5), drained));
        metrics.onPoolEvent(new PoolEvent.LiquidityWithdrawn(ALICE, n(40_000_000), n(40), n(40), drained));

        assertThat(registry.get("ammpool.faucet.credited.total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("ammpool.liquidity.withdrawn.total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("ammpool.shares.burned").summary().totalAmount()).isEqualTo(40_000_000.0);
        assertThat(gauge("ammpool.pool.shares.total")).isZero();
    }

    @Test
    void testRecordRejected_tagsOperationAndCode() {
        metrics.recordRejected("provide", "NON_EQUIVALENT_VALUE");
        metrics.recordRejected("provide", "NON_EQUIVALENT_VALUE");
        metrics.recordRejected("withdraw", "INSUFFICIENT_AMOUNT");

        assertThat(registry.get("ammpool.operation.rejected.total")
                .tags("operation", "provide", "code", "NON_EQUIVALENT_VALUE")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("ammpool.operation.rejected.total")
                .tags("operation", "withdraw", "code", "INSUFFICIENT_AMOUNT")
                .counter().count()).isEqualTo(1.0);
    }
}
