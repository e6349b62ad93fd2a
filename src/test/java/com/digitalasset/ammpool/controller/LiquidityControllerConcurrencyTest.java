// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.controller;

import com.digitalasset.ammpool.dto.FaucetRequest;
import com.digitalasset.ammpool.dto.ProvideLiquidityRequest;
import com.digitalasset.ammpool.dto.ProvideLiquidityResponse;
import com.digitalasset.ammpool.engine.LiquidityManager;
import com.digitalasset.ammpool.metrics.LiquidityMetrics;
import com.digitalasset.ammpool.service.PoolService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LiquidityControllerConcurrencyTest {

    private static final int CALLERS = 8;
    private static final int ROUNDS = 300;

    private LiquidityController controller;

    @BeforeEach
    void setUp() {
        LiquidityMetrics metrics = new LiquidityMetrics(new SimpleMeterRegistry());
        LiquidityManager manager = LiquidityManager.withFee(30);
        manager.addListener(metrics);
        controller = new LiquidityController(new PoolService(manager, metrics), true);

        controller.faucet("alice", new FaucetRequest(BigInteger.valueOf(1000), BigInteger.valueOf(1000)));
        controller.provide("alice", new ProvideLiquidityRequest(BigInteger.valueOf(1000), BigInteger.valueOf(1000)));
    }

    private <T> List<T> runConcurrently(PerCaller<T> call) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(CALLERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<T>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < CALLERS; i++) {
                String caller = "lp-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    List<T> responses = new ArrayList<>();
                    for (int round = 0; round < ROUNDS; round++) {
                        responses.add(call.apply(caller));
                    }
                    return responses;
                }));
            }
            start.countDown();
            List<T> all = new ArrayList<>();
            for (Future<List<T>> future : futures) {
                all.addAll(future.get(30, TimeUnit.SECONDS));
            }
            return all;
        } finally {
            executor.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface PerCaller<T> {
        T apply(String caller);
    }

    @Test
    void testProvideResponses_reportTheTotalsOfTheirOwnCommit() throws Exception {
        for (int i = 0; i < CALLERS; i++) {
            BigInteger funds = BigInteger.valueOf(10L * ROUNDS);
            controller.faucet("lp-" + i, new FaucetRequest(funds, funds));
        }

        List<ProvideLiquidityResponse> responses = runConcurrently(caller -> controller.provide(caller,
                new ProvideLiquidityRequest(BigInteger.TEN, BigInteger.TEN)));

        Set<String> totals = new HashSet<>();
        responses.forEach(response -> totals.add(response.totalToken1));
        assertThat(responses).hasSize(CALLERS * ROUNDS);
        assertThat(totals).hasSize(CALLERS * ROUNDS);
    }
}
