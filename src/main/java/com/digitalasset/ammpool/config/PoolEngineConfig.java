// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.config;

import com.digitalasset.ammpool.engine.LiquidityManager;
import com.digitalasset.ammpool.engine.PoolEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the pool engine: one pool per application, with every
 * {@link PoolEventListener} bean registered as an observer.
 *
 * Configuration:
 * - ammpool.fee-basis-points=30 (valid interval [0, 1000), anything above is stored as 0)
 */
@Configuration
public class PoolEngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PoolEngineConfig.class);

    @Bean
    public LiquidityManager liquidityManager(
            @Value("${ammpool.fee-basis-points:30}") long feeBasisPoints,
            List<PoolEventListener> listeners
    ) {
        LiquidityManager manager = LiquidityManager.withFee(feeBasisPoints);
        listeners.forEach(manager::addListener);
        long storedFee = manager.poolDetails().feeBasisPoints();
        if (storedFee != feeBasisPoints) {
            logger.warn("ammpool.fee-basis-points={} is outside [0, 1000) and was stored as {}", feeBasisPoints, storedFee);
        }
        logger.info("Pool engine ready: feeBasisPoints={}, listeners={}", storedFee,
                listeners.stream().map(l -> l.getClass().getSimpleName()).toList());
        return manager;
    }
}
