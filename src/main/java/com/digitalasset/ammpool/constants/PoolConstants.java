// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.constants;

import java.math.BigInteger;

/**
 * Centralized constants for pool accounting.
 *
 * All share arithmetic is integer arithmetic; PRECISION gives shares six implied decimals.
 */
public final class PoolConstants {

    private PoolConstants() {
        // Prevent instantiation
    }

    // ========================================
    // PRECISION & SHARES
    // ========================================

    /**
     * Share scaling factor (6 implied decimal digits).
     */
    public static final BigInteger PRECISION = BigInteger.valueOf(1_000_000L);

    /**
     * Shares minted for the first deposit into an empty pool, whatever the deposited amounts.
     */
    public static final BigInteger GENESIS_SHARES = BigInteger.valueOf(100L).multiply(PRECISION);

    // ========================================
    // FEE STRUCTURE
    // ========================================

    /**
     * Exclusive upper bound for the fee parameter. Anything at or above it is stored as 0.
     */
    public static final long FEE_BPS_LIMIT = 1000;

    // ========================================
    // HOSTING
    // ========================================

    /**
     * Header carrying the caller identity, set by the upstream gateway.
     */
    public static final String CALLER_HEADER = "X-Caller-Id";

    /**
     * Header carrying the request correlation id.
     */
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    /**
     * Upper bound for history page size.
     */
    public static final int MAX_HISTORY_PAGE = 200;
}
