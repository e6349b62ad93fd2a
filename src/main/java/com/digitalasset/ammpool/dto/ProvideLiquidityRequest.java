// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * ProvideLiquidityRequest - Deposit both tokens into the pool.
 * Zero amounts pass validation here and are rejected by the pool with ZERO_AMOUNT.
 */
public class ProvideLiquidityRequest {
    @NotNull(message = "amountToken1 is required")
    @PositiveOrZero(message = "amountToken1 must be non-negative")
    public BigInteger amountToken1;

    @NotNull(message = "amountToken2 is required")
    @PositiveOrZero(message = "amountToken2 must be non-negative")
    public BigInteger amountToken2;

    // Default constructor for Jackson
    public ProvideLiquidityRequest() {}

    public ProvideLiquidityRequest(BigInteger amountToken1, BigInteger amountToken2) {
        this.amountToken1 = amountToken1;
        this.amountToken2 = amountToken2;
    }
}
