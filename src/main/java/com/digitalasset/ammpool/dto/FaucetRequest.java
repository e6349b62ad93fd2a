// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * FaucetRequest - Free token1/token2 for the caller (bootstrap and testing).
 */
public class FaucetRequest {
    @NotNull(message = "amountToken1 is required")
    @PositiveOrZero(message = "amountToken1 must be non-negative")
    public BigInteger amountToken1;

    @NotNull(message = "amountToken2 is required")
    @PositiveOrZero(message = "amountToken2 must be non-negative")
    public BigInteger amountToken2;

    public FaucetRequest() {}

    public FaucetRequest(BigInteger amountToken1, BigInteger amountToken2) {
        this.amountToken1 = amountToken1;
        this.amountToken2 = amountToken2;
    }
}
