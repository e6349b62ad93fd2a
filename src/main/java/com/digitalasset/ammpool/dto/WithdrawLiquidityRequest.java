// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

public class WithdrawLiquidityRequest {
    @NotNull(message = "shareAmount is required")
    @PositiveOrZero(message = "shareAmount must be non-negative")
    public BigInteger shareAmount;

    public WithdrawLiquidityRequest() {}

    public WithdrawLiquidityRequest(BigInteger shareAmount) {
        this.shareAmount = shareAmount;
    }
}
