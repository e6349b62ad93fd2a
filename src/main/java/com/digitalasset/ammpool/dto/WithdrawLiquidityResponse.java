// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

/**
 * WithdrawLiquidityResponse - Tokens released and the pool totals after the withdrawal
 */
public class WithdrawLiquidityResponse {
    public final String shareAmount;
    public final String amountToken1;
    public final String amountToken2;
    public final String totalToken1;
    public final String totalToken2;
    public final String totalShares;

    public WithdrawLiquidityResponse(String shareAmount, String amountToken1, String amountToken2,
                                     String totalToken1, String totalToken2, String totalShares) {
        this.shareAmount = shareAmount;
        this.amountToken1 = amountToken1;
        this.amountToken2 = amountToken2;
        this.totalToken1 = totalToken1;
        this.totalToken2 = totalToken2;
        this.totalShares = totalShares;
    }
}
