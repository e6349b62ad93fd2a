// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

/**
 * ProvideLiquidityResponse - Shares minted and the pool totals after the deposit
 */
public class ProvideLiquidityResponse {
    public final String shareAmount;
    public final String totalToken1;
    public final String totalToken2;
    public final String totalShares;

    public ProvideLiquidityResponse(String shareAmount, String totalToken1, String totalToken2, String totalShares) {
        this.shareAmount = shareAmount;
        this.totalToken1 = totalToken1;
        this.totalToken2 = totalToken2;
        this.totalShares = totalShares;
    }
}
