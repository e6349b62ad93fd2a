// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

public class WithdrawEstimateResponse {
    public final String shareAmount;
    public final String amountToken1;
    public final String amountToken2;

    public WithdrawEstimateResponse(String shareAmount, String amountToken1, String amountToken2) {
        this.shareAmount = shareAmount;
        this.amountToken1 = amountToken1;
        this.amountToken2 = amountToken2;
    }
}
