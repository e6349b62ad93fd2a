// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

import com.digitalasset.ammpool.engine.CallerId;
import com.digitalasset.ammpool.engine.Holdings;

/**
 * DTO for one caller's balances.
 */
public class HoldingsResponse {
    public String callerId;
    public String token1Balance;
    public String token2Balance;
    public String shareBalance;

    public HoldingsResponse() {}

    public HoldingsResponse(String callerId, String token1Balance, String token2Balance, String shareBalance) {
        this.callerId = callerId;
        this.token1Balance = token1Balance;
        this.token2Balance = token2Balance;
        this.shareBalance = shareBalance;
    }

    public static HoldingsResponse from(CallerId caller, Holdings holdings) {
        return new HoldingsResponse(
                caller.value(),
                holdings.token1Balance().toString(),
                holdings.token2Balance().toString(),
                holdings.shareBalance().toString()
        );
    }
}
