// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

/**
 * Amount of one token matching a given amount of the other at the current pool ratio.
 */
public class EquivalentAmountResponse {
    public final String inputToken;
    public final String inputAmount;
    public final String outputToken;
    public final String equivalentAmount;

    public EquivalentAmountResponse(String inputToken, String inputAmount, String outputToken, String equivalentAmount) {
        this.inputToken = inputToken;
        this.inputAmount = inputAmount;
        this.outputToken = outputToken;
        this.equivalentAmount = equivalentAmount;
    }
}
