// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import java.math.BigInteger;

/**
 * Token amounts released by burning a number of shares.
 */
public record WithdrawEstimate(BigInteger amountToken1, BigInteger amountToken2) {
}
