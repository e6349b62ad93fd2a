// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Balances of one account: off-pool token1 and token2, plus pool shares.
 */
public record Holdings(BigInteger token1Balance, BigInteger token2Balance, BigInteger shareBalance) {

    public static final Holdings ZERO = new Holdings(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);

    public Holdings {
        Amounts.requireUnsigned(token1Balance, "token1Balance");
        Amounts.requireUnsigned(token2Balance, "token2Balance");
        Amounts.requireUnsigned(shareBalance, "shareBalance");
    }

    public BigInteger balance(final AssetKind kind) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case TOKEN1 -> token1Balance;
            case TOKEN2 -> token2Balance;
            case SHARE -> shareBalance;
        };
    }

    Holdings with(final AssetKind kind, final BigInteger balance) {
        return switch (kind) {
            case TOKEN1 -> new Holdings(balance, token2Balance, shareBalance);
            case TOKEN2 -> new Holdings(token1Balance, balance, shareBalance);
            case SHARE -> new Holdings(token1Balance, token2Balance, balance);
        };
    }
}
