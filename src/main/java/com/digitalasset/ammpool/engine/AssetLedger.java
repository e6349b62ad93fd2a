// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import com.digitalasset.ammpool.common.DomainError;
import com.digitalasset.ammpool.common.Result;
import com.digitalasset.ammpool.common.errors.InsufficientAmountError;
import com.digitalasset.ammpool.common.errors.ZeroAmountError;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-caller balances of token1, token2 and pool shares.
 *
 * An account that was never written reads as all zeroes; writes upsert the
 * account. Balances never go below zero: {@link #debit} refuses instead.
 * Only the engine writes balances. Not thread-safe.
 */
public final class AssetLedger {

    private final Map<CallerId, Holdings> accounts = new HashMap<>();

    public BigInteger balanceOf(final CallerId account, final AssetKind kind) {
        return holdingsOf(account).balance(kind);
    }

    public Holdings holdingsOf(final CallerId account) {
        Objects.requireNonNull(account, "account");
        return accounts.getOrDefault(account, Holdings.ZERO);
    }

    void credit(final CallerId account, final AssetKind kind, final BigInteger amount) {
        Amounts.requireUnsigned(amount, "amount");
        Holdings current = holdingsOf(account);
        accounts.put(account, current.with(kind, current.balance(kind).add(amount)));
    }

    /**
     * Removes {@code amount} from the account.
     *
     * @return the remaining balance, or {@code INSUFFICIENT_AMOUNT} with the account untouched
     */
    Result<BigInteger, DomainError> debit(final CallerId account, final AssetKind kind, final BigInteger amount) {
        Amounts.requireUnsigned(amount, "amount");
        Holdings current = holdingsOf(account);
        BigInteger balance = current.balance(kind);
        if (amount.compareTo(balance) > 0) {
            return Result.err(insufficient(kind, balance, amount));
        }
        BigInteger remaining = balance.subtract(amount);
        accounts.put(account, current.with(kind, remaining));
        return Result.ok(remaining);
    }

    /**
     * Checks that the caller may spend {@code amount} of {@code kind}: it must be
     * non-zero and covered by the current balance. Reads only.
     *
     * @return {@code amount} when spendable
     */
    public Result<BigInteger, DomainError> checkSpendable(final CallerId account, final AssetKind kind, final BigInteger amount) {
        Amounts.requireUnsigned(amount, "amount");
        if (Amounts.isZero(amount)) {
            return Result.err(new ZeroAmountError(kind.label() + " amount cannot be zero"));
        }
        BigInteger balance = balanceOf(account, kind);
        if (amount.compareTo(balance) > 0) {
            return Result.err(insufficient(kind, balance, amount));
        }
        return Result.ok(amount);
    }

    /**
     * Sum of one balance over every account.
     */
    public BigInteger total(final AssetKind kind) {
        BigInteger sum = BigInteger.ZERO;
        for (Holdings holdings : accounts.values()) {
            sum = sum.add(holdings.balance(kind));
        }
        return sum;
    }

    private static InsufficientAmountError insufficient(final AssetKind kind, final BigInteger balance, final BigInteger amount) {
        return new InsufficientAmountError(
                "Insufficient " + kind.label() + ": have " + balance + ", need " + amount);
    }
}
