// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import com.digitalasset.ammpool.common.DomainError;
import com.digitalasset.ammpool.common.Result;
import com.digitalasset.ammpool.common.errors.NonEquivalentValueError;
import com.digitalasset.ammpool.common.errors.ThresholdNotReachedError;
import com.digitalasset.ammpool.constants.PoolConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deposits into and withdrawals from a constant-product pool.
 *
 * Every mutating operation validates completely before it writes anything,
 * so a failed call leaves the pool and all accounts exactly as they were.
 * The manager is not thread-safe: the host must serialize calls.
 */
public final class LiquidityManager {

    private static final Logger LOG = LoggerFactory.getLogger(LiquidityManager.class);

    private final Pool pool;
    private final InvariantEngine invariant;
    private final EstimateCalculator estimates;
    private final List<PoolEventListener> listeners = new ArrayList<>();

    LiquidityManager(final Pool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.invariant = new InvariantEngine(pool);
        this.estimates = new EstimateCalculator(pool, invariant);
    }

    /**
     * Creates a manager over a fresh, empty pool.
     *
     * @param feeBasisPoints valid interval is [0, 1000); out-of-range values are stored as 0
     */
    public static LiquidityManager withFee(final long feeBasisPoints) {
        return new LiquidityManager(new Pool(feeBasisPoints));
    }

    public void addListener(final PoolEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Deposits both tokens and mints shares for them.
     *
     * The first deposit into an empty pool always mints {@link PoolConstants#GENESIS_SHARES}
     * and fixes the pool ratio. Later deposits must match that ratio exactly.
     *
     * @return the number of shares minted
     */
    public Result<BigInteger, DomainError> provide(final CallerId caller,
                                                   final BigInteger amountToken1,
                                                   final BigInteger amountToken2) {
        Objects.requireNonNull(caller, "caller");
        Amounts.requireUnsigned(amountToken1, "amountToken1");
        Amounts.requireUnsigned(amountToken2, "amountToken2");

        AssetLedger ledger = pool.accounts();
        Result<BigInteger, DomainError> validated = ledger.checkSpendable(caller, AssetKind.TOKEN1, amountToken1)
                .flatMap(ignored -> ledger.checkSpendable(caller, AssetKind.TOKEN2, amountToken2))
                .flatMap(ignored -> sharesFor(amountToken1, amountToken2));
        if (validated.isErr()) {
            return validated;
        }

        BigInteger share = validated.getValueUnsafe();
        boolean genesis = Amounts.isZero(pool.totalShares());
        debitValidated(ledger, caller, AssetKind.TOKEN1, amountToken1);
        debitValidated(ledger, caller, AssetKind.TOKEN2, amountToken2);
        pool.deposit(amountToken1, amountToken2, share);
        ledger.credit(caller, AssetKind.SHARE, share);

        LOG.debug("Provided {}/{} for {} -> {} shares (genesis={})", amountToken1, amountToken2, caller, share, genesis);
        publish(new PoolEvent.LiquidityProvided(caller, amountToken1, amountToken2, share, genesis, pool.details()));
        return Result.ok(share);
    }

    /**
     * Burns {@code shareAmount} of the caller's shares and pays out the matching tokens.
     *
     * The caller's share balance is checked before pool activity.
     *
     * @return the token amounts released to the caller
     */
    public Result<WithdrawEstimate, DomainError> withdraw(final CallerId caller, final BigInteger shareAmount) {
        Objects.requireNonNull(caller, "caller");
        Amounts.requireUnsigned(shareAmount, "shareAmount");

        AssetLedger ledger = pool.accounts();
        Result<WithdrawEstimate, DomainError> validated = ledger.checkSpendable(caller, AssetKind.SHARE, shareAmount)
                .flatMap(ignored -> estimates.withdrawEstimate(shareAmount));
        if (validated.isErr()) {
            return validated;
        }

        WithdrawEstimate released = validated.getValueUnsafe();
        debitValidated(ledger, caller, AssetKind.SHARE, shareAmount);
        pool.release(released.amountToken1(), released.amountToken2(), shareAmount);
        ledger.credit(caller, AssetKind.TOKEN1, released.amountToken1());
        ledger.credit(caller, AssetKind.TOKEN2, released.amountToken2());

        LOG.debug("Withdrew {} shares for {} -> {}/{}", shareAmount, caller,
                released.amountToken1(), released.amountToken2());
        publish(new PoolEvent.LiquidityWithdrawn(caller, shareAmount,
                released.amountToken1(), released.amountToken2(), pool.details()));
        return Result.ok(released);
    }

    /**
     * Credits free tokens to the caller's off-pool balances. No validation, no effect on the pool.
     */
    public void faucet(final CallerId caller, final BigInteger amountToken1, final BigInteger amountToken2) {
        Objects.requireNonNull(caller, "caller");
        Amounts.requireUnsigned(amountToken1, "amountToken1");
        Amounts.requireUnsigned(amountToken2, "amountToken2");

        AssetLedger ledger = pool.accounts();
        ledger.credit(caller, AssetKind.TOKEN1, amountToken1);
        ledger.credit(caller, AssetKind.TOKEN2, amountToken2);
        publish(new PoolEvent.FaucetCredited(caller, amountToken1, amountToken2, pool.details()));
    }

    public Holdings holdingsOf(final CallerId caller) {
        return pool.accounts().holdingsOf(caller);
    }

    public PoolDetails poolDetails() {
        return pool.details();
    }

    public Result<BigInteger, DomainError> equivalentToken1For(final BigInteger amountToken2) {
        return estimates.equivalentToken1For(amountToken2);
    }

    public Result<BigInteger, DomainError> equivalentToken2For(final BigInteger amountToken1) {
        return estimates.equivalentToken2For(amountToken1);
    }

    public Result<WithdrawEstimate, DomainError> withdrawEstimate(final BigInteger shareAmount) {
        return estimates.withdrawEstimate(shareAmount);
    }

    public BigInteger getK() {
        return invariant.getK();
    }

    private Result<BigInteger, DomainError> sharesFor(final BigInteger amountToken1, final BigInteger amountToken2) {
        BigInteger totalShares = pool.totalShares();
        BigInteger share;
        if (Amounts.isZero(totalShares)) {
            share = PoolConstants.GENESIS_SHARES;
        } else {
            BigInteger share1 = totalShares.multiply(amountToken1).divide(pool.totalToken1());
            BigInteger share2 = totalShares.multiply(amountToken2).divide(pool.totalToken2());
            if (!share1.equals(share2)) {
                return Result.err(new NonEquivalentValueError(
                        "Deposit " + amountToken1 + "/" + amountToken2 + " does not match pool ratio "
                                + pool.totalToken1() + "/" + pool.totalToken2()));
            }
            share = share1;
        }
        if (Amounts.isZero(share)) {
            return Result.err(new ThresholdNotReachedError(
                    "Deposit " + amountToken1 + "/" + amountToken2 + " is worth less than one share unit"));
        }
        return Result.ok(share);
    }

    private static void debitValidated(final AssetLedger ledger, final CallerId caller,
                                       final AssetKind kind, final BigInteger amount) {
        ledger.debit(caller, kind, amount)
                .orElseThrow(error -> new IllegalStateException("Validated " + kind.label() + " debit failed: " + error));
    }

    private void publish(final PoolEvent event) {
        for (PoolEventListener listener : listeners) {
            try {
                listener.onPoolEvent(event);
            } catch (RuntimeException ex) {
                LOG.warn("Pool event listener {} failed on {} for {}: {}",
                        listener.getClass().getSimpleName(), event.type(), event.caller(), ex.getMessage(), ex);
            }
        }
    }
}
