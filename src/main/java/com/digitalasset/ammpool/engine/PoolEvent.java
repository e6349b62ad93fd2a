// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import java.math.BigInteger;

/**
 * Description of a committed state transition, handed to {@link PoolEventListener}s.
 * Failed operations produce no event.
 */
public sealed interface PoolEvent {

    enum Type {
        PROVIDE,
        WITHDRAW,
        FAUCET
    }

    Type type();

    CallerId caller();

    /**
     * Pool totals right after the transition was committed.
     */
    PoolDetails poolAfter();

    record LiquidityProvided(
            CallerId caller,
            BigInteger amountToken1,
            BigInteger amountToken2,
            BigInteger sharesMinted,
            boolean genesis,
            PoolDetails poolAfter
    ) implements PoolEvent {
        @Override
        public Type type() {
            return Type.PROVIDE;
        }
    }

    record LiquidityWithdrawn(
            CallerId caller,
            BigInteger sharesBurned,
            BigInteger amountToken1,
            BigInteger amountToken2,
            PoolDetails poolAfter
    ) implements PoolEvent {
        @Override
        public Type type() {
            return Type.WITHDRAW;
        }
    }

    record FaucetCredited(
            CallerId caller,
            BigInteger amountToken1,
            BigInteger amountToken2,
            PoolDetails poolAfter
    ) implements PoolEvent {
        @Override
        public Type type() {
            return Type.FAUCET;
        }
    }
}
