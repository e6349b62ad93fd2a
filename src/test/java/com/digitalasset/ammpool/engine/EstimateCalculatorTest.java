// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

import com.digitalasset.ammpool.common.DomainError;
import com.digitalasset.ammpool.common.Result;
import com.digitalasset.ammpool.common.errors.InvalidShareError;
import com.digitalasset.ammpool.common.errors.ZeroLiquidityError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Estimate Calculator Tests")
class EstimateCalculatorTest {

    private static EstimateCalculator calculatorFor(long token1, long token2, long shares) {
        Pool pool = new Pool(0);
        pool.deposit(BigInteger.valueOf(token1), BigInteger.valueOf(token2), BigInteger.valueOf(shares));
        return new EstimateCalculator(pool, new InvariantEngine(pool));
    }

    @Test
    @DisplayName("Equivalent amounts follow the pool ratio with floor division")
    void testEquivalentAmounts() {
        EstimateCalculator calculator = calculatorFor(100, 300, 100_000_000);

        assertThat(calculator.equivalentToken2For(BigInteger.TEN).getValueUnsafe()).isEqualTo(BigInteger.valueOf(30));
        // 100 * 10 / 300 = 3.33 -> 3
        assertThat(calculator.equivalentToken1For(BigInteger.TEN).getValueUnsafe()).isEqualTo(BigInteger.valueOf(3));
        assertThat(calculator.equivalentToken1For(BigInteger.TWO).getValueUnsafe()).isZero();
    }

    @Test
    @DisplayName("Withdraw estimate is proportional to the share of the pool")
    void testWithdrawEstimate() {
        EstimateCalculator calculator = calculatorFor(100, 300, 100_000_000);

        Result<WithdrawEstimate, DomainError> full = calculator.withdrawEstimate(BigInteger.valueOf(100_000_000));
        Result<WithdrawEstimate, DomainError> onePercent = calculator.withdrawEstimate(BigInteger.valueOf(1_000_000));
        Result<WithdrawEstimate, DomainError> dust = calculator.withdrawEstimate(BigInteger.valueOf(333_333));

        assertThat(full.getValueUnsafe()).isEqualTo(new WithdrawEstimate(BigInteger.valueOf(100), BigInteger.valueOf(300)));
        assertThat(onePercent.getValueUnsafe()).isEqualTo(new WithdrawEstimate(BigInteger.ONE, BigInteger.valueOf(3)));
        assertThat(dust.getValueUnsafe()).isEqualTo(new WithdrawEstimate(BigInteger.ZERO, BigInteger.ZERO));
    }

    @Test
    @DisplayName("Asking for more shares than exist is INVALID_SHARE")
    void testWithdrawEstimateInvalidShare() {
        EstimateCalculator calculator = calculatorFor(150, 150, 150_000_000);

        Result<WithdrawEstimate, DomainError> result = calculator.withdrawEstimate(BigInteger.valueOf(150_000_001));

        assertThat(result.getErrorUnsafe()).isInstanceOf(InvalidShareError.class);
    }

    @Test
    @DisplayName("Every estimate fails with ZERO_LIQUIDITY on an empty pool")
    void testEmptyPool() {
        Pool pool = new Pool(0);
        EstimateCalculator calculator = new EstimateCalculator(pool, new InvariantEngine(pool));

        assertThat(calculator.equivalentToken1For(BigInteger.ONE).getErrorUnsafe()).isInstanceOf(ZeroLiquidityError.class);
        assertThat(calculator.equivalentToken2For(BigInteger.ONE).getErrorUnsafe()).isInstanceOf(ZeroLiquidityError.class);
        assertThat(calculator.withdrawEstimate(BigInteger.ONE).getErrorUnsafe()).isInstanceOf(ZeroLiquidityError.class);
    }

    @Test
    @DisplayName("Estimates are pure reads")
    void testEstimatesArePure() {
        Pool pool = new Pool(0);
        pool.deposit(BigInteger.valueOf(777), BigInteger.valueOf(1234), BigInteger.valueOf(100_000_000));
        EstimateCalculator calculator = new EstimateCalculator(pool, new InvariantEngine(pool));
        PoolDetails before = pool.details();

        BigInteger first = calculator.equivalentToken2For(BigInteger.valueOf(55)).getValueUnsafe();
        BigInteger second = calculator.equivalentToken2For(BigInteger.valueOf(55)).getValueUnsafe();
        WithdrawEstimate firstWithdraw = calculator.withdrawEstimate(BigInteger.valueOf(12_345_678)).getValueUnsafe();
        WithdrawEstimate secondWithdraw = calculator.withdrawEstimate(BigInteger.valueOf(12_345_678)).getValueUnsafe();

        assertThat(second).isEqualTo(first);
        assertThat(secondWithdraw).isEqualTo(firstWithdraw);
        assertThat(pool.details()).isEqualTo(before);
    }
}
