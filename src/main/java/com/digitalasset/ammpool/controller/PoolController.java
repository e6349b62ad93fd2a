// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.controller;

import com.digitalasset.ammpool.constants.PoolConstants;
import com.digitalasset.ammpool.dto.EquivalentAmountResponse;
import com.digitalasset.ammpool.dto.HoldingsResponse;
import com.digitalasset.ammpool.dto.PoolDTO;
import com.digitalasset.ammpool.dto.WithdrawEstimateResponse;
import com.digitalasset.ammpool.engine.CallerId;
import com.digitalasset.ammpool.engine.WithdrawEstimate;
import com.digitalasset.ammpool.service.PoolService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Read-only pool views: totals, the caller's holdings and deposit/withdrawal estimates.
 */
@RestController
@RequestMapping("/api/pool")
public class PoolController {

    private static final Logger LOG = LoggerFactory.getLogger(PoolController.class);
    private final PoolService poolService;

    public PoolController(PoolService poolService) {
        this.poolService = poolService;
    }

    @GetMapping
    @WithSpan
    public PoolDTO pool() {
        return PoolDTO.from(poolService.poolDetails());
    }

    /**
     * GET /api/pool/holdings with the caller header
     */
    @GetMapping("/holdings")
    @WithSpan
    public HoldingsResponse holdings(
            @RequestHeader(value = PoolConstants.CALLER_HEADER, required = false) String callerHeader
    ) {
        CallerId caller = CallerResolver.unwrap(CallerResolver.resolve(callerHeader));
        LOG.debug("GET /api/pool/holdings caller={}", caller);
        return HoldingsResponse.from(caller, poolService.holdingsOf(caller));
    }

    /**
     * GET /api/pool/estimate/token1?amountToken2=...
     */
    @GetMapping("/estimate/token1")
    @WithSpan
    public EquivalentAmountResponse equivalentToken1(@RequestParam("amountToken2") BigInteger amountToken2) {
        BigInteger input = CallerResolver.unwrap(CallerResolver.unsigned("amountToken2", amountToken2));
        BigInteger token1 = CallerResolver.unwrap(poolService.equivalentToken1For(input));
        return new EquivalentAmountResponse("token2", input.toString(), "token1", token1.toString());
    }

    /**
     * GET /api/pool/estimate/token2?amountToken1=...
     */
    @GetMapping("/estimate/token2")
    @WithSpan
    public EquivalentAmountResponse equivalentToken2(@RequestParam("amountToken1") BigInteger amountToken1) {
        BigInteger input = CallerResolver.unwrap(CallerResolver.unsigned("amountToken1", amountToken1));
        BigInteger token2 = CallerResolver.unwrap(poolService.equivalentToken2For(input));
        return new EquivalentAmountResponse("token1", input.toString(), "token2", token2.toString());
    }

    /**
     * GET /api/pool/estimate/withdraw?shareAmount=...
     */
    @GetMapping("/estimate/withdraw")
    @WithSpan
    public WithdrawEstimateResponse withdrawEstimate(@RequestParam("shareAmount") BigInteger shareAmount) {
        BigInteger shares = CallerResolver.unwrap(CallerResolver.unsigned("shareAmount", shareAmount));
        WithdrawEstimate estimate = CallerResolver.unwrap(poolService.withdrawEstimate(shares));
        return new WithdrawEstimateResponse(
                shares.toString(),
                estimate.amountToken1().toString(),
                estimate.amountToken2().toString()
        );
    }
}
