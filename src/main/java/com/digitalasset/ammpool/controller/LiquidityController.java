// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.controller;

import com.digitalasset.ammpool.constants.PoolConstants;
import com.digitalasset.ammpool.dto.FaucetRequest;
import com.digitalasset.ammpool.dto.HoldingsResponse;
import com.digitalasset.ammpool.dto.ProvideLiquidityRequest;
import com.digitalasset.ammpool.dto.ProvideLiquidityResponse;
import com.digitalasset.ammpool.dto.WithdrawLiquidityRequest;
import com.digitalasset.ammpool.dto.WithdrawLiquidityResponse;
import com.digitalasset.ammpool.engine.CallerId;
import com.digitalasset.ammpool.engine.Holdings;
import com.digitalasset.ammpool.engine.PoolDetails;
import com.digitalasset.ammpool.engine.WithdrawEstimate;
import com.digitalasset.ammpool.service.PoolService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;


/**
 * LiquidityController - Handles liquidity provision, removal and the token faucet.
 */
@RestController
@RequestMapping("/api/liquidity")
public class LiquidityController {

    private static final Logger logger = LoggerFactory.getLogger(LiquidityController.class);
    private final PoolService poolService;
    private final boolean faucetEnabled;

    public LiquidityController(PoolService poolService,
                               @Value("${ammpool.faucet.enabled:true}") boolean faucetEnabled) {
        this.poolService = poolService;
        this.faucetEnabled = faucetEnabled;
    }

    @PostMapping("/provide")
    @WithSpan
    public ProvideLiquidityResponse provide(
            @RequestHeader(value = PoolConstants.CALLER_HEADER, required = false) String callerHeader,
            @Valid @RequestBody ProvideLiquidityRequest req
    ) {
        CallerId caller = CallerResolver.unwrap(CallerResolver.resolve(callerHeader));
        logger.info("POST /api/liquidity/provide - caller: {}, amounts: {}/{}", caller, req.amountToken1, req.amountToken2);

        PoolService.Provided provided = CallerResolver.unwrap(poolService.provide(caller, req.amountToken1, req.amountToken2));
        PoolDetails pool = provided.poolAfter();
        return new ProvideLiquidityResponse(
                provided.shareAmount().toString(),
                pool.totalToken1().toString(),
                pool.totalToken2().toString(),
                pool.totalShares().toString()
        );
    }

    @PostMapping("/withdraw")
    @WithSpan
    public WithdrawLiquidityResponse withdraw(
            @RequestHeader(value = PoolConstants.CALLER_HEADER, required = false) String callerHeader,
            @Valid @RequestBody WithdrawLiquidityRequest req
    ) {
        CallerId caller = CallerResolver.unwrap(CallerResolver.resolve(callerHeader));
        logger.info("POST /api/liquidity/withdraw - caller: {}, shares: {}", caller, req.shareAmount);

        PoolService.Withdrawn withdrawn = CallerResolver.unwrap(poolService.withdraw(caller, req.shareAmount));
        WithdrawEstimate released = withdrawn.released();
        PoolDetails pool = withdrawn.poolAfter();
        return new WithdrawLiquidityResponse(
                withdrawn.shareAmount().toString(),
                released.amountToken1().toString(),
                released.amountToken2().toString(),
                pool.totalToken1().toString(),
                pool.totalToken2().toString(),
                pool.totalShares().toString()
        );
    }

    @PostMapping("/faucet")
    @WithSpan
    public HoldingsResponse faucet(
            @RequestHeader(value = PoolConstants.CALLER_HEADER, required = false) String callerHeader,
            @Valid @RequestBody FaucetRequest req
    ) {
        if (!faucetEnabled) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Faucet is disabled (ammpool.faucet.enabled=false)");
        }
        CallerId caller = CallerResolver.unwrap(CallerResolver.resolve(callerHeader));
        logger.info("POST /api/liquidity/faucet - caller: {}, amounts: {}/{}", caller, req.amountToken1, req.amountToken2);

        Holdings holdings = poolService.faucet(caller, req.amountToken1, req.amountToken2);
        return HoldingsResponse.from(caller, holdings);
    }
}
