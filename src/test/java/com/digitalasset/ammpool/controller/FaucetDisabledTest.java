// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "ammpool.faucet.enabled=false",
        "ammpool.fee-basis-points=1500"
})
class FaucetDisabledTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testFaucet_isForbiddenWhenDisabled() throws Exception {
        mockMvc.perform(post("/api/liquidity/faucet")
                        .header("X-Caller-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amountToken1\":10,\"amountToken2\":10}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        mockMvc.perform(get("/api/pool/holdings").header("X-Caller-Id", "alice"))
                .andExpect(jsonPath("$.token1Balance").value("0"));
    }

    @Test
    void testOutOfRangeFee_isStoredAsZero() throws Exception {
        mockMvc.perform(get("/api/pool"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.feeBasisPoints").value(0));
    }
}
