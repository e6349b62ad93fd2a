// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

import com.digitalasset.ammpool.engine.PoolDetails;

/**
 * Pool DTO for frontend consumption
 * Represents the pool reserves, issued shares, fee parameter and constant product
 */
public class PoolDTO {
    public final String totalToken1;
    public final String totalToken2;
    public final String totalShares;
    public final long feeBasisPoints;
    public final String k;
    public final boolean active;

    public PoolDTO(String totalToken1, String totalToken2, String totalShares,
                   long feeBasisPoints, String k, boolean active) {
        this.totalToken1 = totalToken1;
        this.totalToken2 = totalToken2;
        this.totalShares = totalShares;
        this.feeBasisPoints = feeBasisPoints;
        this.k = k;
        this.active = active;
    }

    public static PoolDTO from(PoolDetails details) {
        return new PoolDTO(
                details.totalToken1().toString(),
                details.totalToken2().toString(),
                details.totalShares().toString(),
                details.feeBasisPoints(),
                details.k().toString(),
                details.active()
        );
    }
}
