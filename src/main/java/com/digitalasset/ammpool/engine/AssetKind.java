// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

/**
 * The three balances every account carries.
 */
public enum AssetKind {
    TOKEN1("token1"),
    TOKEN2("token2"),
    SHARE("share");

    private final String label;

    AssetKind(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
