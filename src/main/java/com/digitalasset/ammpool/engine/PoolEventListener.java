// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.engine;

/**
 * Observer of committed pool transitions.
 *
 * Called synchronously, after the commit, on the thread that ran the operation.
 * An exception thrown here is logged and does not affect the operation.
 */
@FunctionalInterface
public interface PoolEventListener {

    void onPoolEvent(PoolEvent event);
}
