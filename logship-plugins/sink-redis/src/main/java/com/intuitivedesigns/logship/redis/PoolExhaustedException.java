/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.TransportException;

/**
 * No connection could be leased: the endpoint at the cursor reached its cap, or the pool
 * has no endpoints at all.
 */
public final class PoolExhaustedException extends TransportException {

    public PoolExhaustedException(String message) {
        super(message);
    }
}
