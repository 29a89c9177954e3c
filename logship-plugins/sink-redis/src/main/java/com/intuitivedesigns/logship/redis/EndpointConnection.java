/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

/**
 * A live connection bound to one {@link Endpoint} and owned by an {@link EndpointPool}.
 */
public interface EndpointConnection extends AutoCloseable {

    Endpoint endpoint();

    /**
     * Releases the underlying socket. Must not throw.
     */
    @Override
    void close();
}
