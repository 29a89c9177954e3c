/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.TransportException;

/**
 * The Redis commands the queue sink needs.
 */
public interface RedisConnection extends EndpointConnection {

    /**
     * Pushes {@code value} onto the head of list {@code key}.
     *
     * @return the list length after the push
     */
    long lpush(String key, String value) throws TransportException;
}
