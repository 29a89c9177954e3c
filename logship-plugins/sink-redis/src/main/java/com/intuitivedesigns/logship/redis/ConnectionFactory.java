/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.TransportException;

@FunctionalInterface
public interface ConnectionFactory<C extends EndpointConnection> {

    C connect(Endpoint endpoint) throws TransportException;
}
