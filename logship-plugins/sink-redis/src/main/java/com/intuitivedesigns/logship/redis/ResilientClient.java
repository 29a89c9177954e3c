/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.TransportException;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Runs commands against an {@link EndpointPool}, moving to the next endpoint when one fails.
 *
 * <p>By default one call makes as many attempts as the pool has endpoints, so a single sweep
 * visits every endpoint once. A failed connection is purged, never reused.</p>
 */
public final class ResilientClient<C extends EndpointConnection> {

    private static final Logger log = LoggerFactory.getLogger(ResilientClient.class);

    @FunctionalInterface
    public interface Command<C, R> {
        R execute(C connection) throws TransportException;
    }

    private final EndpointPool<C> pool;
    private final int attempts;
    private final MetricsRuntime metrics;

    public ResilientClient(EndpointPool<C> pool) {
        this(pool, 0, MetricsRuntime.noop());
    }

    /**
     * @param attempts fixed number of attempts per call; 0 or less means one per endpoint
     */
    public ResilientClient(EndpointPool<C> pool, int attempts, MetricsRuntime metrics) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.attempts = attempts;
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    /**
     * @throws TransportException wrapping the last failure once every attempt has failed
     */
    public <R> R execute(String name, Command<? super C, R> command) throws TransportException {
        int limit = attempts > 0 ? attempts : Math.max(1, pool.endpointCount());
        Exception last = null;

        for (int attempt = 1; attempt <= limit; attempt++) {
            final C conn;
            try {
                conn = pool.lease();
            } catch (TransportException e) {
                last = e;
                log.warn("{}: no connection (attempt {}/{}): {}", name, attempt, limit, e.getMessage());
                continue;
            }

            long start = System.nanoTime();
            try {
                R result = command.execute(conn);
                pool.release(conn);
                return result;
            } catch (TransportException | RuntimeException e) {
                last = e;
                pool.purge(conn);
                log.warn("{} failed on {} (attempt {}/{}): {}", name, conn.endpoint(), attempt, limit, e.getMessage());
            } finally {
                metrics.timer("logship.client." + name.toLowerCase(Locale.ROOT), System.nanoTime() - start);
            }
        }

        String cause = (last != null) ? last.getMessage() : "no attempts made";
        throw new TransportException(name + " failed after " + limit + " attempt(s): " + cause, last);
    }

    public EndpointPool<C> pool() {
        return pool;
    }
}
