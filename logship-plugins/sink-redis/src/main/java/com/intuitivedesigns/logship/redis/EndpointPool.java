/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.TransportException;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Round-robin connection pool over an ordered list of endpoints.
 *
 * <p>Each endpoint keeps its own available and in-use connections plus a count of live
 * connections created for it; that count never exceeds the per-endpoint cap. Every
 * {@link #lease()} moves the cursor to the next endpoint, whether or not it succeeds.</p>
 *
 * <p>The pool belongs to the process that created it. Before each operation the current
 * process identity is compared with the recorded one; after a fork the child abandons
 * every inherited connection without closing it (the sockets belong to the parent) and
 * starts a new, empty generation. Connections from an older generation are ignored by
 * {@link #release} and {@link #purge}.</p>
 *
 * <p>Not thread-safe: one pool serves one sequential sink.</p>
 */
public final class EndpointPool<C extends EndpointConnection> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EndpointPool.class);

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final List<Endpoint> endpoints;
    private final ConnectionFactory<? extends C> factory;
    private final int maxPerEndpoint;
    private final MetricsRuntime metrics;
    private final LongSupplier processId;

    private long ownerProcess;
    private PoolState<C> state;
    private int cursor;

    public EndpointPool(List<Endpoint> endpoints, ConnectionFactory<? extends C> factory) {
        this(endpoints, factory, UNBOUNDED, MetricsRuntime.noop(), () -> ProcessHandle.current().pid());
    }

    public EndpointPool(List<Endpoint> endpoints,
                        ConnectionFactory<? extends C> factory,
                        int maxPerEndpoint,
                        MetricsRuntime metrics,
                        LongSupplier processId) {
        this.endpoints = new ArrayList<>(Objects.requireNonNull(endpoints, "endpoints"));
        this.factory = Objects.requireNonNull(factory, "factory");
        this.maxPerEndpoint = maxPerEndpoint > 0 ? maxPerEndpoint : UNBOUNDED;
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
        this.processId = Objects.requireNonNull(processId, "processId");
        this.ownerProcess = processId.getAsLong();
        this.state = new PoolState<>(0, this.endpoints);
    }

    /**
     * Leases a connection to the endpoint at the cursor, creating one if none is available
     * and the endpoint is under its cap.
     *
     * @throws PoolExhaustedException if the endpoint is at its cap or the pool has no endpoints
     * @throws TransportException if a new connection cannot be established
     */
    public C lease() throws TransportException {
        checkProcess();
        if (endpoints.isEmpty()) {
            throw new PoolExhaustedException("Pool has no endpoints");
        }
        int index = cursor;
        try {
            Slot<C> slot = state.slots.get(index);
            C conn = slot.available.poll();
            if (conn == null) {
                if (slot.created >= maxPerEndpoint) {
                    throw new PoolExhaustedException("Too many connections to " + slot.endpoint
                            + " (" + slot.created + "/" + maxPerEndpoint + ")");
                }
                conn = factory.connect(slot.endpoint);
                slot.created++;
                state.owners.put(conn, slot);
                metrics.counter("logship.pool.connections.created");
                log.debug("Opened connection #{} to {}", slot.created, slot.endpoint);
            }
            slot.inUse.add(conn);
            return conn;
        } finally {
            cursor = (index + 1) % endpoints.size();
        }
    }

    /**
     * Returns a leased connection to its endpoint's available set.
     */
    public void release(C conn) {
        checkProcess();
        Slot<C> slot = state.owners.get(conn);
        if (slot == null) {
            log.debug("Ignoring release of a connection this generation does not own");
            return;
        }
        if (slot.inUse.remove(conn)) {
            slot.available.push(conn);
        }
    }

    /**
     * Removes a connection from the pool for good and closes it. Its endpoint may then
     * open a replacement.
     */
    public void purge(C conn) {
        checkProcess();
        Slot<C> slot = state.owners.remove(conn);
        if (slot == null) {
            log.debug("Ignoring purge of a connection this generation does not own");
            return;
        }
        slot.inUse.remove(conn);
        slot.available.remove(conn);
        slot.created--;
        metrics.counter("logship.pool.connections.purged");
        closeQuietly(conn);
    }

    /**
     * Starts a new generation: every current connection is abandoned (not closed) and the
     * cursor goes back to the first endpoint.
     */
    public void reset() {
        int abandoned = state.owners.size();
        state = new PoolState<>(state.generation + 1, endpoints);
        cursor = 0;
        log.debug("Pool reset to generation {} ({} connections abandoned)", state.generation, abandoned);
    }

    public void addEndpoint(Endpoint endpoint) {
        checkProcess();
        Objects.requireNonNull(endpoint, "endpoint");
        endpoints.add(endpoint);
        state.slots.add(new Slot<>(endpoint));
        log.info("Endpoint {} added to pool ({} endpoints)", endpoint, endpoints.size());
    }

    /**
     * Removes the first endpoint equal to {@code endpoint} and closes all its connections.
     *
     * @return false if no such endpoint is configured
     */
    public boolean removeEndpoint(Endpoint endpoint) {
        checkProcess();
        int index = endpoints.indexOf(endpoint);
        if (index < 0) {
            return false;
        }
        Slot<C> slot = state.slots.remove(index);
        endpoints.remove(index);
        closeAll(slot);

        if (index < cursor) {
            cursor--;
        }
        if (cursor >= endpoints.size()) {
            cursor = 0;
        }
        log.info("Endpoint {} removed from pool ({} endpoints)", endpoint, endpoints.size());
        return true;
    }

    /**
     * Closes every connection this generation owns.
     */
    @Override
    public void close() {
        checkProcess();
        for (Slot<C> slot : state.slots) {
            closeAll(slot);
        }
    }

    public List<Endpoint> endpoints() {
        return List.copyOf(endpoints);
    }

    public int endpointCount() {
        return endpoints.size();
    }

    public int availableCount(int index) {
        checkProcess();
        return state.slots.get(index).available.size();
    }

    public int inUseCount(int index) {
        checkProcess();
        return state.slots.get(index).inUse.size();
    }

    public int createdCount(int index) {
        checkProcess();
        return state.slots.get(index).created;
    }

    public long generation() {
        checkProcess();
        return state.generation;
    }

    int cursor() {
        return cursor;
    }

    private void checkProcess() {
        long current = processId.getAsLong();
        if (current != ownerProcess) {
            log.info("Process identity changed ({} -> {}); abandoning inherited connections", ownerProcess, current);
            ownerProcess = current;
            reset();
        }
    }

    private void closeAll(Slot<C> slot) {
        List<C> conns = new ArrayList<>(slot.available);
        conns.addAll(slot.inUse);
        slot.available.clear();
        slot.inUse.clear();
        slot.created = 0;
        for (C conn : conns) {
            state.owners.remove(conn);
            closeQuietly(conn);
        }
    }

    private static void closeQuietly(EndpointConnection conn) {
        try {
            conn.close();
        } catch (RuntimeException e) {
            log.debug("Ignoring close failure for connection to {}", conn.endpoint(), e);
        }
    }

    private static final class PoolState<C> {
        final long generation;
        final List<Slot<C>> slots = new ArrayList<>();
        final Map<C, Slot<C>> owners = new IdentityHashMap<>();

        PoolState(long generation, List<Endpoint> endpoints) {
            this.generation = generation;
            for (Endpoint endpoint : endpoints) {
                slots.add(new Slot<>(endpoint));
            }
        }
    }

    private static final class Slot<C> {
        final Endpoint endpoint;
        final Deque<C> available = new ArrayDeque<>();
        final Set<C> inUse = Collections.newSetFromMap(new IdentityHashMap<>());
        int created;

        Slot(Endpoint endpoint) {
            this.endpoint = endpoint;
        }
    }
}
