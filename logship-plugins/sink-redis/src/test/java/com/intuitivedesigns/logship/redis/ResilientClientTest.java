/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.TransportException;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResilientClientTest {

    private static final Endpoint E1 = new Endpoint("a", 1001, 0);
    private static final Endpoint E2 = new Endpoint("b", 1002, 0);
    private static final Endpoint E3 = new Endpoint("c", 1003, 0);

    private final FakeRedis redis = new FakeRedis();

    private ResilientClient<RedisConnection> client(int maxPerEndpoint, Endpoint... endpoints) {
        EndpointPool<RedisConnection> pool = new EndpointPool<>(List.of(endpoints), redis, maxPerEndpoint, MetricsRuntime.noop(), () -> 1L);
        return new ResilientClient<>(pool);
    }

    @Test
    void testSucceedsOnFirstHealthyEndpoint() throws Exception {
        ResilientClient<RedisConnection> client = client(0, E1, E2);

        assertEquals(1L, client.<Long>execute("LPUSH", c -> c.lpush("logs", "x")));
        assertEquals(List.of("1001 logs x"), redis.log);
        assertEquals(1, client.pool().availableCount(0));
        assertEquals(0, client.pool().inUseCount(0));
    }

    @Test
    void testFailsOverToNextEndpoint() throws Exception {
        redis.down.add(E1);
        ResilientClient<RedisConnection> client = client(0, E1, E2, E3);

        client.execute("LPUSH", c -> c.lpush("logs", "x"));

        assertEquals(List.of("1002 logs x"), redis.log);
        assertEquals(0, client.pool().createdCount(0));
        assertTrue(redis.opened.get(0).closed);
    }

    @Test
    void testGivesUpAfterOneSweep() {
        redis.down.addAll(List.of(E1, E2, E3));
        ResilientClient<RedisConnection> client = client(0, E1, E2, E3);
        AtomicInteger calls = new AtomicInteger();

        TransportException e = assertThrows(TransportException.class, () -> client.execute("LPUSH", c -> {
            calls.incrementAndGet();
            return c.lpush("logs", "x");
        }));

        assertEquals(3, calls.get());
        assertTrue(e.getMessage().contains("3 attempt"));
        assertInstanceOf(TransportException.class, e.getCause());
        for (int i = 0; i < 3; i++) {
            assertEquals(0, client.pool().inUseCount(i));
            assertEquals(0, client.pool().availableCount(i));
        }
        assertEquals(0, redis.openCount());
    }

    @Test
    void testExhaustedLeaseConsumesAnAttempt() throws Exception {
        ResilientClient<RedisConnection> client = client(1, E1, E2);
        RedisConnection held = client.pool().lease(); // E1 at cap, cursor at E2
        client.pool().lease(); // E2 at cap, cursor back at E1

        TransportException e = assertThrows(TransportException.class, () -> client.execute("LPUSH", c -> c.lpush("k", "v")));

        assertInstanceOf(PoolExhaustedException.class, e.getCause());
        assertTrue(redis.log.isEmpty());
        client.pool().release(held);
        assertEquals(1L, client.<Long>execute("LPUSH", c -> c.lpush("k", "v")));
    }

    @Test
    void testRuntimeFailurePurgesConnection() throws Exception {
        ResilientClient<RedisConnection> client = client(0, E1, E2);
        AtomicInteger calls = new AtomicInteger();

        String result = client.execute("PING", c -> {
            if (calls.getAndIncrement() == 0) {
                throw new IllegalStateException("protocol desync");
            }
            return c.endpoint().host();
        });

        assertEquals("b", result);
        assertTrue(redis.opened.get(0).closed);
    }

    @Test
    void testAttemptsFollowEndpointCountAtCallTime() {
        redis.down.addAll(List.of(E1, E2, E3));
        ResilientClient<RedisConnection> client = client(0, E1);
        client.pool().addEndpoint(E2);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransportException.class, () -> client.execute("LPUSH", c -> {
            calls.incrementAndGet();
            return c.lpush("k", "v");
        }));
        assertEquals(2, calls.get());
    }

    @Test
    void testFixedAttemptCount() {
        redis.down.add(E1);
        EndpointPool<RedisConnection> pool = new EndpointPool<>(List.of(E1), redis, 0, MetricsRuntime.noop(), () -> 1L);
        ResilientClient<RedisConnection> client = new ResilientClient<>(pool, 3, MetricsRuntime.noop());

        assertThrows(TransportException.class, () -> client.execute("LPUSH", c -> c.lpush("k", "v")));
        assertEquals(3, redis.opened.size());
    }
}
