/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.TransportException;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class EndpointPoolTest {

    private static final Endpoint E1 = new Endpoint("a", 6379, 0);
    private static final Endpoint E2 = new Endpoint("b", 6380, 0);
    private static final Endpoint E3 = new Endpoint("c", 6381, 0);

    private final FakeRedis redis = new FakeRedis();
    private final AtomicLong pid = new AtomicLong(100);

    private EndpointPool<RedisConnection> pool(int max, Endpoint... endpoints) {
        return new EndpointPool<>(List.of(endpoints), redis, max, MetricsRuntime.noop(), pid::get);
    }

    @Test
    void testRoundRobinWraps() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1, E2, E3);

        for (Endpoint expected : List.of(E1, E2, E3, E1)) {
            RedisConnection conn = pool.lease();
            assertEquals(expected, conn.endpoint());
            pool.release(conn);
        }
    }

    @Test
    void testReleasedConnectionIsReused() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1);

        RedisConnection first = pool.lease();
        pool.release(first);
        RedisConnection second = pool.lease();

        assertSame(first, second);
        assertEquals(1, pool.createdCount(0));
        assertEquals(1, pool.inUseCount(0));
        assertEquals(0, pool.availableCount(0));
    }

    @Test
    void testCapPerEndpoint() throws Exception {
        EndpointPool<RedisConnection> pool = pool(2, E1);

        pool.lease();
        pool.lease();
        PoolExhaustedException e = assertThrows(PoolExhaustedException.class, pool::lease);
        assertTrue(e.getMessage().contains(E1.toString()));
        assertEquals(2, pool.createdCount(0));
    }

    @Test
    void testCursorAdvancesOnFailure() throws Exception {
        EndpointPool<RedisConnection> pool = pool(1, E1, E2);
        pool.lease(); // E1 now at its cap

        assertEquals(E2, pool.lease().endpoint());
        assertThrows(PoolExhaustedException.class, pool::lease); // E1
        assertThrows(PoolExhaustedException.class, pool::lease); // E2
        assertEquals(0, pool.cursor());
    }

    @Test
    void testFailedConnectAdvancesCursor() {
        redis.unreachable.add(E1);
        EndpointPool<RedisConnection> pool = pool(0, E1, E2);

        assertThrows(TransportException.class, pool::lease);
        assertEquals(1, pool.cursor());
        assertEquals(0, pool.createdCount(0));
    }

    @Test
    void testPurgeClosesAndFreesCapacity() throws Exception {
        EndpointPool<RedisConnection> pool = pool(1, E1);
        RedisConnection conn = pool.lease();

        pool.purge(conn);

        assertTrue(((FakeRedis.Conn) conn).closed);
        assertEquals(0, pool.inUseCount(0));
        assertEquals(0, pool.createdCount(0));
        RedisConnection replacement = pool.lease();
        assertNotSame(conn, replacement);
    }

    @Test
    void testCapCountsLiveConnectionsNotLifetimeCreations() throws Exception {
        EndpointPool<RedisConnection> pool = pool(1, E1);

        for (int i = 0; i < 3; i++) {
            RedisConnection conn = pool.lease();
            assertEquals(1, pool.createdCount(0));
            pool.purge(conn);
        }

        assertEquals(3, redis.opened.size());
        RedisConnection live = pool.lease();
        assertThrows(PoolExhaustedException.class, pool::lease);
        pool.release(live);
    }

    @Test
    void testPurgedConnectionIsNeverReused() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1);
        RedisConnection conn = pool.lease();
        pool.purge(conn);
        pool.release(conn);

        assertEquals(0, pool.availableCount(0));
        assertNotSame(conn, pool.lease());
    }

    @Test
    void testEmptyPoolIsExhausted() {
        EndpointPool<RedisConnection> pool = pool(0);

        assertThrows(PoolExhaustedException.class, pool::lease);
    }

    @Test
    void testRemoveEndpointKeepsCursorInRange() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1, E2, E3);
        pool.release(pool.lease()); // E1
        pool.release(pool.lease()); // E2, cursor now at E3

        assertTrue(pool.removeEndpoint(E3));
        assertEquals(0, pool.cursor());
        assertEquals(E1, pool.lease().endpoint());
    }

    @Test
    void testRemoveEndpointBeforeCursorKeepsNextTarget() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1, E2, E3);
        pool.release(pool.lease()); // E1
        pool.release(pool.lease()); // E2, cursor now at E3

        assertTrue(pool.removeEndpoint(E1));
        assertEquals(List.of(E2, E3), pool.endpoints());
        assertEquals(E3, pool.lease().endpoint());
    }

    @Test
    void testRemoveEndpointClosesItsConnections() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1, E2);
        RedisConnection idle = pool.lease();
        RedisConnection busy = pool.lease(); // E2
        RedisConnection busyE1 = pool.lease();
        pool.release(idle);

        assertTrue(pool.removeEndpoint(E1));
        assertTrue(((FakeRedis.Conn) idle).closed);
        assertTrue(((FakeRedis.Conn) busyE1).closed);
        assertFalse(((FakeRedis.Conn) busy).closed);
        assertFalse(pool.removeEndpoint(E1));
    }

    @Test
    void testAddEndpointJoinsRotation() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1);
        pool.addEndpoint(E2);

        assertEquals(E1, pool.lease().endpoint());
        assertEquals(E2, pool.lease().endpoint());
        assertEquals(2, pool.endpointCount());
    }

    @Test
    void testProcessChangeStartsNewGeneration() throws Exception {
        EndpointPool<RedisConnection> pool = pool(1, E1);
        RedisConnection inherited = pool.lease();
        assertEquals(0, pool.generation());

        pid.set(200);

        assertEquals(1, pool.generation());
        assertEquals(0, pool.createdCount(0));
        RedisConnection fresh = pool.lease();
        assertNotSame(inherited, fresh);
        assertFalse(((FakeRedis.Conn) inherited).closed);

        pool.release(inherited);
        pool.purge(inherited);
        assertEquals(0, pool.availableCount(0));
        assertEquals(1, pool.inUseCount(0));
        assertFalse(((FakeRedis.Conn) inherited).closed);
    }

    @Test
    void testResetAbandonsConnections() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1);
        RedisConnection old = pool.lease();
        pool.release(old);

        pool.reset();

        assertEquals(1, pool.generation());
        assertEquals(0, pool.availableCount(0));
        assertNotSame(old, pool.lease());
    }

    @Test
    void testResetRewindsCursor() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1, E2, E3);
        pool.lease();
        pool.lease();
        assertEquals(2, pool.cursor());

        pool.reset();

        assertEquals(0, pool.cursor());
        assertEquals(E1, pool.lease().endpoint());
    }

    @Test
    void testCloseAfterProcessChangeLeavesInheritedConnectionsOpen() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1, E2);
        RedisConnection inherited = pool.lease();
        pool.release(pool.lease());

        pid.set(200);
        pool.close();

        assertFalse(((FakeRedis.Conn) inherited).closed);
        assertEquals(2, redis.openCount());
        assertEquals(1, pool.generation());
    }

    @Test
    void testCloseClosesEverything() throws Exception {
        EndpointPool<RedisConnection> pool = pool(0, E1, E2);
        pool.release(pool.lease());
        pool.lease();

        pool.close();

        assertEquals(0, redis.openCount());
    }
}
