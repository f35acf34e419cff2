package com.realmgate.gateway.session;

import com.realmgate.core.testing.MutableClock;
import com.realmgate.gateway.config.GatewayConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

    private MutableClock clock;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        manager = newManager(3);
        manager.start();
    }

    private ConnectionManager newManager(int maxConnections) {
        GatewayConfig config = GatewayConfig.builder().maxConnections(maxConnections).build();
        return new ConnectionManager(config, new SimpleMeterRegistry(), clock);
    }

    // ========== Admission ==========

    @Test
    @DisplayName("Admits up to the limit, then rejects without touching the registry")
    void admitsUpToLimit() {
        assertEquals(AdmissionResult.ADMITTED, manager.admit("conn_1", "10.0.0.1"));
        assertEquals(AdmissionResult.ADMITTED, manager.admit("conn_2", "10.0.0.2"));
        assertEquals(AdmissionResult.ADMITTED, manager.admit("conn_3", "10.0.0.3"));

        assertEquals(AdmissionResult.CAPACITY_EXCEEDED, manager.admit("conn_4", "10.0.0.4"));

        assertEquals(3, manager.stats().totalConnections());
        assertTrue(manager.get("conn_4").isEmpty());
        assertEquals(3.0, manager.metrics().get("connection_accepted", 0));
        assertEquals(1.0, manager.metrics().get("connection_rejected", 0));
    }

    @Test
    @DisplayName("Removing a connection frees a slot")
    void removeFreesSlot() {
        manager.admit("conn_1", "10.0.0.1");
        manager.admit("conn_2", "10.0.0.2");
        manager.admit("conn_3", "10.0.0.3");

        assertTrue(manager.remove("conn_2"));

        assertEquals(AdmissionResult.ADMITTED, manager.admit("conn_4", "10.0.0.4"));
        assertEquals(3, manager.stats().totalConnections());
    }

    @Test
    @DisplayName("A live id cannot be admitted twice and the original record is kept")
    void duplicateRejected() {
        manager.admit("conn_1", "10.0.0.1");
        manager.authenticate("conn_1", "alice");

        assertEquals(AdmissionResult.DUPLICATE, manager.admit("conn_1", "10.9.9.9"));

        ConnectionRecord record = manager.get("conn_1").orElseThrow();
        assertEquals("10.0.0.1", record.getClientIp());
        assertEquals("alice", record.getUserId());
        assertEquals(1, manager.stats().totalConnections());
    }

    @Test
    @DisplayName("Unknown ids are no-ops for remove and authenticate")
    void unknownIdsAreNoOps() {
        assertFalse(manager.remove("ghost"));
        assertFalse(manager.authenticate("ghost", "bob"));
        manager.touch("ghost");
        manager.recordReceived("ghost", 10);

        assertEquals(0, manager.stats().totalConnections());
        assertTrue(manager.get("ghost").isEmpty());
    }

    @Test
    @DisplayName("New records start unauthenticated with both timestamps at admission time")
    void newRecordShape() {
        Instant admittedAt = clock.instant();
        manager.admit("conn_1", "10.0.0.1");

        ConnectionRecord record = manager.get("conn_1").orElseThrow();
        assertEquals("conn_1", record.getConnectionId());
        assertNull(record.getUserId());
        assertFalse(record.isAuthenticated());
        assertEquals(admittedAt, record.getConnectedAt());
        assertEquals(admittedAt, record.getLastActivity());
        assertEquals(0, record.getBytesSent());
        assertEquals(0, record.getBytesReceived());
    }

    // ========== Authentication ==========

    @Test
    @DisplayName("Authenticate sets user id and flag and is reflected in stats")
    void authenticate() {
        manager.admit("conn_1", "10.0.0.1");
        manager.admit("conn_2", "10.0.0.2");

        assertTrue(manager.authenticate("conn_1", "alice"));
        assertTrue(manager.authenticate("conn_1", "alice-again"));

        ConnectionRecord record = manager.get("conn_1").orElseThrow();
        assertTrue(record.isAuthenticated());
        assertEquals("alice-again", record.getUserId());
        assertEquals(1, manager.stats().authenticatedConnections());

        manager.remove("conn_1");
        assertEquals(0, manager.stats().authenticatedConnections());
    }

    @Test
    @DisplayName("Records handed out are snapshots")
    void recordsAreSnapshots() {
        manager.admit("conn_1", "10.0.0.1");
        ConnectionRecord before = manager.get("conn_1").orElseThrow();

        manager.authenticate("conn_1", "alice");

        assertFalse(before.isAuthenticated());
        assertTrue(manager.get("conn_1").orElseThrow().isAuthenticated());
    }

    // ========== Activity ==========

    @Test
    @DisplayName("touch never moves the activity timestamp backwards")
    void touchNeverRegresses() {
        manager.admit("conn_1", "10.0.0.1");
        clock.advance(Duration.ofSeconds(30));
        manager.touch("conn_1");
        Instant latest = clock.instant();

        clock.rewind(Duration.ofSeconds(20));
        manager.touch("conn_1");

        assertEquals(latest, manager.get("conn_1").orElseThrow().getLastActivity());
    }

    @Test
    @DisplayName("Traffic counters accumulate and inbound traffic counts as activity")
    void trafficCounters() {
        manager.admit("conn_1", "10.0.0.1");
        clock.advance(Duration.ofSeconds(5));

        manager.recordReceived("conn_1", 100);
        manager.recordReceived("conn_1", 20);
        manager.recordSent("conn_1", 64);

        ConnectionRecord record = manager.get("conn_1").orElseThrow();
        assertEquals(120, record.getBytesReceived());
        assertEquals(64, record.getBytesSent());
        assertEquals(clock.instant(), record.getLastActivity());
    }

    // ========== Stats ==========

    @Test
    @DisplayName("Stats report utilization against capacity with the legacy key names")
    void stats() {
        ConnectionManager manager = newManager(4);
        manager.admit("conn_1", "10.0.0.1");
        manager.authenticate("conn_1", "alice");

        ConnectionStats stats = manager.stats();
        assertEquals(1, stats.totalConnections());
        assertEquals(1, stats.authenticatedConnections());
        assertEquals(4, stats.maxConnections());
        assertEquals(0.25, stats.utilization());

        Map<String, Object> map = stats.toMap();
        assertEquals(List.of("total_connections", "authenticated_connections", "max_connections",
            "connection_utilization"), new ArrayList<>(map.keySet()));
    }

    // ========== Sweep ==========

    @Test
    @DisplayName("Sweep evicts only connections idle longer than the timeout")
    void sweepEvictsIdle() {
        manager.admit("idle", "10.0.0.1");
        manager.admit("busy", "10.0.0.2");

        clock.advance(Duration.ofSeconds(2));
        manager.touch("busy");
        clock.advance(Duration.ofMillis(1500));

        List<String> evicted = manager.sweep(Duration.ofSeconds(3));

        assertEquals(List.of("idle"), evicted);
        assertTrue(manager.get("idle").isEmpty());
        assertTrue(manager.get("busy").isPresent());
        assertEquals(1, manager.stats().totalConnections());
        assertEquals(1.0, manager.metrics().get("connections_cleaned", 0));
    }

    @Test
    @DisplayName("A connection exactly at the timeout survives the sweep")
    void sweepBoundaryIsExclusive() {
        manager.admit("conn_1", "10.0.0.1");
        clock.advance(Duration.ofSeconds(3));

        assertEquals(List.of(), manager.sweep(Duration.ofSeconds(3)));

        clock.advance(Duration.ofMillis(1));
        assertEquals(List.of("conn_1"), manager.sweep(Duration.ofSeconds(3)));
    }

    @Test
    @DisplayName("Sweep on a real clock evicts a connection idle for two seconds")
    void sweepWithWallClock() throws InterruptedException {
        ConnectionManager wallClock = new ConnectionManager(
            GatewayConfig.builder().maxConnections(10).build(), new SimpleMeterRegistry());
        wallClock.start();
        wallClock.admit("conn_1", "10.0.0.1");

        Thread.sleep(2_100);

        assertEquals(List.of("conn_1"), wallClock.sweep(Duration.ofSeconds(1)));
        assertEquals(0, wallClock.stats().totalConnections());
        wallClock.stop();
    }

    // ========== Concurrency ==========

    @Test
    @DisplayName("Concurrent admissions never exceed the limit and count matches the registry")
    void concurrentAdmission() throws Exception {
        ConnectionManager manager = newManager(100);
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int offset = t * perThread;
            results.add(executor.submit(() -> {
                start.await();
                int admitted = 0;
                for (int i = 0; i < perThread; i++) {
                    if (manager.admit("conn_" + (offset + i), "10.0.0.1").isAdmitted()) {
                        admitted++;
                    }
                }
                return admitted;
            }));
        }
        start.countDown();

        int admitted = 0;
        for (Future<Integer> result : results) {
            admitted += result.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(100, admitted);
        assertEquals(100, manager.stats().totalConnections());
        int present = 0;
        for (int i = 0; i < threads * perThread; i++) {
            if (manager.get("conn_" + i).isPresent()) {
                present++;
            }
        }
        assertEquals(100, present);
    }

    @Test
    @DisplayName("Stats taken during churn never report more authenticated than admitted connections")
    void statsAreConsistentUnderChurn() throws Exception {
        ConnectionManager manager = newManager(1000);
        int writers = 4;
        int rounds = 2000;
        ExecutorService executor = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> churn = new ArrayList<>();

        for (int t = 0; t < writers; t++) {
            int thread = t;
            churn.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    String id = "conn_" + thread + "_" + i;
                    manager.admit(id, "10.0.0.1");
                    manager.authenticate(id, "user-" + i);
                    manager.remove(id);
                }
                return null;
            }));
        }
        Future<Integer> reader = executor.submit(() -> {
            start.await();
            int torn = 0;
            while (!churn.stream().allMatch(Future::isDone)) {
                ConnectionStats stats = manager.stats();
                if (stats.authenticatedConnections() > stats.totalConnections()) {
                    torn++;
                }
            }
            return torn;
        });
        start.countDown();

        for (Future<?> writer : churn) {
            writer.get(30, TimeUnit.SECONDS);
        }
        int torn = reader.get(30, TimeUnit.SECONDS);
        executor.shutdown();

        assertEquals(0, torn);
        assertEquals(0, manager.stats().totalConnections());
        assertEquals(0, manager.stats().authenticatedConnections());
    }

    // ========== Lifecycle ==========

    @Test
    @DisplayName("Stop clears the registry and is idempotent")
    void stopClears() {
        manager.admit("conn_1", "10.0.0.1");
        manager.authenticate("conn_1", "alice");

        manager.stop();
        manager.stop();

        assertFalse(manager.isRunning());
        assertEquals(0, manager.stats().totalConnections());
        assertEquals(0, manager.stats().authenticatedConnections());
        assertTrue(manager.get("conn_1").isEmpty());
        assertEquals("false", manager.healthSnapshot().get("running"));
    }
}
