/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.durablevec.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DurabilityDaemon} against an in-memory {@link LogHandle}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Periodic and wake-triggered syncs</li>
 *   <li>Exactly one drain on stop</li>
 *   <li>Flush under the vector lock, sync outside it</li>
 *   <li>Sync failures reach the failure action</li>
 * </ul>
 */
class DurabilityDaemonTest {

    private static final Duration LONG_PERIOD = Duration.ofHours(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final RecordingLogHandle handle = new RecordingLogHandle();
    private DurabilityDaemon daemon;

    @AfterEach
    void tearDown() {
        handle.releaseSync();
        if (daemon != null && daemon.state() != DurabilityDaemon.State.STOPPED) {
            daemon.stop();
        }
    }

    private DurabilityDaemon start(Duration period) {
        daemon = new DurabilityDaemon(handle, lock, period);
        daemon.start();
        return daemon;
    }

    private static void awaitTrue(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message);
            }
            Thread.sleep(5);
        }
    }

    @Test
    @DisplayName("Syncs on every period")
    void testPeriodicSync() throws InterruptedException {
        start(Duration.ofMillis(20));

        awaitTrue(() -> daemon.syncCount() >= 3, "expected at least 3 periodic syncs");
        assertTrue(handle.syncs.get() >= 3);
    }

    @Test
    @DisplayName("wake() syncs ahead of the period")
    void testWake() throws InterruptedException {
        start(LONG_PERIOD);

        daemon.wake();

        awaitTrue(() -> daemon.syncCount() == 1, "wake should trigger a sync");
        assertEquals(DurabilityDaemon.State.RUNNING, daemon.state());
    }

    @Test
    @DisplayName("stop() drains exactly once and ends STOPPED")
    void testStopDrains() {
        start(LONG_PERIOD);
        assertEquals(DurabilityDaemon.State.RUNNING, daemon.state());

        daemon.stop();

        assertEquals(DurabilityDaemon.State.STOPPED, daemon.state());
        assertEquals(1, daemon.syncCount());
        assertEquals(1, handle.flushes.get());
        assertEquals(1, handle.syncs.get());
    }

    @Test
    @DisplayName("Flush runs under the lock, sync runs outside it")
    void testLockDiscipline() {
        start(LONG_PERIOD);
        daemon.wake();
        daemon.stop();

        assertFalse(handle.lockHeldAtFlush.isEmpty());
        assertTrue(handle.lockHeldAtFlush.stream().allMatch(held -> held));
        assertTrue(handle.lockHeldAtSync.stream().noneMatch(held -> held));
    }

    @Test
    @DisplayName("Writers can take the lock while a sync is in progress")
    void testWritersNotBlockedBySync() throws InterruptedException {
        handle.blockSync();
        start(LONG_PERIOD);

        daemon.wake();
        assertTrue(handle.syncEntered.await(5, TimeUnit.SECONDS));

        assertTrue(lock.tryLock(1, TimeUnit.SECONDS), "lock should be free during sync");
        lock.unlock();

        handle.releaseSync();
        awaitTrue(() -> daemon.syncCount() == 1, "sync should complete once released");
    }

    @Test
    @DisplayName("Sync failure is handed to the failure action")
    void testSyncFailure() throws InterruptedException {
        handle.failSync = true;
        List<IOException> failures = new CopyOnWriteArrayList<>();
        daemon = new DurabilityDaemon(handle, lock, LONG_PERIOD, failures::add);
        daemon.start();

        daemon.wake();

        awaitTrue(() -> !failures.isEmpty(), "failure action should be invoked");
        assertEquals("disk gone", failures.get(0).getMessage());
        assertEquals(0, daemon.syncCount());
    }

    @Test
    @DisplayName("stop() while holding the lock is rejected")
    void testStopWhileHoldingLock() {
        start(LONG_PERIOD);

        lock.lock();
        try {
            assertThrows(IllegalStateException.class, () -> daemon.stop());
        } finally {
            lock.unlock();
        }
        assertEquals(DurabilityDaemon.State.RUNNING, daemon.state());
    }

    @Test
    @DisplayName("Non-positive period is rejected")
    void testInvalidPeriod() {
        assertThrows(IllegalArgumentException.class,
                () -> new DurabilityDaemon(handle, lock, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new DurabilityDaemon(handle, lock, Duration.ofMillis(-5)));
    }

    /**
     * Counts calls and records whether the vector lock was held for each.
     */
    private final class RecordingLogHandle implements LogHandle {
        final AtomicInteger flushes = new AtomicInteger();
        final AtomicInteger syncs = new AtomicInteger();
        final List<Boolean> lockHeldAtFlush = new CopyOnWriteArrayList<>();
        final List<Boolean> lockHeldAtSync = new CopyOnWriteArrayList<>();
        final CountDownLatch syncEntered = new CountDownLatch(1);
        volatile boolean failSync;
        private volatile CountDownLatch syncGate;

        void blockSync() {
            syncGate = new CountDownLatch(1);
        }

        void releaseSync() {
            CountDownLatch gate = syncGate;
            if (gate != null) {
                gate.countDown();
            }
        }

        @Override
        public void write(ByteBuffer buf) {
            buf.position(buf.limit());
        }

        @Override
        public void flush() {
            lockHeldAtFlush.add(lock.isHeldByCurrentThread());
            flushes.incrementAndGet();
        }

        @Override
        public void sync() throws IOException {
            lockHeldAtSync.add(lock.isHeldByCurrentThread());
            syncEntered.countDown();
            CountDownLatch gate = syncGate;
            if (gate != null) {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
            if (failSync) {
                throw new IOException("disk gone");
            }
            syncs.incrementAndGet();
        }

        @Override
        public void close() {
        }
    }
}
