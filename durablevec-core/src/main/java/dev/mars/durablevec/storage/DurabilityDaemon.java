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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Background thread that periodically forces the vector log to stable storage.
 * <p>
 * <b>Lifecycle:</b>
 * <pre>
 * RUNNING --stop()--&gt; DRAINING (one final flush + sync) --&gt; STOPPED
 * </pre>
 * While running, the thread waits on a condition of the vector lock for at
 * most one sync period. On timeout or {@link #wake()} it flushes with the lock
 * held, then releases the lock for the sync itself so writers are not blocked
 * behind the disk.
 * <p>
 * <b>Failure:</b> a failed sync means appended data may never reach the disk.
 * The failure is logged and handed to the failure action, which by default
 * halts the JVM.
 */
final class DurabilityDaemon {

    private static final Logger LOG = LoggerFactory.getLogger(DurabilityDaemon.class);

    /** Daemon lifecycle states. */
    enum State {
        RUNNING,
        DRAINING,
        STOPPED
    }

    private final LogHandle log;
    private final ReentrantLock lock;
    private final Condition wakeup;
    private final long periodNanos;
    private final Consumer<IOException> onSyncFailure;
    private final Thread thread;
    private final AtomicLong syncCount = new AtomicLong();

    private volatile State state = State.RUNNING;

    // guarded by lock
    private boolean stopRequested;
    private boolean wakeRequested;

    DurabilityDaemon(LogHandle log, ReentrantLock lock, Duration period) {
        this(log, lock, period, DurabilityDaemon::halt);
    }

    DurabilityDaemon(LogHandle log, ReentrantLock lock, Duration period, Consumer<IOException> onSyncFailure) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Sync period must be positive: " + period);
        }
        this.log = log;
        this.lock = lock;
        this.wakeup = lock.newCondition();
        this.periodNanos = period.toNanos();
        this.onSyncFailure = onSyncFailure;
        this.thread = new Thread(this::run, "durablevec-sync");
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
        LOG.debug("Durability daemon started: period={} ms", periodNanos / 1_000_000);
    }

    /**
     * Asks for a flush + sync ahead of the timer. Advisory: several wakes
     * before the daemon runs collapse into one sync.
     */
    void wake() {
        lock.lock();
        try {
            wakeRequested = true;
            wakeup.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the daemon and waits for its final flush + sync.
     * <p>
     * Must not be called with the vector lock held: draining needs it.
     */
    void stop() {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("stop() called while holding the vector lock");
        }
        lock.lock();
        try {
            stopRequested = true;
            wakeup.signal();
        } finally {
            lock.unlock();
        }

        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("Durability daemon stopped after {} syncs", syncCount.get());
    }

    State state() {
        return state;
    }

    /** Number of completed flush + sync cycles, including the final drain. */
    long syncCount() {
        return syncCount.get();
    }

    private void run() {
        boolean interrupted = false;
        lock.lock();
        try {
            while (!stopRequested) {
                if (!wakeRequested) {
                    wakeup.awaitNanos(periodNanos);
                }
                if (stopRequested) {
                    break;
                }
                wakeRequested = false;
                flushAndSync();
            }
        } catch (InterruptedException e) {
            // restored only after the drain so the final sync runs with a clear flag
            interrupted = true;
            LOG.warn("Durability daemon interrupted, draining");
        } finally {
            state = State.DRAINING;
            try {
                flushAndSync();
            } finally {
                lock.unlock();
                state = State.STOPPED;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Called and returns with the lock held; the lock is released around the sync.
     */
    private void flushAndSync() {
        try {
            log.flush();
            lock.unlock();
            try {
                log.sync();
            } finally {
                lock.lock();
            }
            syncCount.incrementAndGet();
        } catch (IOException e) {
            LOG.error("Failed to sync log: {}", e.getMessage(), e);
            onSyncFailure.accept(e);
        }
    }

    private static void halt(IOException cause) {
        LOG.error("Unsynced log data cannot be made durable, halting JVM");
        Runtime.getRuntime().halt(1);
    }
}
