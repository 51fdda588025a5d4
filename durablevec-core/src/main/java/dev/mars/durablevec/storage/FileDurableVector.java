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

import dev.mars.durablevec.storage.LogRecord.Append;
import dev.mars.durablevec.storage.LogRecord.Tombstone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File-based implementation of {@link DurableVector}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  └─ .vector.bin   // append-only log of APPEND and TOMBSTONE records
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Every operation, reads included, runs under one {@link ReentrantLock} that
 * covers both the log write position and the in-memory index. A mutation
 * writes its record and updates the index inside the same critical section,
 * so readers never see an item whose record is not yet in the log.
 * <p>
 * <b>Durability:</b>
 * Writes go straight to the log file descriptor. A {@link DurabilityDaemon}
 * forces the file to disk every {@link VectorConfig#syncPeriod()}, and earlier
 * after every {@link VectorConfig#batchWakeCount()} mutations. Closing the
 * vector performs one last sync. Log I/O ignores thread interrupts, so an
 * interrupted caller gets a normal result and leaves the log usable.
 * <p>
 * <b>Recovery:</b>
 * Opening an existing log replays it through {@link LogRecovery}. A torn
 * final record is trimmed; any other inconsistency fails the open with
 * {@link CorruptLogException}.
 *
 * @see DurableVector
 */
public final class FileDurableVector implements DurableVector {

    private static final Logger LOG = LoggerFactory.getLogger(FileDurableVector.class);

    /** Log file name inside the data directory. */
    static final String LOG_FILE = ".vector.bin";

    private final VectorConfig config;
    private final Path logPath;
    private final ReentrantLock lock = new ReentrantLock();
    private final VectorIndex index;
    private final IdAllocator ids;
    private final LogHandle log;
    private final DurabilityDaemon daemon;
    private final ReplaySummary replaySummary;

    // guarded by lock
    private long mutationCount;
    private boolean writeFailed;
    private boolean closed;

    private FileDurableVector(VectorConfig config, Path logPath, VectorIndex index, IdAllocator ids,
                              LogHandle log, ReplaySummary replaySummary) {
        this.config = config;
        this.logPath = logPath;
        this.index = index;
        this.ids = ids;
        this.log = log;
        this.replaySummary = replaySummary;
        this.daemon = new DurabilityDaemon(log, lock, config.syncPeriod());
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    /**
     * Opens the vector stored in {@code dataDir}, creating it if needed.
     * Other settings are resolved as described in {@link VectorConfig}.
     *
     * @throws StorageException    if the log cannot be read or opened for append
     * @throws CorruptLogException if the existing log cannot be replayed
     */
    public static FileDurableVector open(Path dataDir) {
        return open(VectorConfig.builder().dataDir(dataDir).build());
    }

    /**
     * Opens the vector described by {@code config}, creating it if needed.
     *
     * @throws StorageException    if the log cannot be read or opened for append
     * @throws CorruptLogException if the existing log cannot be replayed
     */
    public static FileDurableVector open(VectorConfig config) {
        return open(config, FileLogHandle::open);
    }

    static FileDurableVector open(VectorConfig config, LogHandle.Opener opener) {
        Path dataDir = config.dataDir();
        LOG.info("Opening durable vector at: {} ({})", dataDir, config);
        if (!config.syncEnabled()) {
            LOG.warn("Durable vector opened with fsync DISABLED. Do NOT use in production!");
        }

        VectorIndex index = new VectorIndex();
        IdAllocator ids = new IdAllocator(config.idRecycling());
        try {
            Files.createDirectories(dataDir);
            Path logPath = dataDir.resolve(LOG_FILE);

            ReplaySummary summary = LogRecovery.replay(logPath, index, ids);
            LogHandle log = opener.open(logPath, config.syncEnabled());

            FileDurableVector vector = new FileDurableVector(config, logPath, index, ids, log, summary);
            vector.daemon.start();
            LOG.info("Durable vector opened: path={}, items={}, nextId={}", logPath, index.size(), ids.peekNext());
            return vector;
        } catch (IOException e) {
            LOG.error("Failed to open durable vector at {}: {}", dataDir, e.getMessage(), e);
            throw new StorageException("Failed to open durable vector at " + dataDir, e);
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                LOG.debug("Vector already closed, ignoring duplicate close()");
                return;
            }
            closed = true;
        } finally {
            lock.unlock();
        }
        LOG.info("Closing durable vector at: {}", logPath);

        daemon.stop();
        try {
            log.close();
        } catch (IOException e) {
            LOG.warn("Error closing log: {}", e.getMessage());
        }
        LOG.info("Durable vector closed after {} syncs", daemon.syncCount());
    }

    // ========================================================================
    // Mutations
    // ========================================================================

    @Override
    public long pushBack(byte[] value) {
        Objects.requireNonNull(value, "value");
        if (value.length > MAX_VALUE_SIZE) {
            throw new IllegalArgumentException("value too large: " + value.length
                    + " bytes (max: " + MAX_VALUE_SIZE + ")");
        }
        byte[] copy = value.clone();

        lock.lock();
        try {
            ensureWritable();
            // the id is only consumed once its record is written
            long id = ids.peekNext();
            writeRecord(new Append(id, copy));
            ids.allocate();
            index.append(new Item(id, copy));
            LOG.trace("pushBack: id={}, valueLen={}, size={}", id, copy.length, index.size());
            afterMutation();
            return id;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void erase(int position) {
        lock.lock();
        try {
            ensureWritable();
            checkIndex(position);
            Item item = index.get(position);
            writeRecord(new Tombstone(item.id(), position));
            index.remove(position);
            ids.reclaim(item.id());
            LOG.trace("erase: index={}, id={}, size={}", position, item.id(), index.size());
            afterMutation();
        } finally {
            lock.unlock();
        }
    }

    private void writeRecord(LogRecord record) {
        try {
            log.write(LogCodec.encode(record));
        } catch (IOException e) {
            // a partial record may now end the log; later appends would follow it
            writeFailed = true;
            LOG.error("Failed to write {} record for id {}: {}",
                    record instanceof Append ? "APPEND" : "TOMBSTONE", record.id(), e.getMessage(), e);
            throw new StorageException("Failed to write log record to " + logPath, e);
        }
    }

    private void afterMutation() {
        int batch = config.batchWakeCount();
        if (batch > 0 && ++mutationCount % batch == 0) {
            daemon.wake();
        }
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Override
    public byte[] at(int position) {
        lock.lock();
        try {
            ensureOpen();
            checkIndex(position);
            return index.get(position).value().clone();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            ensureOpen();
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long idAt(int position) {
        lock.lock();
        try {
            ensureOpen();
            checkIndex(position);
            return index.get(position).id();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Item> items() {
        lock.lock();
        try {
            ensureOpen();
            return index.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long nextId() {
        lock.lock();
        try {
            ensureOpen();
            return ids.peekNext();
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Durability
    // ========================================================================

    @Override
    public void sync() {
        lock.lock();
        try {
            ensureOpen();
            log.flush();
        } catch (IOException e) {
            LOG.error("Failed to flush log: {}", e.getMessage(), e);
            throw new StorageException("Failed to flush log " + logPath, e);
        } finally {
            lock.unlock();
        }

        try {
            log.sync();
            LOG.debug("Explicit sync of {} complete", logPath);
        } catch (IOException e) {
            LOG.error("Failed to sync log: {}", e.getMessage(), e);
            throw new StorageException("Failed to sync log " + logPath, e);
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    /** Returns the configuration this vector was opened with. */
    public VectorConfig config() {
        return config;
    }

    /** Returns what the replay at open recovered. */
    public ReplaySummary replaySummary() {
        return replaySummary;
    }

    /** Path of the log file. */
    public Path logPath() {
        return logPath;
    }

    DurabilityDaemon.State daemonState() {
        return daemon.state();
    }

    long syncCount() {
        return daemon.syncCount();
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Vector is closed: " + logPath);
        }
    }

    private void ensureWritable() {
        ensureOpen();
        if (writeFailed) {
            throw new IllegalStateException("An earlier log write failed; reopen the vector to recover: " + logPath);
        }
    }

    private void checkIndex(int position) {
        if (position < 0 || position >= index.size()) {
            throw new IndexOutOfBoundsException("index out of range: " + position + " (size: " + index.size() + ")");
        }
    }
}
