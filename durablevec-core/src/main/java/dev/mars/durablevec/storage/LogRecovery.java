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

import dev.mars.durablevec.storage.DurableVector.Item;
import dev.mars.durablevec.storage.LogCodec.Decoded;
import dev.mars.durablevec.storage.LogCodec.Status;
import dev.mars.durablevec.storage.LogRecord.Append;
import dev.mars.durablevec.storage.LogRecord.Tombstone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Rebuilds the in-memory state of a vector from its log.
 * <p>
 * <b>Replay rules:</b>
 * <ul>
 *   <li>APPEND: the item goes to the back of the index and its id is registered
 *       with the allocator.</li>
 *   <li>TOMBSTONE: the recorded position must hold the recorded id. The item is
 *       removed and its id reclaimed.</li>
 *   <li>A partial record at the end of the file stops replay quietly. The file
 *       is truncated back to the last complete record so new appends start on a
 *       record boundary.</li>
 *   <li>Reads and the truncation use stream and {@link RandomAccessFile} I/O,
 *       which ignores the interrupt status of the opening thread.</li>
 *   <li>Any complete record that cannot be applied fails the replay with
 *       {@link CorruptLogException}.</li>
 * </ul>
 */
final class LogRecovery {

    private static final Logger LOG = LoggerFactory.getLogger(LogRecovery.class);

    private static final int READ_BUFFER_SIZE = 64 * 1024;

    private LogRecovery() {
    }

    /**
     * Replays {@code logPath} into an empty index and allocator.
     *
     * @return what was recovered
     * @throws IOException         if the log cannot be read or trimmed
     * @throws CorruptLogException if a complete record is invalid
     */
    static ReplaySummary replay(Path logPath, VectorIndex index, IdAllocator ids) throws IOException {
        if (!Files.exists(logPath)) {
            LOG.debug("No log file found at {}, starting empty", logPath);
            return ReplaySummary.EMPTY;
        }

        LOG.info("Replaying log from: {}", logPath);
        long startTime = System.currentTimeMillis();
        long fileSize = Files.size(logPath);
        long pos = 0;
        long appendCount = 0;
        long tombstoneCount = 0;
        Set<Long> liveIds = new HashSet<>();

        try (InputStream in = new BufferedInputStream(new FileInputStream(logPath.toFile()), READ_BUFFER_SIZE)) {
            while (true) {
                Decoded decoded = LogCodec.decode(in);
                if (decoded.status() == Status.CORRUPT) {
                    LOG.error("Corrupt record at pos {}: {}", pos, decoded.reason());
                    throw new CorruptLogException(pos, decoded.reason());
                }
                if (decoded.status() == Status.TORN_TAIL) {
                    LOG.debug("Torn record at pos {}: {}", pos, decoded.reason());
                    break;
                }
                if (decoded.status() == Status.END) {
                    break;
                }

                LogRecord record = decoded.record();
                if (record instanceof Append append) {
                    applyAppend(append, pos, index, ids, liveIds);
                    appendCount++;
                } else {
                    applyTombstone((Tombstone) record, pos, index, ids, liveIds);
                    tombstoneCount++;
                }
                pos += decoded.length();
            }
        }

        long discarded = fileSize - pos;
        if (discarded > 0) {
            LOG.warn("Truncating torn tail: {} bytes removed (file was {} bytes, valid data {} bytes)",
                    discarded, fileSize, pos);
            try (RandomAccessFile raf = new RandomAccessFile(logPath.toFile(), "rw")) {
                raf.setLength(pos);
                raf.getFD().sync();
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        LOG.info("Log replay complete: {} items recovered, {} appends, {} tombstones, {} ms",
                index.size(), appendCount, tombstoneCount, elapsed);
        return new ReplaySummary(index.size(), appendCount, tombstoneCount, pos, discarded, elapsed);
    }

    private static void applyAppend(Append append, long pos, VectorIndex index,
                                    IdAllocator ids, Set<Long> liveIds) {
        if (!liveIds.add(append.id())) {
            throw new CorruptLogException(pos, "append reuses live id " + append.id());
        }
        index.append(new Item(append.id(), append.value()));
        ids.observe(append.id());
        LOG.trace("Replay APPEND: id={}, valueLen={}", append.id(), append.value().length);
    }

    private static void applyTombstone(Tombstone tombstone, long pos, VectorIndex index,
                                       IdAllocator ids, Set<Long> liveIds) {
        long target = tombstone.index();
        if (target < 0 || target >= index.size()) {
            throw new CorruptLogException(pos, "tombstone index " + Long.toUnsignedString(target)
                    + " out of range for " + index.size() + " items");
        }
        Item item = index.get((int) target);
        if (item.id() != tombstone.id()) {
            throw new CorruptLogException(pos, "tombstone for id " + tombstone.id()
                    + " but index " + target + " holds id " + item.id());
        }
        index.remove((int) target);
        liveIds.remove(item.id());
        ids.reclaim(item.id());
        LOG.trace("Replay TOMBSTONE: id={}, index={}", tombstone.id(), target);
    }
}
