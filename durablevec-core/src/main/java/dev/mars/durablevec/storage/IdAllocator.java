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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Assigns item ids and recycles the ids of erased items.
 * <p>
 * Reclaimed ids are handed out again oldest-first. When the free list is
 * empty a new id is minted above the high-water mark, so a freshly minted id
 * is always greater than every id seen before. Ids are unsigned 64-bit values,
 * as stored in the log, and are compared as such.
 * <p>
 * <b>Not thread-safe.</b> Owned by a single vector and only touched under its lock.
 */
final class IdAllocator {

    private final boolean recycling;
    private final Deque<Long> freeIds = new ArrayDeque<>();
    private long lastAssigned;

    IdAllocator(boolean recycling) {
        this.recycling = recycling;
    }

    /**
     * Returns the next id: the oldest reclaimed id if any, otherwise a new one.
     */
    long allocate() {
        Long recycled = freeIds.pollFirst();
        if (recycled != null) {
            return recycled;
        }
        return ++lastAssigned;
    }

    /**
     * Returns the id that {@link #allocate()} would hand out, without consuming it.
     */
    long peekNext() {
        Long recycled = freeIds.peekFirst();
        return recycled != null ? recycled : lastAssigned + 1;
    }

    /**
     * Makes the id of an erased item available again. No-op when recycling is disabled.
     */
    void reclaim(long id) {
        if (recycling) {
            freeIds.addLast(id);
        }
    }

    /**
     * Registers an id read back from the log during replay.
     * <p>
     * The id is live again, so if it was recycled it leaves the free list.
     * Replay sees recycled ids in allocation order, which makes the head of
     * the queue the usual match.
     */
    void observe(long id) {
        if (Long.compareUnsigned(id, lastAssigned) > 0) {
            lastAssigned = id;
        }
        if (!freeIds.isEmpty()) {
            if (freeIds.peekFirst() == id) {
                freeIds.pollFirst();
            } else {
                freeIds.remove(id);
            }
        }
    }

    /** The highest id ever assigned or observed, as an unsigned value. */
    long lastAssigned() {
        return lastAssigned;
    }

    /** Number of ids waiting to be recycled. */
    int freeCount() {
        return freeIds.size();
    }
}
