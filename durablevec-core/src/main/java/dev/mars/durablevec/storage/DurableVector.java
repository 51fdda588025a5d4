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

import java.io.Closeable;
import java.util.Arrays;
import java.util.List;

/**
 * An ordered list of small byte values that survives process restarts.
 * <p>
 * Every mutation is appended to a log before it becomes visible, so a value
 * returned by {@link #at(int)} always has its record in the log.
 * <p>
 * <b>Durability Contract:</b> a mutation is safe from a process crash once
 * the call returns, because the bytes are already with the operating system.
 * It is safe from power loss only after the next sync, which a background
 * task performs periodically. Call {@link #sync()} for an explicit barrier.
 *
 * @see FileDurableVector
 */
public interface DurableVector extends Closeable {

    /** Largest value, in bytes, that {@link #pushBack(byte[])} accepts. */
    int MAX_VALUE_SIZE = 4096;

    /**
     * Appends a value to the end of the vector.
     *
     * @param value the bytes to store, at most {@link #MAX_VALUE_SIZE}
     * @return the id assigned to the new item
     * @throws IllegalArgumentException if the value is too large
     * @throws StorageException         if the log write fails
     */
    long pushBack(byte[] value);

    /**
     * Removes the item at {@code index}. Later items move down one position,
     * so indexes held past this call must be re-derived.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
     * @throws StorageException          if the log write fails
     */
    void erase(int index);

    /**
     * Returns a copy of the value at {@code index}. No I/O.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
     */
    byte[] at(int index);

    /** Number of live items. */
    int size();

    /**
     * Returns the id of the item at {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
     */
    long idAt(int index);

    /** Immutable snapshot of all live items in order. */
    List<Item> items();

    /** The id the next {@link #pushBack(byte[])} will assign. */
    long nextId();

    /**
     * Durability barrier: forces every mutation made so far to stable storage.
     *
     * @throws StorageException if the sync fails
     */
    void sync();

    /**
     * Stops background syncing after a final sync and closes the log.
     * Idempotent; every other method fails after close.
     */
    @Override
    void close();

    /**
     * A live item.
     *
     * @param id    the item id, unique among live items
     * @param value the stored bytes
     */
    record Item(long id, byte[] value) {

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Item other)) {
                return false;
            }
            return id == other.id && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(id) + Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Item[id=" + id + ", valueLen=" + value.length + "]";
        }
    }
}
