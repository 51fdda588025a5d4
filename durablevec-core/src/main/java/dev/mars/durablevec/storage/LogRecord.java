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

/**
 * A single mutation recorded in the vector log.
 * <p>
 * Each kind carries its own payload: an {@link Append} holds the value that
 * was pushed, a {@link Tombstone} holds the position it removed. The wire
 * layout is produced by {@link LogCodec}.
 */
interface LogRecord {

    /** Record kind tag for an appended item. */
    long KIND_APPEND = 1;

    /** Record kind tag for an erased item. */
    long KIND_TOMBSTONE = 2;

    /** The wire tag of this record. */
    long kind();

    /** The id of the item this record refers to. */
    long id();

    /**
     * An item pushed to the back of the vector.
     *
     * @param id    the id assigned to the item
     * @param value the item bytes (at most {@link LogCodec#MAX_VALUE_SIZE})
     */
    record Append(long id, byte[] value) implements LogRecord {
        @Override
        public long kind() {
            return KIND_APPEND;
        }
    }

    /**
     * An item removed from the vector.
     *
     * @param id    the id of the removed item
     * @param index the position the item occupied when it was removed
     */
    record Tombstone(long id, long index) implements LogRecord {
        @Override
        public long kind() {
            return KIND_TOMBSTONE;
        }
    }
}
