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
 * Thrown during replay when a complete record cannot be applied.
 * <p>
 * Unlike a torn tail, a corrupt record is never skipped: opening the vector
 * fails so that no history is silently dropped.
 */
public class CorruptLogException extends StorageException {

    private final long offset;

    public CorruptLogException(long offset, String message) {
        super("Corrupt log at offset " + offset + ": " + message);
        this.offset = offset;
    }

    /** Byte offset of the record that failed validation. */
    public long offset() {
        return offset;
    }
}
