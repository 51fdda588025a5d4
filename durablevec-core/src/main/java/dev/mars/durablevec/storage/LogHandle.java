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
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;

/**
 * Write side of the vector log.
 * <p>
 * {@link #write} and {@link #flush} are called with the vector lock held.
 * {@link #sync} may run concurrently with writes from another thread.
 */
interface LogHandle extends Closeable {

    /** Writes the whole buffer at the end of the log. */
    void write(ByteBuffer buf) throws IOException;

    /** Pushes any user-space buffered bytes to the operating system. */
    void flush() throws IOException;

    /** Forces everything handed to the operating system onto stable storage. */
    void sync() throws IOException;

    @Override
    void close() throws IOException;

    /** Opens the log file at a path for appending. */
    @FunctionalInterface
    interface Opener {
        LogHandle open(Path path, boolean syncEnabled) throws IOException;
    }
}
