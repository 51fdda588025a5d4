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

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link LogHandle} over a {@link FileOutputStream} opened in append mode.
 * <p>
 * Writes go straight to the file descriptor, so a record is in the OS page
 * cache when {@link #write} returns and {@link #flush} has nothing to do.
 * <p>
 * <b>Interrupts:</b> neither {@link FileOutputStream#write} nor
 * {@link java.io.FileDescriptor#sync()} reacts to the calling thread's
 * interrupt status. A caller that happens to be interrupted cannot close the
 * log underneath the vector, as it could with an interruptible
 * {@link java.nio.channels.FileChannel}.
 */
final class FileLogHandle implements LogHandle {

    private static final Logger LOG = LoggerFactory.getLogger(FileLogHandle.class);

    private final Path path;
    private final FileOutputStream out;
    private final boolean syncEnabled;

    private FileLogHandle(Path path, FileOutputStream out, boolean syncEnabled) {
        this.path = path;
        this.out = out;
        this.syncEnabled = syncEnabled;
    }

    /**
     * Opens (creating if needed) the log for appending.
     */
    static FileLogHandle open(Path path, boolean syncEnabled) throws IOException {
        FileOutputStream out = new FileOutputStream(path.toFile(), true);
        LOG.debug("Log opened for append: path={}, size={} bytes", path, Files.size(path));
        return new FileLogHandle(path, out, syncEnabled);
    }

    @Override
    public void write(ByteBuffer buf) throws IOException {
        if (buf.hasArray()) {
            out.write(buf.array(), buf.arrayOffset() + buf.position(), buf.remaining());
            buf.position(buf.limit());
        } else {
            byte[] bytes = new byte[buf.remaining()];
            buf.get(bytes);
            out.write(bytes);
        }
    }

    @Override
    public void flush() {
        // unbuffered: every write is already with the OS
    }

    @Override
    public void sync() throws IOException {
        if (!syncEnabled) {
            LOG.trace("sync() skipped, fsync is disabled");
            return;
        }
        long startNanos = System.nanoTime();
        out.getFD().sync();
        LOG.trace("Log synced to disk in {} us", (System.nanoTime() - startNanos) / 1000);
    }

    @Override
    public void close() throws IOException {
        out.close();
        LOG.debug("Log closed: {}", path);
    }
}
