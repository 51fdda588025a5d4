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

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary encoding of {@link LogRecord}s.
 * <p>
 * <b>Record Layout (little-endian, no padding):</b>
 * <pre>
 * +-----------+-----------+-----------+----------------------+
 * | KIND (8)  | ID (8)    | AUX (8)   | PAYLOAD (AUX bytes)  |
 * +-----------+-----------+-----------+----------------------+
 * KIND = 1 (append):    AUX = payload length, payload follows
 * KIND = 2 (tombstone): AUX = index removed, no payload
 * </pre>
 * There is no terminator and no checksum: the end of the file is the only
 * record boundary signal, and a trailing partial record is reported as a
 * torn tail rather than an error.
 */
final class LogCodec {

    /** Header size: KIND(8) + ID(8) + AUX(8) */
    static final int HEADER_SIZE = 8 + 8 + 8;

    /** Largest value an append record may carry. */
    static final int MAX_VALUE_SIZE = DurableVector.MAX_VALUE_SIZE;

    private LogCodec() {
    }

    /**
     * Encodes a record into a buffer ready for writing (position 0, limit at the end).
     */
    static ByteBuffer encode(LogRecord record) {
        ByteBuffer buf;
        if (record instanceof Append append) {
            byte[] value = append.value();
            buf = header(HEADER_SIZE + value.length, LogRecord.KIND_APPEND, append.id(), value.length);
            buf.put(value);
        } else if (record instanceof Tombstone tombstone) {
            buf = header(HEADER_SIZE, LogRecord.KIND_TOMBSTONE, tombstone.id(), tombstone.index());
        } else {
            throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getName());
        }
        buf.flip();
        return buf;
    }

    private static ByteBuffer header(int capacity, long kind, long id, long aux) {
        ByteBuffer buf = ByteBuffer.allocate(capacity).order(ByteOrder.LITTLE_ENDIAN);
        buf.putLong(kind);
        buf.putLong(id);
        buf.putLong(aux);
        return buf;
    }

    /**
     * Reads the next record from the stream.
     * <p>
     * Never throws for malformed input: the outcome is reported through
     * {@link Decoded#status()}. Only genuine read failures propagate.
     *
     * @param in a stream positioned on a record boundary
     * @return the decoded record, or the reason decoding stopped
     * @throws IOException if the underlying stream fails
     */
    static Decoded decode(InputStream in) throws IOException {
        byte[] header = new byte[HEADER_SIZE];
        int headerRead = in.readNBytes(header, 0, HEADER_SIZE);
        if (headerRead == 0) {
            return Decoded.END;
        }
        if (headerRead < HEADER_SIZE) {
            return Decoded.torn(headerRead, "incomplete header: " + headerRead + " of " + HEADER_SIZE + " bytes");
        }

        ByteBuffer buf = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        long kind = buf.getLong();
        long id = buf.getLong();
        long aux = buf.getLong();

        if (kind == LogRecord.KIND_TOMBSTONE) {
            return Decoded.ofRecord(new Tombstone(id, aux), HEADER_SIZE);
        }
        if (kind != LogRecord.KIND_APPEND) {
            return Decoded.corrupt("unknown record kind " + Long.toUnsignedString(kind));
        }
        if (aux < 0 || aux > MAX_VALUE_SIZE) {
            return Decoded.corrupt("value length " + Long.toUnsignedString(aux) + " exceeds " + MAX_VALUE_SIZE);
        }

        byte[] value = new byte[(int) aux];
        int valueRead = in.readNBytes(value, 0, value.length);
        if (valueRead < value.length) {
            return Decoded.torn(HEADER_SIZE + valueRead,
                    "incomplete value: " + valueRead + " of " + value.length + " bytes");
        }
        return Decoded.ofRecord(new Append(id, value), HEADER_SIZE + value.length);
    }

    /**
     * Outcome of a single {@link #decode} call.
     *
     * @param status what was found at the current position
     * @param record the record, when {@code status == RECORD}
     * @param length bytes consumed from the stream
     * @param reason detail for torn and corrupt outcomes
     */
    record Decoded(Status status, LogRecord record, int length, String reason) {

        static final Decoded END = new Decoded(Status.END, null, 0, null);

        static Decoded ofRecord(LogRecord record, int length) {
            return new Decoded(Status.RECORD, record, length, null);
        }

        static Decoded torn(int length, String reason) {
            return new Decoded(Status.TORN_TAIL, null, length, reason);
        }

        static Decoded corrupt(String reason) {
            return new Decoded(Status.CORRUPT, null, 0, reason);
        }
    }

    enum Status {
        /** A complete record was decoded. */
        RECORD,
        /** Clean end of file on a record boundary. */
        END,
        /** A partial record at the end of the file. */
        TORN_TAIL,
        /** A complete header that cannot be a valid record. */
        CORRUPT
    }
}
