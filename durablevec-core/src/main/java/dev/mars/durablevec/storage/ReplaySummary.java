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
 * What a log replay recovered at open.
 *
 * @param items          live items after replay
 * @param appends        append records applied
 * @param tombstones     tombstone records applied
 * @param validBytes     length of the replayed prefix (the log is trimmed to this)
 * @param discardedBytes bytes of torn tail removed from the end of the log
 * @param elapsedMillis  replay duration
 */
public record ReplaySummary(
        int items,
        long appends,
        long tombstones,
        long validBytes,
        long discardedBytes,
        long elapsedMillis
) {
    /** Summary for a vector that had no log file. */
    public static final ReplaySummary EMPTY = new ReplaySummary(0, 0, 0, 0, 0, 0);

    /** True if a torn tail was found and trimmed. */
    public boolean tornTailDiscarded() {
        return discardedBytes > 0;
    }
}
