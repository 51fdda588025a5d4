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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link IdAllocator}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Minting from 1 and FIFO reuse of reclaimed ids</li>
 *   <li>Peeking without consuming</li>
 *   <li>Replay bookkeeping through {@code observe}, including unsigned ids</li>
 * </ul>
 */
class IdAllocatorTest {

    @Test
    @DisplayName("Fresh allocator mints 1, 2, 3")
    void testMintsFromOne() {
        IdAllocator ids = new IdAllocator(true);

        assertEquals(1, ids.allocate());
        assertEquals(2, ids.allocate());
        assertEquals(3, ids.allocate());
        assertEquals(3, ids.lastAssigned());
    }

    @Test
    @DisplayName("Reclaimed ids come back oldest first, then minting resumes above the high-water mark")
    void testFifoRecycling() {
        IdAllocator ids = new IdAllocator(true);
        for (int i = 0; i < 5; i++) {
            ids.allocate();
        }

        ids.reclaim(4);
        ids.reclaim(2);

        assertEquals(4, ids.peekNext());
        assertEquals(4, ids.allocate());
        assertEquals(2, ids.allocate());
        assertEquals(6, ids.allocate());
    }

    @Test
    @DisplayName("peekNext does not consume")
    void testPeekDoesNotConsume() {
        IdAllocator ids = new IdAllocator(true);

        assertEquals(1, ids.peekNext());
        assertEquals(1, ids.peekNext());
        assertEquals(1, ids.allocate());
        assertEquals(2, ids.peekNext());
    }

    @Test
    @DisplayName("Disabled recycling ignores reclaim")
    void testRecyclingDisabled() {
        IdAllocator ids = new IdAllocator(false);
        ids.allocate();
        ids.allocate();

        ids.reclaim(1);

        assertEquals(0, ids.freeCount());
        assertEquals(3, ids.allocate());
    }

    @Test
    @DisplayName("observe raises the high-water mark")
    void testObserveRaisesHighWaterMark() {
        IdAllocator ids = new IdAllocator(true);

        ids.observe(10);
        ids.observe(3);

        assertEquals(10, ids.lastAssigned());
        assertEquals(11, ids.allocate());
    }

    @Test
    @DisplayName("observe compares ids as unsigned 64-bit values")
    void testObserveUnsigned() {
        IdAllocator ids = new IdAllocator(true);
        long high = 0x8000_0000_0000_0005L;

        ids.observe(7);
        ids.observe(high);
        ids.observe(9);

        assertEquals(high, ids.lastAssigned());
        assertEquals(high + 1, ids.allocate());
    }

    @Test
    @DisplayName("observe of a recycled id removes it from the free list")
    void testObserveRemovesRecycledId() {
        IdAllocator ids = new IdAllocator(true);
        ids.observe(1);
        ids.observe(2);
        ids.observe(3);
        ids.reclaim(1);
        ids.reclaim(3);

        // replay sees id 1 appended again
        ids.observe(1);

        assertEquals(1, ids.freeCount());
        assertEquals(3, ids.allocate());
        assertEquals(4, ids.allocate());
    }

    @Test
    @DisplayName("observe of a recycled id that is not at the head still removes it")
    void testObserveRemovesNonHeadId() {
        IdAllocator ids = new IdAllocator(true);
        ids.observe(5);
        ids.reclaim(2);
        ids.reclaim(4);

        ids.observe(4);

        assertEquals(1, ids.freeCount());
        assertEquals(2, ids.allocate());
        assertEquals(6, ids.allocate());
    }
}
