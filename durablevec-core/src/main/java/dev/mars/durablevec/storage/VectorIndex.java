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

import java.util.ArrayList;
import java.util.List;

/**
 * The in-memory sequence of live items, in log order.
 * <p>
 * Not thread-safe; guarded by the owning vector's lock.
 */
final class VectorIndex {

    private final List<Item> items = new ArrayList<>();

    void append(Item item) {
        items.add(item);
    }

    Item get(int index) {
        return items.get(index);
    }

    /** Removes the item at {@code index}; later items shift down by one. */
    Item remove(int index) {
        return items.remove(index);
    }

    int size() {
        return items.size();
    }

    /** Immutable copy of the items; values are copied too. */
    List<Item> snapshot() {
        List<Item> copy = new ArrayList<>(items.size());
        for (Item item : items) {
            copy.add(new Item(item.id(), item.value().clone()));
        }
        return List.copyOf(copy);
    }
}
