/**
 * Copyright Pravega Authors.
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
package io.redblack.common.util;

import java.util.function.Consumer;

/**
 * An ordered collection of entries, each identified by a long key. At most one entry per key may be present.
 * <p>
 * Entries are never null, so a null result from any lookup means that nothing matched. Implementations make no
 * thread-safety guarantees.
 *
 * @param <V> The type of the entries.
 */
public interface SortedIndex<V extends SortedIndex.IndexEntry> {
    /**
     * Removes every entry.
     */
    void clear();

    /**
     * Adds the given entry, replacing any entry with the same key.
     *
     * @param item The entry to add.
     * @return The replaced entry, or null if the key was not present.
     */
    V put(V item);

    /**
     * Removes the entry with the given key.
     *
     * @param key The key to remove.
     * @return The removed entry, or null if the key was not present.
     */
    V remove(long key);

    /**
     * @return The number of entries.
     */
    int size();

    /**
     * @return True if there are no entries.
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Looks up an entry by exact key.
     *
     * @param key The key to look up.
     * @return The entry, or null.
     */
    V get(long key);

    /**
     * Looks up the entry with the smallest key that is at least the given one.
     *
     * @param key The lower bound (inclusive).
     * @return The entry, or null if every key is smaller.
     */
    V getCeiling(long key);

    /**
     * Looks up the entry with the largest key that is at most the given one.
     *
     * @param key The upper bound (inclusive).
     * @return The entry, or null if every key is larger.
     */
    V getFloor(long key);

    /**
     * @return The entry with the smallest key, or null if empty.
     */
    V getFirst();

    /**
     * @return The entry with the largest key, or null if empty.
     */
    V getLast();

    /**
     * Invokes the given consumer on every entry, in ascending key order.
     *
     * @param consumer The consumer to invoke.
     * @throws java.util.ConcurrentModificationException If the consumer (or anything else) modifies this index before
     *                                                   the traversal completes.
     */
    void forEach(Consumer<V> consumer);

    /**
     * An entry that can be stored in a SortedIndex.
     */
    interface IndexEntry {
        /**
         * Gets the key of this entry. It must remain constant while the entry is indexed.
         *
         * @return The key.
         */
        long key();
    }
}
