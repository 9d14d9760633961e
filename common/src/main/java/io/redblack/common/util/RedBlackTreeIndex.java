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

import com.google.common.base.Preconditions;
import java.util.Comparator;
import java.util.function.Consumer;
import javax.annotation.concurrent.NotThreadSafe;
import lombok.val;

/**
 * SortedIndex backed by a {@link RedBlackTree}.
 * <p>
 * Note: This class is not thread-safe and requires external synchronization when in a multi-threaded environment.
 *
 * @param <V> The type of the IndexEntries.
 */
@NotThreadSafe
@SuppressWarnings("unchecked")
public class RedBlackTreeIndex<V extends SortedIndex.IndexEntry> implements SortedIndex<V> {
    //region Members

    private static final Comparator<SortedIndex.IndexEntry> KEY_COMPARATOR = Comparator.comparingLong(SortedIndex.IndexEntry::key);
    // Typed by IndexEntry (not V) so that bare keys can be used as search probes.
    private final RedBlackTree<SortedIndex.IndexEntry> tree;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the RedBlackTreeIndex class.
     */
    public RedBlackTreeIndex() {
        this(RedBlackTreeConfig.DEFAULT);
    }

    /**
     * Creates a new instance of the RedBlackTreeIndex class.
     *
     * @param config The configuration for the underlying RedBlackTree.
     */
    public RedBlackTreeIndex(RedBlackTreeConfig config) {
        this.tree = new RedBlackTree<>(KEY_COMPARATOR, config);
    }

    //endregion

    //region SortedIndex implementation

    @Override
    public void clear() {
        this.tree.clear();
    }

    @Override
    public V put(V item) {
        Preconditions.checkNotNull(item, "item");
        V displaced = remove(item.key());
        this.tree.insert(item);
        return displaced;
    }

    @Override
    public V remove(long key) {
        val cursor = this.tree.findCeiling(searchKey(key));
        if (cursor.isEnd() || cursor.item().key() != key) {
            return null;
        }

        V removed = (V) cursor.item();
        this.tree.delete(cursor);
        return removed;
    }

    @Override
    public int size() {
        return this.tree.size();
    }

    @Override
    public V get(long key) {
        return (V) this.tree.get(searchKey(key));
    }

    @Override
    public V getCeiling(long key) {
        return getItem(this.tree.findCeiling(searchKey(key)));
    }

    @Override
    public V getFloor(long key) {
        return getItem(this.tree.findFloor(searchKey(key)));
    }

    @Override
    public V getFirst() {
        return (V) this.tree.first();
    }

    @Override
    public V getLast() {
        return (V) this.tree.last();
    }

    @Override
    public void forEach(Consumer<V> consumer) {
        Preconditions.checkNotNull(consumer, "consumer");
        for (SortedIndex.IndexEntry e : this.tree) {
            consumer.accept((V) e);
        }
    }

    private V getItem(TreeCursor<SortedIndex.IndexEntry> cursor) {
        return cursor.isEnd() ? null : (V) cursor.item();
    }

    private static SortedIndex.IndexEntry searchKey(long key) {
        return () -> key;
    }

    //endregion
}
