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

import io.redblack.testcommon.AssertExtensions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.LinkedList;
import java.util.Random;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;

/**
 * Base class for testing any SortedIndex implementation.
 */
public abstract class SortedIndexTestBase {
    private static final int ITEM_COUNT = 20 * 1000;
    private static final Comparator<Long> KEY_COMPARATOR = Long::compare;
    private static final Comparator<Long> KEY_REVERSE_COMPARATOR = (n1, n2) -> Long.compare(n2, n1);

    //region Test Definitions

    /**
     * Tests the put(), size(), get(), getFirst() and getLast() methods.
     */
    @Test
    public void testPut() {
        final int reinsertFrequency = 100;
        val index = createIndex();
        Random rnd = new Random(0);
        TestEntry firstEntry = null;
        TestEntry lastEntry = null;
        val reinsertKeys = new ArrayList<Integer>();
        for (int i = 0; i < ITEM_COUNT; i++) {
            int key;
            do {
                key = rnd.nextInt();
            } while (index.get(key) != null);

            if (i % reinsertFrequency == 0) {
                reinsertKeys.add(key);
            }

            val entry = new TestEntry(key);
            if (firstEntry == null || entry.key() <= firstEntry.key()) {
                firstEntry = entry;
            }

            if (lastEntry == null || entry.key() >= lastEntry.key()) {
                lastEntry = entry;
            }

            Assert.assertNull("put() displaced an entry for a new key.", index.put(entry));
            Assert.assertEquals("Unexpected size.", i + 1, index.size());
            Assert.assertEquals("Unexpected value from getFirst() after " + index.size() + " insertions.", firstEntry, index.getFirst());
            Assert.assertEquals("Unexpected value from getLast() after " + index.size() + " insertions.", lastEntry, index.getLast());
        }

        // Reinserting an existing key replaces the entry and returns the old one.
        for (int key : reinsertKeys) {
            val oldEntry = index.get(key);
            val entry = new TestEntry(key);
            val overriddenEntry = index.put(entry);
            Assert.assertSame("Unexpected overridden entry for key " + key, oldEntry, overriddenEntry);
            Assert.assertSame("New entry was not placed in the index for key " + key, entry, index.get(key));
            Assert.assertEquals("Unexpected size when overriding entry.", ITEM_COUNT, index.size());
        }
    }

    /**
     * Tests the remove(), size(), get(), getFirst(), getLast() methods.
     */
    @Test
    public void testRemove() {
        val index = createIndex();
        val keys = populate(index);

        keys.sort(KEY_COMPARATOR);
        val keysToRemove = new LinkedList<Long>(keys);
        int expectedSize = index.size();
        Assert.assertNull("remove() returned an entry for a missing key.", index.remove(-1));
        while (keysToRemove.size() > 0) {
            // Alternate between the smallest and the largest key, to exercise getFirst() and getLast().
            long key = expectedSize % 2 == 0 ? keysToRemove.removeLast() : keysToRemove.removeFirst();
            val entry = index.get(key);
            val removedEntry = index.remove(key);
            expectedSize--;

            Assert.assertSame("Unexpected removed entry for key " + key, entry, removedEntry);
            Assert.assertEquals("Unexpected size after removing key " + key, expectedSize, index.size());
            Assert.assertNull("Entry was not removed for key " + key, index.get(key));
            Assert.assertNull("Second remove() returned an entry for key " + key, index.remove(key));

            if (expectedSize == 0) {
                Assert.assertNull("Unexpected value from getFirst() when index is empty.", index.getFirst());
                Assert.assertNull("Unexpected value from getLast() when index is empty.", index.getLast());
            } else {
                Assert.assertEquals("Unexpected value from getFirst() after removing key " + key, (long) keysToRemove.getFirst(), index.getFirst().key());
                Assert.assertEquals("Unexpected value from getLast() after removing key " + key, (long) keysToRemove.getLast(), index.getLast().key());
            }
        }
    }

    /**
     * Tests the clear() method.
     */
    @Test
    public void testClear() {
        val index = createIndex();
        val keys = populate(index);

        Assert.assertNotNull("Unexpected return value for getFirst() on non-empty index.", index.getFirst());
        Assert.assertNotNull("Unexpected return value for getLast() on non-empty index.", index.getLast());

        Assert.assertFalse("Unexpected value for isEmpty() on non-empty index.", index.isEmpty());
        index.clear();
        Assert.assertEquals("Unexpected size of empty index.", 0, index.size());
        Assert.assertTrue("Unexpected value for isEmpty() on empty index.", index.isEmpty());
        Assert.assertNull("Unexpected return value for getFirst() on empty index.", index.getFirst());
        Assert.assertNull("Unexpected return value for getLast() on empty index.", index.getLast());

        for (long key : keys) {
            Assert.assertNull("Unexpected value for get() on empty index.", index.get(key));
            Assert.assertNull("Unexpected value for getCeiling() on empty index.", index.getCeiling(key));
            Assert.assertNull("Unexpected value for getFloor() on empty index.", index.getFloor(key));
        }
    }

    /**
     * Tests the getCeiling() method.
     */
    @Test
    public void testGetCeiling() {
        final int itemCount = 1000;
        final int maxKey = itemCount * 10;

        val index = createIndex();
        val validKeys = populate(index, itemCount, maxKey);
        validKeys.sort(KEY_COMPARATOR);

        val validKeysIterator = validKeys.iterator();
        Long expectedValue = -1L;
        for (long testKey = 0; testKey < maxKey; testKey++) {
            // Both testKey and validKeysIterator increase, so the expected value only ever moves forward.
            while (expectedValue != null && testKey > expectedValue) {
                expectedValue = validKeysIterator.hasNext() ? validKeysIterator.next() : null;
            }

            val ceilingEntry = index.getCeiling(testKey);
            Long actualValue = ceilingEntry != null ? ceilingEntry.key() : null;
            Assert.assertEquals("Unexpected value for getCeiling for key " + testKey, expectedValue, actualValue);
        }
    }

    /**
     * Tests the getFloor() method.
     */
    @Test
    public void testGetFloor() {
        final int itemCount = 1000;
        final int maxKey = itemCount * 10;

        val index = createIndex();
        val validKeys = populate(index, itemCount, maxKey);
        validKeys.sort(KEY_REVERSE_COMPARATOR);

        val validKeysIterator = validKeys.iterator();
        Long expectedValue = (long) Integer.MAX_VALUE;
        for (long testKey = maxKey; testKey >= 0; testKey--) {
            while (expectedValue != null && testKey < expectedValue) {
                expectedValue = validKeysIterator.hasNext() ? validKeysIterator.next() : null;
            }

            val floorEntry = index.getFloor(testKey);
            Long actualValue = floorEntry != null ? floorEntry.key() : null;
            Assert.assertEquals("Unexpected value for getFloor for key " + testKey, expectedValue, actualValue);
        }
    }

    /**
     * Tests the forEach() method.
     */
    @Test
    public void testForEach() {
        val index = createIndex();
        val validKeys = populate(index);

        // Extract the keys using forEach - they should be ordered naturally.
        val actualKeys = new ArrayList<Long>();
        index.forEach(e -> actualKeys.add(e.key()));
        validKeys.sort(KEY_COMPARATOR);
        Assert.assertEquals("Unexpected keys from forEach().", validKeys, actualKeys);

        // Modifying the index while looping through it must throw.
        AssertExtensions.assertThrows(
                "forEach did not throw when a new item was added during enumeration.",
                () -> index.forEach(e -> index.put(new TestEntry(-1 - index.size()))),
                ex -> ex instanceof ConcurrentModificationException);

        AssertExtensions.assertThrows(
                "forEach did not throw when an item was removed during enumeration.",
                () -> index.forEach(e -> index.remove(e.key())),
                ex -> ex instanceof ConcurrentModificationException);

        AssertExtensions.assertThrows(
                "forEach did not throw when the index was cleared during enumeration.",
                () -> index.forEach(e -> index.clear()),
                ex -> ex instanceof ConcurrentModificationException);
    }

    /**
     * Tests various operations on already sorted input.
     */
    @Test
    public void testSortedInput() {
        val index = createIndex();
        for (int key = 0; key < ITEM_COUNT; key++) {
            index.put(new TestEntry(key));
        }

        for (int key = 0; key < ITEM_COUNT; key++) {
            Assert.assertEquals("Unexpected value from get() for key " + key, key, index.get(key).key());
            Assert.assertEquals("Unexpected value from getCeiling() for key " + key, key, index.getCeiling(key).key());
        }

        for (long key = 0; key < ITEM_COUNT; key++) {
            long removedKey = index.remove(key).key();
            Assert.assertEquals("Unexpected value from remove(). ", key, removedKey);
            Assert.assertNull("Unexpected value from get() for removed key " + key, index.get(key));
            if (key == ITEM_COUNT - 1) {
                Assert.assertNull("Unexpected value from getCeiling() for removed key " + key, index.getCeiling(key));
            } else {
                Assert.assertEquals("Unexpected value from getCeiling() for removed key " + key, key + 1, index.getCeiling(key).key());
            }
        }
    }

    //endregion

    //region Helpers

    protected abstract SortedIndex<TestEntry> createIndex();

    private ArrayList<Long> populate(SortedIndex<TestEntry> index) {
        return populate(index, ITEM_COUNT, Integer.MAX_VALUE);
    }

    private ArrayList<Long> populate(SortedIndex<TestEntry> index, int itemCount, int maxKey) {
        Random rnd = new Random(0);
        val keys = new ArrayList<Long>();
        for (int i = 0; i < itemCount; i++) {
            long key;
            do {
                key = rnd.nextInt(maxKey);
            } while (index.get(key) != null);

            keys.add(key);
            index.put(new TestEntry(key));
        }

        return keys;
    }

    //endregion

    //region TestEntry

    protected static class TestEntry implements SortedIndex.IndexEntry {
        // Note: do not implement equals() or hash() for this class - the tests rely on object equality, not key equality.
        private final long key;

        TestEntry(long key) {
            this.key = key;
        }

        @Override
        public long key() {
            return this.key;
        }

        @Override
        public String toString() {
            return "Key = " + this.key;
        }
    }

    //endregion
}
