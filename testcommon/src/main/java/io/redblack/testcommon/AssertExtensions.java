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
package io.redblack.testcommon;

import java.util.function.Predicate;
import org.junit.Assert;

/**
 * Additional Assert Methods that are useful during testing.
 */
public final class AssertExtensions {
    private AssertExtensions() {
    }

    /**
     * Asserts that a function throws an expected exception.
     *
     * @param message  The message to include in the Assert calls.
     * @param runnable The function to test.
     * @param tester   A predicate that indicates whether the exception (if thrown) is as expected.
     */
    public static void assertThrows(String message, RunnableWithException runnable, Predicate<Throwable> tester) {
        try {
            runnable.run();
        } catch (Exception ex) {
            if (!tester.test(ex)) {
                Assert.fail(message + " Exception thrown was of unexpected type: " + ex);
            }

            return;
        }

        Assert.fail(message + " No exception has been thrown.");
    }

    /**
     * Asserts that a function throws an exception of the given type (or a subtype of it).
     *
     * @param type     The expected exception type.
     * @param runnable The function to test.
     * @param <T>      The expected exception type.
     */
    public static <T extends Throwable> void assertThrows(Class<T> type, RunnableWithException runnable) {
        assertThrows("Expected " + type.getSimpleName() + ".", runnable, type::isInstance);
    }

    /**
     * Asserts that smaller &lt;= larger.
     *
     * @param message The message to include in the Assert calls.
     * @param smaller The first value (smaller).
     * @param larger  The second value (larger).
     */
    public static void assertLessThanOrEqual(String message, long smaller, long larger) {
        Assert.assertTrue(String.format("%s Expected: less than or equal to %d. Actual: %d.", message, larger, smaller), smaller <= larger);
    }

    @FunctionalInterface
    public interface RunnableWithException {
        void run() throws Exception;
    }
}
