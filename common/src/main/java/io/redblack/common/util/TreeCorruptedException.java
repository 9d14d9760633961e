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

/**
 * Exception that is thrown when a RedBlackTree detects that one of its structural invariants no longer holds. This
 * indicates a bug in the tree (or a Comparator that does not define a total order), not a recoverable condition.
 */
public class TreeCorruptedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance of the TreeCorruptedException class.
     *
     * @param message The message.
     */
    public TreeCorruptedException(String message) {
        super(message);
    }
}
