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

import lombok.Data;

/**
 * Key-Value pair used as a tree item in tests. Trees order these by key only.
 */
@Data
class KeyedItem {
    private final int key;
    private final String value;

    @Override
    public String toString() {
        return String.format("{%d %s}", this.key, this.value);
    }
}
