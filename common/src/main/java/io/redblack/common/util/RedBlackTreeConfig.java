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

import lombok.Getter;
import lombok.ToString;

/**
 * Configuration for the RedBlackTree class.
 */
@ToString
public class RedBlackTreeConfig {
    //region Config Names

    public static final Property<Boolean> VALIDATION_ENABLED = Property.named("validation.enable", false, "validateInvariants");
    public static final Property<Integer> VALIDATION_INTERVAL = Property.named("validation.interval", 1);
    public static final String COMPONENT_CODE = "redblacktree";

    /**
     * Default configuration: no invariant validation.
     */
    public static final RedBlackTreeConfig DEFAULT = builder().build();

    //endregion

    //region Members

    /**
     * Whether the tree verifies all of its structural invariants after mutations. Each verification is O(n), so this
     * should only be turned on for debugging or testing.
     */
    @Getter
    private final boolean validationEnabled;

    /**
     * The number of mutations (successful inserts and deletes) between two consecutive invariant verifications.
     */
    @Getter
    private final int validationInterval;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the RedBlackTreeConfig class.
     *
     * @param properties The TypedProperties object to read Properties from.
     */
    private RedBlackTreeConfig(TypedProperties properties) throws ConfigurationException {
        this.validationEnabled = properties.getBoolean(VALIDATION_ENABLED);
        this.validationInterval = properties.getPositiveInt(VALIDATION_INTERVAL);
    }

    /**
     * Creates a new ConfigBuilder that can be used to create instances of this class.
     *
     * @return A new Builder for this class.
     */
    public static ConfigBuilder<RedBlackTreeConfig> builder() {
        return new ConfigBuilder<>(COMPONENT_CODE, RedBlackTreeConfig::new);
    }

    //endregion
}
