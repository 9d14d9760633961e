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

import io.redblack.common.Exceptions;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A named, typed configuration setting, optionally carrying a default value and a legacy (deprecated) name. Names are
 * relative to the namespace of the configuration class that declares the Property.
 *
 * @param <T> The type of the property values.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Property<T> {
    private static final String SEPARATOR = ".";
    private final String name;
    private final T defaultValue;
    private final String legacyName;

    /**
     * Creates a required Property: reading it fails if no value has been set.
     *
     * @param name The name of the property.
     * @param <T>  The type of the property values.
     * @return A new Property.
     */
    public static <T> Property<T> named(String name) {
        return named(name, null, null);
    }

    /**
     * Creates a Property that falls back to the given value when it is not set.
     *
     * @param name         The name of the property.
     * @param defaultValue The default value.
     * @param <T>          The type of the property values.
     * @return A new Property.
     */
    public static <T> Property<T> named(String name, T defaultValue) {
        return named(name, defaultValue, null);
    }

    /**
     * Creates a Property that is also looked up under a legacy name. A value set under the legacy name takes precedence.
     *
     * @param name         The name of the property.
     * @param defaultValue The default value, or null if the property is required.
     * @param legacyName   The old name of the property, or null.
     * @param <T>          The type of the property values.
     * @return A new Property.
     */
    public static <T> Property<T> named(String name, T defaultValue, String legacyName) {
        Exceptions.checkNotNullOrEmpty(name, "name");
        return new Property<>(name, defaultValue, legacyName);
    }

    /**
     * Gets the key of this Property within the given namespace.
     *
     * @param namespace The namespace.
     * @return The namespaced key.
     */
    String fullName(String namespace) {
        return namespace + SEPARATOR + this.name;
    }

    /**
     * Gets the legacy key of this Property within the given namespace.
     *
     * @param namespace The namespace.
     * @return The namespaced legacy key, or null if this Property was never renamed.
     */
    String fullLegacyName(String namespace) {
        return this.legacyName == null ? null : namespace + SEPARATOR + this.legacyName;
    }

    /**
     * Gets a value indicating whether the given key belongs to the given namespace.
     */
    static boolean isInNamespace(String key, String namespace) {
        return key.startsWith(namespace + SEPARATOR);
    }

    boolean hasDefaultValue() {
        return this.defaultValue != null;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
