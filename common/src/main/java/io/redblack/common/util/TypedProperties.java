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
import io.redblack.common.Exceptions;
import java.util.Properties;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Wrapper for a java.util.Properties object, that sections it based on a namespace. Each property in the wrapped object
 * is prefixed by a namespace.
 * <p>
 * Example:
 * <ul>
 * <li>redblacktree.validation.enable=true
 * <li>redblacktree.validation.interval=100
 * <li>other.validation.enable=false
 * </ul>
 * Namespace "redblacktree" sees (validation.enable=true, validation.interval=100); namespace "other" sees
 * (validation.enable=false).
 */
@Slf4j
public class TypedProperties {
    //region Members

    private final String namespace;
    private final Properties properties;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the TypedProperties class.
     *
     * @param properties The java.util.Properties to wrap.
     * @param namespace  The namespace of this instance.
     */
    public TypedProperties(Properties properties, String namespace) {
        this.properties = Preconditions.checkNotNull(properties, "properties");
        this.namespace = Exceptions.checkNotNullOrEmpty(namespace, "namespace");
    }

    //endregion

    //region Getters

    /**
     * Gets the value of a String property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current namespace and the
     *                                property does not have a default value set.
     */
    public String get(Property<String> property) throws ConfigurationException {
        return tryGet(property, s -> s);
    }

    /**
     * Gets the value of an Integer property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current namespace and the
     *                                property does not have a default value set, or when the property cannot be parsed
     *                                as an Integer.
     */
    public int getInt(Property<Integer> property) throws ConfigurationException {
        return tryGet(property, Integer::parseInt);
    }

    /**
     * Gets the value of an Integer property only if it is greater than 0.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the property is missing and has no default value, or when its value is not a
     *                                positive Integer.
     */
    public int getPositiveInt(Property<Integer> property) throws ConfigurationException {
        int value = getInt(property);
        if (value <= 0) {
            throw new InvalidPropertyValueException(property.fullName(this.namespace), Integer.toString(value));
        }

        return value;
    }

    /**
     * Gets the value of a boolean property.
     * Notes:
     * <ul>
     * <li> "true", "yes" and "1" (case insensitive) map to boolean "true".
     * <li> "false", "no" and "0" (case insensitive) map to boolean "false".
     * </ul>
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current namespace and the
     *                                property does not have a default value set, or when the property cannot be parsed
     *                                as a Boolean.
     */
    public boolean getBoolean(Property<Boolean> property) throws ConfigurationException {
        return tryGet(property, this::parseBoolean);
    }

    private <T> T tryGet(Property<T> property, Function<String, T> converter) {
        String propNewName = property.fullName(this.namespace);
        String propOldName = property.fullLegacyName(this.namespace);
        String propValue = null;
        if (propOldName != null) {
            propValue = this.properties.getProperty(propOldName, null);
            if (propValue != null) {
                log.warn("Deprecated property name '{}' used. Please use '{}' instead.", propOldName, propNewName);
            }
        }

        if (propValue == null) {
            propValue = this.properties.getProperty(propNewName, null);
        }

        if (propValue == null) {
            if (property.hasDefaultValue()) {
                return property.getDefaultValue();
            } else {
                throw new MissingPropertyException(propNewName);
            }
        }

        try {
            return converter.apply(propValue.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidPropertyValueException(propNewName, propValue, ex);
        }
    }

    private boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equalsIgnoreCase("1")) {
            return true;
        } else if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no") || value.equalsIgnoreCase("0")) {
            return false;
        } else {
            throw new IllegalArgumentException(String.format("String '%s' cannot be interpreted as a valid Boolean.", value));
        }
    }

    //endregion
}
