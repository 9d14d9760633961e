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

/**
 * Collects Property values for one configuration namespace and turns them into a configuration object.
 *
 * @param <T> Type of the configuration.
 */
public class ConfigBuilder<T> {
    private final Properties properties;
    private final String namespace;
    private final ConfigConstructor<T> constructor;

    /**
     * Creates a new instance of the ConfigBuilder class.
     *
     * @param namespace   The configuration namespace to use.
     * @param constructor Creates a configuration object from the collected values.
     */
    public ConfigBuilder(String namespace, ConfigConstructor<T> constructor) {
        this.namespace = Exceptions.checkNotNullOrEmpty(namespace, "namespace");
        this.constructor = Preconditions.checkNotNull(constructor, "constructor");
        this.properties = new Properties();
    }

    /**
     * Sets a value for the given Property, replacing any previous one.
     *
     * @param property The property to set.
     * @param value    The value of the property. A null value is stored as an empty string.
     * @param <V>      Type of the property.
     * @return This instance.
     */
    public <V> ConfigBuilder<T> with(Property<V> property, V value) {
        Preconditions.checkNotNull(property, "property");
        this.properties.setProperty(property.fullName(this.namespace), value == null ? "" : value.toString());
        return this;
    }

    /**
     * Imports every entry of the given Properties that belongs to this builder's namespace, such as the contents of a
     * loaded configuration file or the system properties. Entries of other namespaces are ignored. Imported values
     * replace values set earlier, and may in turn be replaced by later calls to {@link #with}.
     *
     * @param source The Properties to import from. It is not modified.
     * @return This instance.
     */
    public ConfigBuilder<T> withAll(Properties source) {
        Preconditions.checkNotNull(source, "source");
        for (String key : source.stringPropertyNames()) {
            if (Property.isInNamespace(key, this.namespace)) {
                this.properties.setProperty(key, source.getProperty(key));
            }
        }

        return this;
    }

    /**
     * Creates a new instance of the configuration class using the values collected so far. The builder may still be
     * used afterwards; later changes do not affect the returned instance.
     *
     * @return The newly created instance.
     * @throws ConfigurationException When a required Property is missing or a Property has an invalid value.
     */
    public T build() throws ConfigurationException {
        Properties snapshot = new Properties();
        snapshot.putAll(this.properties);
        return this.constructor.apply(new TypedProperties(snapshot, this.namespace));
    }

    @FunctionalInterface
    public interface ConfigConstructor<R> {
        R apply(TypedProperties properties) throws ConfigurationException;
    }
}
