/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.relsec.core.config;

import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable set of configuration parameters of a predicate filter.
 * <p>
 * Values may be given as strings (for instance when read from a properties
 * file) and are converted to the type of the requested default value.
 */
public final class FilterConfiguration {

    /**
     * Whether one group name may be bound to several content types.
     */
    public static final String PARAM_ALLOW_REUSING_GROUP_NAMES = "allowReusingGroupNames";

    public static final boolean DEFAULT_ALLOW_REUSING_GROUP_NAMES = false;

    public static final FilterConfiguration EMPTY = new FilterConfiguration(Collections.<String, Object>emptyMap());

    private final Map<String, Object> options;

    private FilterConfiguration(@NotNull Map<String, ?> options) {
        this.options = ImmutableMap.copyOf(options);
    }

    @NotNull
    public static FilterConfiguration of(@NotNull Map<String, ?> options) {
        if (options.isEmpty()) {
            return EMPTY;
        }
        return new FilterConfiguration(options);
    }

    @NotNull
    public static FilterConfiguration of(@NotNull Properties properties) {
        ImmutableMap.Builder<String, Object> options = ImmutableMap.builder();
        for (String name : properties.stringPropertyNames()) {
            options.put(name, properties.getProperty(name));
        }
        return of(options.build());
    }

    public boolean contains(@NotNull String key) {
        return options.containsKey(key);
    }

    @NotNull
    public Set<String> keySet() {
        return options.keySet();
    }

    public boolean isAllowReusingGroupNames() {
        return getConfigValue(PARAM_ALLOW_REUSING_GROUP_NAMES, DEFAULT_ALLOW_REUSING_GROUP_NAMES);
    }

    /**
     * Returns the value of the given key converted to the type of the
     * default value, or the default value if the key is not configured.
     *
     * @throws IllegalArgumentException if the configured value cannot be
     *                                  converted
     */
    @NotNull
    public <T> T getConfigValue(@NotNull String key, @NotNull T defaultValue) {
        checkNotNull(defaultValue, "Default value must not be null");
        @SuppressWarnings("unchecked")
        Class<T> targetClass = (Class<T>) defaultValue.getClass();
        T value = getConfigValue(key, defaultValue, targetClass);
        return value == null ? defaultValue : value;
    }

    /**
     * Returns the value of the given key converted to the target class, or
     * the default value if the key is not configured. Without a target class
     * the value is returned as configured.
     *
     * @throws IllegalArgumentException if the configured value cannot be
     *                                  converted
     */
    @Nullable
    public <T> T getConfigValue(@NotNull String key, @Nullable T defaultValue, @Nullable Class<T> targetClass) {
        Object configured = options.get(key);
        if (configured == null) {
            return defaultValue;
        }
        if (targetClass == null) {
            @SuppressWarnings("unchecked")
            T value = (T) configured;
            return value;
        }
        return convert(key, configured, targetClass);
    }

    @Override
    public String toString() {
        return "FilterConfiguration" + options;
    }

    //------------------------------------------------------------< private >---

    private static <T> T convert(String key, Object configured, Class<T> targetClass) {
        if (targetClass.isInstance(configured)) {
            return targetClass.cast(configured);
        }
        String str = configured.toString().trim();
        Object converted;
        try {
            if (targetClass == String.class) {
                converted = str;
            } else if (targetClass == Boolean.class) {
                converted = parseBoolean(key, str);
            } else if (targetClass == Integer.class) {
                converted = Integer.valueOf(str);
            } else if (targetClass == Long.class) {
                converted = Long.valueOf(str);
            } else {
                throw new IllegalArgumentException(String.format(
                        "Unsupported type %s for config entry '%s'", targetClass.getName(), key));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(
                    "Cannot convert config entry '%s' = '%s' to %s", key, str, targetClass.getName()), e);
        }
        return targetClass.cast(converted);
    }

    private static Boolean parseBoolean(String key, String str) {
        if ("true".equalsIgnoreCase(str)) {
            return Boolean.TRUE;
        } else if ("false".equalsIgnoreCase(str)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException(String.format(
                "Cannot convert config entry '%s' = '%s' to a boolean", key, str));
    }
}
