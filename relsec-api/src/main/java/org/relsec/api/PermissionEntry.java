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
package org.relsec.api;

import java.util.Locale;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A non-relational permission held by a user, independent of any content
 * item (for example "site administrators may edit everything").
 * <p>
 * Permission names are compared case-insensitively.
 */
public final class PermissionEntry {

    private final String name;
    private final PermissionValue value;

    private PermissionEntry(String name, PermissionValue value) {
        checkArgument(!name.isEmpty(), "Permission name must not be empty");
        this.name = name;
        this.value = checkNotNull(value, "Permission value must not be null");
    }

    @NotNull
    public static PermissionEntry of(@NotNull String name, @NotNull PermissionValue value) {
        return new PermissionEntry(checkNotNull(name, "Permission name must not be null"), value);
    }

    @NotNull
    public static PermissionEntry allow(@NotNull String name) {
        return of(name, PermissionValue.ALLOW);
    }

    @NotNull
    public static PermissionEntry deny(@NotNull String name) {
        return of(name, PermissionValue.DENY);
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public PermissionValue getValue() {
        return value;
    }

    public boolean appliesTo(@NotNull String permission) {
        return name.equalsIgnoreCase(permission);
    }

    @Override
    public int hashCode() {
        return 31 * name.toLowerCase(Locale.ENGLISH).hashCode() + value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PermissionEntry)) {
            return false;
        }
        PermissionEntry other = (PermissionEntry) obj;
        return name.equalsIgnoreCase(other.name) && value == other.value;
    }

    @Override
    public String toString() {
        return name + '=' + value;
    }
}
