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

import com.google.common.base.Predicate;
import com.google.common.collect.Iterables;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.relsec.api.constraint.Constraint;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The outcome of resolving one permission for one user against one content
 * type: a reusable predicate over content items.
 * <p>
 * A decision only holds the user key and the immutable group configuration,
 * so it can be cached and evaluated concurrently. The underlying
 * {@link #getConstraint() constraint} can be handed to a query translator
 * instead of filtering items in memory.
 *
 * @param <T> the content type
 */
public final class Decision<T> implements Predicate<T> {

    private final Class<T> contentType;
    private final String permission;
    private final PermissionValue globalValue;
    private final Constraint<T> constraint;

    public Decision(@NotNull Class<T> contentType, @NotNull String permission,
                    @NotNull PermissionValue globalValue, @NotNull Constraint<T> constraint) {
        this.contentType = checkNotNull(contentType);
        this.permission = checkNotNull(permission);
        this.globalValue = checkNotNull(globalValue);
        this.constraint = checkNotNull(constraint);
    }

    @NotNull
    public Class<T> getContentType() {
        return contentType;
    }

    @NotNull
    public String getPermission() {
        return permission;
    }

    /**
     * @return the combined value of the user's global permission entries for
     * the permission of this decision
     */
    @NotNull
    public PermissionValue getGlobalValue() {
        return globalValue;
    }

    @NotNull
    public Constraint<T> getConstraint() {
        return constraint;
    }

    @Override
    public boolean apply(@Nullable T content) {
        return constraint.evaluate(checkNotNull(content, "Content must not be null"));
    }

    /**
     * Returns a lazy view of the items this decision accepts. Items are
     * evaluated while iterating, not when this method is called.
     */
    @NotNull
    public Iterable<T> filter(@NotNull Iterable<T> content) {
        return Iterables.filter(content, this);
    }

    @Override
    public String toString() {
        return permission + " on " + contentType.getSimpleName() + ": " + constraint;
    }
}
