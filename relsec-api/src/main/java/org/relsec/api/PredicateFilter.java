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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Filters content using application-defined security predicates that match
 * users to relational permission groups ("post-submitter", "post-editor"),
 * optionally combined with the users' global permissions.
 * <p>
 * Within one permission a {@link PermissionValue#DENY} always overrides an
 * {@link PermissionValue#ALLOW}, and content nobody allowed is denied.
 * <p>
 * Implementations are immutable once built and safe for concurrent use.
 *
 * @param <U> the user type
 */
public interface PredicateFilter<U> {

    /**
     * Build the decision for a permission, user and content type. The
     * decision can be reused for any number of items of that type.
     *
     * @param contentType the type of the content to decide on
     * @param permission  the name of the permission to check
     * @param user        the user, possibly {@code null} for anonymous access
     * @return the decision
     */
    @NotNull
    <T> Decision<T> getDecision(@NotNull Class<T> contentType, @NotNull String permission, @Nullable U user);

    /**
     * Filter content down to the items the user holds a permission for.
     *
     * @return a lazy view of the permitted items
     */
    @NotNull
    <T> Iterable<T> filter(@NotNull Iterable<T> content, @NotNull Class<T> contentType,
                           @NotNull String permission, @Nullable U user);

    /**
     * Check a permission for a single content item, using the runtime type
     * of the item to select the relevant groups.
     */
    boolean test(@NotNull Object content, @NotNull String permission, @Nullable U user);

    /**
     * Check whether the user's global permissions alone allow a permission,
     * without reference to any content.
     */
    boolean testGlobal(@NotNull String permission, @Nullable U user);

    /**
     * Check whether the user matches a group for a content item, regardless
     * of the permissions assigned to that group.
     *
     * @throws UnknownGroupException        if no group has that name
     * @throws TypeMismatchException        if the group is not defined for the
     *                                      type of the content
     * @throws AmbiguousGroupNameException  if several groups of that name
     *                                      apply to the content
     */
    boolean isMember(@NotNull Object content, @NotNull String groupName, @Nullable U user);
}
