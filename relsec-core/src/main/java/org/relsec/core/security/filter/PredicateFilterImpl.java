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
package org.relsec.core.security.filter;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.relsec.api.Decision;
import org.relsec.api.GlobalPermissionProvider;
import org.relsec.api.PredicateFilter;
import org.relsec.api.UserKeyProvider;
import org.relsec.core.security.group.Group;
import org.relsec.core.security.group.GroupRegistry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Default {@link PredicateFilter} implementation, created by a
 * {@link PredicateFilterBuilder}.
 *
 * @param <U> the user type
 * @param <K> the user key type passed to the group matchers
 */
public class PredicateFilterImpl<U, K> implements PredicateFilter<U> {

    private final GroupRegistry<K> groups;
    private final UserKeyProvider<U, K> userKeyProvider;
    private final PermissionResolver<U, K> resolver;

    PredicateFilterImpl(@NotNull GroupRegistry<K> groups, @NotNull UserKeyProvider<U, K> userKeyProvider,
                        @Nullable GlobalPermissionProvider<U> globalPermissionProvider) {
        checkArgument(groups.isFrozen(), "The group registry of a predicate filter must be frozen");
        this.groups = groups;
        this.userKeyProvider = checkNotNull(userKeyProvider);
        this.resolver = new PermissionResolver<U, K>(groups, userKeyProvider, globalPermissionProvider);
    }

    @NotNull
    public GroupRegistry<K> getGroupRegistry() {
        return groups;
    }

    //----------------------------------------------------< PredicateFilter >---

    @NotNull
    @Override
    public <T> Decision<T> getDecision(@NotNull Class<T> contentType, @NotNull String permission,
                                       @Nullable U user) {
        return resolver.resolve(contentType, permission, user);
    }

    @NotNull
    @Override
    public <T> Iterable<T> filter(@NotNull Iterable<T> content, @NotNull Class<T> contentType,
                                  @NotNull String permission, @Nullable U user) {
        checkNotNull(content, "Content must not be null");
        return getDecision(contentType, permission, user).filter(content);
    }

    @Override
    public boolean test(@NotNull Object content, @NotNull String permission, @Nullable U user) {
        checkNotNull(content, "Content must not be null");
        return test(content.getClass(), content, permission, user);
    }

    @Override
    public boolean testGlobal(@NotNull String permission, @Nullable U user) {
        checkNotNull(permission, "Permission must not be null");
        return resolver.getGlobalValue(permission, user).isAllow();
    }

    @Override
    public boolean isMember(@NotNull Object content, @NotNull String groupName, @Nullable U user) {
        checkNotNull(content, "Content must not be null");
        Group<?, K> group = groups.resolveGroup(groupName, content.getClass());
        return group.matches(content, userKeyProvider.getUserKey(user));
    }

    //------------------------------------------------------------< private >---

    private <T> boolean test(Class<T> contentType, Object content, String permission, U user) {
        return getDecision(contentType, permission, user).apply(contentType.cast(content));
    }
}
