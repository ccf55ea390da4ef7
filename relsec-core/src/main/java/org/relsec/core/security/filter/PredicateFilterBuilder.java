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
import org.relsec.api.GlobalPermissionProvider;
import org.relsec.api.GroupMatcher;
import org.relsec.api.PermissionValue;
import org.relsec.api.PredicateFilter;
import org.relsec.api.UserKeyProvider;
import org.relsec.core.config.FilterConfiguration;
import org.relsec.core.security.group.GroupRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Collects the group and permission declarations of a predicate filter and
 * builds the immutable filter from them.
 * <p>
 * A minimal example defines a group that can edit blog posts and filters a
 * collection of posts down to those the current user can edit:
 * <pre>
 * PredicateFilter&lt;User&gt; filter = PredicateFilterBuilder.newBuilder(User::getId)
 *         .addGroup("post-editor", BlogPost.class, (post, userId) -&gt; post.getEditorId() == userId)
 *         .addPermission("post-editor", "post-edit", PermissionValue.ALLOW)
 *         .build();
 *
 * Iterable&lt;BlogPost&gt; canEdit = filter.filter(posts, BlogPost.class, "post-edit", user);
 * </pre>
 * Configuration errors are reported by the call declaring them. Builders are
 * not thread-safe; the filters they build are.
 *
 * @param <U> the user type
 * @param <K> the user key type passed to the group matchers
 */
public final class PredicateFilterBuilder<U, K> {

    private static final Logger log = LoggerFactory.getLogger(PredicateFilterBuilder.class);

    private final UserKeyProvider<U, K> userKeyProvider;
    private GlobalPermissionProvider<U> globalPermissionProvider;
    private GroupRegistry<K> groups = new GroupRegistry<K>(FilterConfiguration.DEFAULT_ALLOW_REUSING_GROUP_NAMES);

    private PredicateFilterBuilder(UserKeyProvider<U, K> userKeyProvider) {
        this.userKeyProvider = checkNotNull(userKeyProvider, "User key provider must not be null");
    }

    /**
     * @param userKeyProvider maps a user to the key passed to group matchers
     */
    @NotNull
    public static <U, K> PredicateFilterBuilder<U, K> newBuilder(@NotNull UserKeyProvider<U, K> userKeyProvider) {
        return new PredicateFilterBuilder<U, K>(userKeyProvider);
    }

    /**
     * Builder for filters where the user is identified directly by its key.
     */
    @NotNull
    public static <K> PredicateFilterBuilder<K, K> newBuilder() {
        return new PredicateFilterBuilder<K, K>(new UserKeyProvider<K, K>() {
            @Override
            public K getUserKey(@Nullable K user) {
                return user;
            }
        });
    }

    @NotNull
    public PredicateFilterBuilder<U, K> withGlobalPermissions(@Nullable GlobalPermissionProvider<U> provider) {
        this.globalPermissionProvider = provider;
        return this;
    }

    /**
     * Allow binding one group name to several, unrelated content types. Must
     * be set before the first group is added.
     */
    @NotNull
    public PredicateFilterBuilder<U, K> allowReusingGroupNames(boolean allow) {
        checkState(groups.size() == 0, "Reusing group names must be configured before adding groups");
        groups = new GroupRegistry<K>(allow);
        return this;
    }

    /**
     * Apply configuration parameters. Must be called before the first group
     * is added.
     */
    @NotNull
    public PredicateFilterBuilder<U, K> with(@NotNull FilterConfiguration configuration) {
        return allowReusingGroupNames(configuration.isAllowReusingGroupNames());
    }

    /**
     * @see GroupRegistry#addGroup(String, Class, GroupMatcher)
     */
    @NotNull
    public <T> PredicateFilterBuilder<U, K> addGroup(@NotNull String name, @NotNull Class<T> contentType,
                                                     @NotNull GroupMatcher<T, K> matcher) {
        groups.addGroup(name, contentType, matcher);
        return this;
    }

    /**
     * @see GroupRegistry#addPermission(String, String, PermissionValue)
     */
    @NotNull
    public PredicateFilterBuilder<U, K> addPermission(@NotNull String groupName, @NotNull String permission,
                                                      @NotNull PermissionValue value) {
        groups.addPermission(groupName, permission, value);
        return this;
    }

    /**
     * @see GroupRegistry#addPermission(String, Class, String, PermissionValue)
     */
    @NotNull
    public PredicateFilterBuilder<U, K> addPermission(@NotNull String groupName, @NotNull Class<?> contentType,
                                                      @NotNull String permission, @NotNull PermissionValue value) {
        groups.addPermission(groupName, contentType, permission, value);
        return this;
    }

    /**
     * Freeze the declarations made so far into a filter. The builder can be
     * used further; later declarations do not affect filters already built.
     */
    @NotNull
    public PredicateFilter<U> build() {
        GroupRegistry<K> frozen = groups.freeze();
        log.debug("Built predicate filter with {} group(s), reusing group names: {}, global permissions: {}",
                frozen.size(), frozen.isAllowReusingGroupNames(), globalPermissionProvider != null);
        return new PredicateFilterImpl<U, K>(frozen, userKeyProvider, globalPermissionProvider);
    }
}
