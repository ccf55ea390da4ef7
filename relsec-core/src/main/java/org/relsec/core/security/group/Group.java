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
package org.relsec.core.security.group;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSortedMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.relsec.api.GroupMatcher;
import org.relsec.api.PermissionValue;
import org.relsec.api.TypeMismatchException;
import org.relsec.api.constraint.MatchConstraint;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named group of permissions which can be matched to users for content of
 * one type.
 * <p>
 * A group is mutable while its {@link GroupRegistry} is being configured; the
 * copies held by a frozen registry are immutable.
 *
 * @param <T> the content type the group is defined for
 * @param <K> the user key type
 */
public final class Group<T, K> {

    private final String name;
    private final Class<T> contentType;
    private final GroupMatcher<T, K> matcher;
    private final SortedMap<String, PermissionValue> permissions;

    Group(@NotNull String name, @NotNull Class<T> contentType, @NotNull GroupMatcher<T, K> matcher) {
        this(name, contentType, matcher, new TreeMap<String, PermissionValue>(String.CASE_INSENSITIVE_ORDER));
    }

    private Group(String name, Class<T> contentType, GroupMatcher<T, K> matcher,
                  SortedMap<String, PermissionValue> permissions) {
        checkArgument(!checkNotNull(name).isEmpty(), "Group name must not be empty");
        this.name = name;
        this.contentType = checkNotNull(contentType);
        this.matcher = checkNotNull(matcher);
        this.permissions = permissions;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public Class<T> getContentType() {
        return contentType;
    }

    @NotNull
    public GroupMatcher<T, K> getMatcher() {
        return matcher;
    }

    /**
     * @return the permissions of this group, keyed case-insensitively
     */
    @NotNull
    public Map<String, PermissionValue> getPermissions() {
        return ImmutableSortedMap.copyOfSorted(permissions);
    }

    /**
     * @return the value this group assigns to a permission, or
     * {@link PermissionValue#INHERIT} if it does not define it
     */
    @NotNull
    public PermissionValue getPermission(@NotNull String permission) {
        PermissionValue value = permissions.get(permission);
        return value == null ? PermissionValue.INHERIT : value;
    }

    public boolean definesPermission(@NotNull String permission) {
        return permissions.containsKey(permission);
    }

    public boolean hasName(@NotNull String groupName) {
        return name.equalsIgnoreCase(groupName);
    }

    /**
     * A group applies to requests for its own content type and for subtypes
     * of it.
     */
    public boolean appliesTo(@NotNull Class<?> type) {
        return contentType.isAssignableFrom(type);
    }

    /**
     * A group is relevant to a type it applies to, and to supertypes of its
     * content type: a collection of the supertype may hold items of the
     * content type.
     */
    public boolean isRelevantTo(@NotNull Class<?> type) {
        return appliesTo(type) || type.isAssignableFrom(contentType);
    }

    /**
     * Invoke the matcher of this group.
     *
     * @throws TypeMismatchException if the content is not an instance of the
     *                               content type of this group
     */
    public boolean matches(@NotNull Object content, @Nullable K userKey) {
        if (!contentType.isInstance(content)) {
            throw new TypeMismatchException(name, contentType, content.getClass());
        }
        return matcher.matches(contentType.cast(content), userKey);
    }

    /**
     * Create the constraint testing membership in this group for content of
     * the requested type. If the content type of this group is a subtype of
     * the requested type, the constraint does not hold for items of other
     * types.
     *
     * @throws TypeMismatchException if this group is not relevant to the
     *                               requested type
     */
    @NotNull
    public <C> MatchConstraint<C, K> newConstraint(@NotNull Class<C> requestedType, @Nullable K userKey) {
        if (!isRelevantTo(requestedType)) {
            throw new TypeMismatchException(name, contentType, requestedType);
        }
        // the matcher is only invoked on instances of T, see MatchConstraint.evaluate
        @SuppressWarnings("unchecked")
        GroupMatcher<? super C, ? super K> m = (GroupMatcher<? super C, ? super K>) matcher;
        return new MatchConstraint<C, K>(name, contentType, m, userKey, !appliesTo(requestedType));
    }

    //------------------------------------------------------< configuration >---

    void setPermission(@NotNull String permission, @NotNull PermissionValue value) {
        checkArgument(!checkNotNull(permission).isEmpty(), "Permission name must not be empty");
        permissions.put(permission, checkNotNull(value));
    }

    /**
     * @return a copy of this group using another matcher and the same
     * permissions
     */
    Group<T, K> withMatcher(@NotNull GroupMatcher<T, K> newMatcher) {
        TreeMap<String, PermissionValue> copy = new TreeMap<String, PermissionValue>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(permissions);
        return new Group<T, K>(name, contentType, newMatcher, copy);
    }

    Group<T, K> freeze() {
        return new Group<T, K>(name, contentType, matcher, ImmutableSortedMap.copyOfSorted(permissions));
    }

    @Override
    public String toString() {
        return name + '(' + contentType.getSimpleName() + ")=" + permissions;
    }
}
