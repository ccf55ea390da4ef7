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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.relsec.api.AmbiguousGroupNameException;
import org.relsec.api.DuplicateGroupNameException;
import org.relsec.api.GroupMatcher;
import org.relsec.api.PermissionValue;
import org.relsec.api.TypeMismatchException;
import org.relsec.api.UnknownGroupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * The groups known to a predicate filter, in registration order.
 * <p>
 * Group names are case-insensitive. Unless reusing group names is allowed,
 * each name is bound to exactly one content type; otherwise a name may be
 * bound to several content types and lookups are disambiguated by type.
 * <p>
 * A registry is populated during a configuration phase and then
 * {@link #freeze() frozen}. This class is not thread-safe while it is being
 * configured; a frozen registry is immutable.
 *
 * @param <K> the user key type
 */
public final class GroupRegistry<K> {

    private static final Logger log = LoggerFactory.getLogger(GroupRegistry.class);

    private final boolean allowReusingGroupNames;
    private final List<Group<?, K>> groups;
    private final boolean frozen;

    public GroupRegistry(boolean allowReusingGroupNames) {
        this(allowReusingGroupNames, new ArrayList<Group<?, K>>(), false);
    }

    private GroupRegistry(boolean allowReusingGroupNames, List<Group<?, K>> groups, boolean frozen) {
        this.allowReusingGroupNames = allowReusingGroupNames;
        this.groups = groups;
        this.frozen = frozen;
    }

    public boolean isAllowReusingGroupNames() {
        return allowReusingGroupNames;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Define a group. Defining a group again for the same content type
     * replaces its matcher and keeps the permissions already assigned to it.
     *
     * @param name        the name of the group
     * @param contentType the type of content the group can be matched to
     * @param matcher     returns true if the group applies for a content
     *                    item and user key
     * @throws DuplicateGroupNameException if the name is bound to another
     *                                     content type and reusing group names is not allowed
     */
    public <T> void addGroup(@NotNull String name, @NotNull Class<T> contentType,
                             @NotNull GroupMatcher<T, K> matcher) {
        checkMutable();
        checkNotNull(name, "Group name must not be null");
        checkNotNull(contentType, "Content type must not be null");
        checkNotNull(matcher, "Matcher must not be null");

        for (int i = 0; i < groups.size(); i++) {
            Group<?, K> existing = groups.get(i);
            if (!existing.hasName(name)) {
                continue;
            }
            if (existing.getContentType() == contentType) {
                Group<T, K> replacement = cast(existing, contentType).withMatcher(matcher);
                groups.set(i, replacement);
                log.debug("Replaced the matcher of group {}", replacement);
                return;
            }
            if (!allowReusingGroupNames) {
                throw new DuplicateGroupNameException(existing.getName(), existing.getContentType(), contentType);
            }
        }
        groups.add(new Group<T, K>(name, contentType, matcher));
    }

    /**
     * Assign a permission to the group of the given name.
     *
     * @throws UnknownGroupException        if there is no such group
     * @throws AmbiguousGroupNameException  if the name is bound to several
     *                                      content types
     */
    public void addPermission(@NotNull String groupName, @NotNull String permission,
                              @NotNull PermissionValue value) {
        checkMutable();
        List<Group<?, K>> named = getGroups(groupName);
        if (named.isEmpty()) {
            throw new UnknownGroupException(groupName);
        }
        if (named.size() > 1) {
            throw new AmbiguousGroupNameException(groupName, contentTypes(named));
        }
        named.get(0).setPermission(permission, value);
    }

    /**
     * Assign a permission to the group of the given name defined for exactly
     * the given content type.
     *
     * @throws UnknownGroupException if there is no such group
     */
    public void addPermission(@NotNull String groupName, @NotNull Class<?> contentType,
                              @NotNull String permission, @NotNull PermissionValue value) {
        checkMutable();
        Group<?, K> group = getGroup(groupName, contentType);
        if (group == null) {
            throw new UnknownGroupException(groupName, contentType);
        }
        group.setPermission(permission, value);
    }

    /**
     * @return all groups, in registration order
     */
    @NotNull
    public List<Group<?, K>> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    /**
     * @return the groups of the given name, one per content type
     */
    @NotNull
    public List<Group<?, K>> getGroups(@NotNull String groupName) {
        checkNotNull(groupName, "Group name must not be null");
        List<Group<?, K>> named = Lists.newArrayListWithCapacity(1);
        for (Group<?, K> group : groups) {
            if (group.hasName(groupName)) {
                named.add(group);
            }
        }
        return named;
    }

    /**
     * @return the groups relevant to a content type which define a
     * permission, in registration order. This includes groups defined for
     * subtypes of the content type.
     * @see Group#isRelevantTo(Class)
     */
    @NotNull
    public List<Group<?, K>> getGroups(@NotNull Class<?> contentType, @NotNull String permission) {
        checkNotNull(contentType, "Content type must not be null");
        checkNotNull(permission, "Permission must not be null");
        List<Group<?, K>> result = Lists.newArrayList();
        for (Group<?, K> group : groups) {
            if (group.isRelevantTo(contentType) && group.definesPermission(permission)) {
                result.add(group);
            }
        }
        return result;
    }

    /**
     * @return the group of the given name defined for exactly the given
     * content type, or {@code null}
     */
    @Nullable
    public Group<?, K> getGroup(@NotNull String groupName, @NotNull Class<?> contentType) {
        for (Group<?, K> group : getGroups(groupName)) {
            if (group.getContentType() == contentType) {
                return group;
            }
        }
        return null;
    }

    /**
     * Find the single group of the given name which applies to content of
     * the given type.
     *
     * @throws UnknownGroupException        if there is no group of that name
     * @throws TypeMismatchException        if no group of that name applies to
     *                                      the type
     * @throws AmbiguousGroupNameException  if more than one does
     */
    @NotNull
    public Group<?, K> resolveGroup(@NotNull String groupName, @NotNull Class<?> contentType) {
        List<Group<?, K>> named = getGroups(groupName);
        if (named.isEmpty()) {
            throw new UnknownGroupException(groupName);
        }
        List<Group<?, K>> applicable = Lists.newArrayListWithCapacity(1);
        for (Group<?, K> group : named) {
            if (group.appliesTo(contentType)) {
                applicable.add(group);
            }
        }
        if (applicable.isEmpty()) {
            throw new TypeMismatchException(groupName, named.get(0).getContentType(), contentType);
        }
        if (applicable.size() > 1) {
            throw new AmbiguousGroupNameException(groupName, contentTypes(applicable));
        }
        return applicable.get(0);
    }

    public int size() {
        return groups.size();
    }

    /**
     * @return an immutable copy of this registry
     */
    @NotNull
    public GroupRegistry<K> freeze() {
        if (frozen) {
            return this;
        }
        ImmutableList.Builder<Group<?, K>> copy = ImmutableList.builder();
        for (Group<?, K> group : groups) {
            copy.add(group.freeze());
        }
        return new GroupRegistry<K>(allowReusingGroupNames, copy.build(), true);
    }

    @Override
    public String toString() {
        return "GroupRegistry{allowReusingGroupNames=" + allowReusingGroupNames + ", groups=" + groups + '}';
    }

    //------------------------------------------------------------< private >---

    private void checkMutable() {
        checkState(!frozen, "The group registry is frozen and can no longer be modified");
    }

    @SuppressWarnings("unchecked")
    private static <T, K> Group<T, K> cast(Group<?, K> group, Class<T> contentType) {
        // only called once the content types are known to be identical
        return (Group<T, K>) group;
    }

    private static List<Class<?>> contentTypes(List<? extends Group<?, ?>> groups) {
        List<Class<?>> types = Lists.newArrayListWithCapacity(groups.size());
        for (Group<?, ?> group : groups) {
            types.add(group.getContentType());
        }
        return types;
    }
}
