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

import java.util.List;

import com.google.common.collect.Lists;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.relsec.api.Decision;
import org.relsec.api.GlobalPermissionProvider;
import org.relsec.api.PermissionEntry;
import org.relsec.api.PermissionValue;
import org.relsec.api.UserKeyProvider;
import org.relsec.api.constraint.ConstantConstraint;
import org.relsec.api.constraint.Constraint;
import org.relsec.api.constraint.Constraints;
import org.relsec.core.security.group.Group;
import org.relsec.core.security.group.GroupRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Merges the global permissions of a user and the relational groups defined
 * for a content type into a single {@link Decision}.
 * <p>
 * The decision is {@code A and not D1 and ... and not Dn}, where {@code A}
 * is the disjunction of all allowing contributions (a global allow, or the
 * membership in a group allowing the permission) and each {@code Di} is a
 * denying contribution (a global deny, or the membership in a group denying
 * the permission). Without any allowing contribution the decision is
 * {@code false}.
 */
class PermissionResolver<U, K> {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final GroupRegistry<K> groups;
    private final UserKeyProvider<U, K> userKeyProvider;
    private final GlobalPermissionProvider<U> globalPermissionProvider;

    PermissionResolver(@NotNull GroupRegistry<K> groups, @NotNull UserKeyProvider<U, K> userKeyProvider,
                       @Nullable GlobalPermissionProvider<U> globalPermissionProvider) {
        this.groups = checkNotNull(groups);
        this.userKeyProvider = checkNotNull(userKeyProvider);
        this.globalPermissionProvider = globalPermissionProvider;
    }

    /**
     * Combine the global permission entries of a user for one permission.
     *
     * @return {@code DENY} if any entry denies the permission, {@code ALLOW}
     * if any entry allows it, {@code INHERIT} otherwise
     */
    @NotNull
    PermissionValue getGlobalValue(@NotNull String permission, @Nullable U user) {
        if (globalPermissionProvider == null) {
            return PermissionValue.INHERIT;
        }
        PermissionValue value = PermissionValue.INHERIT;
        for (PermissionEntry entry : globalPermissionProvider.getGlobalPermissions(user)) {
            if (entry.appliesTo(permission)) {
                value = value.combine(entry.getValue());
            }
        }
        return value;
    }

    @NotNull
    <T> Decision<T> resolve(@NotNull Class<T> contentType, @NotNull String permission, @Nullable U user) {
        checkNotNull(contentType, "Content type must not be null");
        checkNotNull(permission, "Permission must not be null");

        PermissionValue globalValue = getGlobalValue(permission, user);
        K userKey = userKeyProvider.getUserKey(user);

        List<Constraint<T>> allow = Lists.newArrayList();
        List<Constraint<T>> deny = Lists.newArrayList();
        if (globalValue == PermissionValue.ALLOW) {
            allow.add(ConstantConstraint.<T>alwaysTrue());
        } else if (globalValue == PermissionValue.DENY) {
            deny.add(ConstantConstraint.<T>alwaysTrue());
        }
        for (Group<?, K> group : groups.getGroups(contentType, permission)) {
            switch (group.getPermission(permission)) {
                case ALLOW:
                    allow.add(group.newConstraint(contentType, userKey));
                    break;
                case DENY:
                    deny.add(group.newConstraint(contentType, userKey));
                    break;
                default:
                    // inherit
            }
        }

        Constraint<T> constraint;
        if (allow.isEmpty()) {
            constraint = ConstantConstraint.alwaysFalse();
        } else {
            List<Constraint<T>> operands = Lists.newArrayListWithCapacity(deny.size() + 1);
            operands.add(Constraints.or(allow));
            for (Constraint<T> denied : deny) {
                operands.add(Constraints.not(denied));
            }
            constraint = Constraints.and(operands);
        }

        Decision<T> decision = new Decision<T>(contentType, permission, globalValue, constraint);
        if (log.isTraceEnabled()) {
            log.trace("Resolved {} for user key {} (global {})", decision, userKey, globalValue);
        }
        return decision;
    }
}
