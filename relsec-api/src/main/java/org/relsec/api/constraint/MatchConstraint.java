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
package org.relsec.api.constraint;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.relsec.api.GroupMatcher;
import org.relsec.api.TypeMismatchException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An atomic test: does the user (identified by a key bound when the decision
 * was built) belong to a named group for the content item?
 *
 * @param <T> the content type
 * @param <K> the user key type
 */
public final class MatchConstraint<T, K> extends Constraint<T> {

    private final String groupName;
    private final Class<?> groupType;
    private final GroupMatcher<? super T, ? super K> matcher;
    private final K userKey;
    private final boolean typeGuarded;

    public MatchConstraint(@NotNull String groupName, @NotNull Class<?> groupType,
                           @NotNull GroupMatcher<? super T, ? super K> matcher, @Nullable K userKey) {
        this(groupName, groupType, matcher, userKey, false);
    }

    /**
     * @param typeGuarded if {@code true} the group is defined for a subtype of
     *                    the content type and the constraint does not hold for
     *                    items which are no instances of that subtype
     */
    public MatchConstraint(@NotNull String groupName, @NotNull Class<?> groupType,
                           @NotNull GroupMatcher<? super T, ? super K> matcher, @Nullable K userKey,
                           boolean typeGuarded) {
        this.groupName = checkNotNull(groupName);
        this.groupType = checkNotNull(groupType);
        this.matcher = checkNotNull(matcher);
        this.userKey = userKey;
        this.typeGuarded = typeGuarded;
    }

    @NotNull
    public String getGroupName() {
        return groupName;
    }

    /**
     * @return the content type the group was defined for
     */
    @NotNull
    public Class<?> getGroupType() {
        return groupType;
    }

    /**
     * @return whether the group only matches instances of its own, narrower
     * content type
     */
    public boolean isTypeGuarded() {
        return typeGuarded;
    }

    @Nullable
    public K getUserKey() {
        return userKey;
    }

    @NotNull
    public GroupMatcher<? super T, ? super K> getMatcher() {
        return matcher;
    }

    @Override
    public boolean evaluate(@NotNull T content) {
        // generic types are erased, the matcher would fail with a ClassCastException
        if (!groupType.isInstance(content)) {
            if (typeGuarded) {
                return false;
            }
            throw new TypeMismatchException(groupName, groupType, content.getClass());
        }
        return matcher.matches(content, userKey);
    }

    @Override
    public <R> R accept(@NotNull ConstraintVisitor<T, R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return quote(groupName);
    }
}
