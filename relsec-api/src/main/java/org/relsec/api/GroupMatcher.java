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
 * Application-defined rule deciding whether a user belongs to a relational
 * group for one content item, for instance "the user submitted this post".
 * <p>
 * Implementations are expected to be cheap and free of side effects; they
 * may be invoked once per item of a filtered collection.
 *
 * @param <T> the content type the rule accepts
 * @param <K> the type of the key identifying the user
 */
@FunctionalInterface
public interface GroupMatcher<T, K> {

    /**
     * @param content the content item to match
     * @param userKey the key of the user, as returned by the configured
     *                {@link UserKeyProvider}
     * @return {@code true} if the user belongs to the group for this item
     */
    boolean matches(@NotNull T content, @Nullable K userKey);
}
