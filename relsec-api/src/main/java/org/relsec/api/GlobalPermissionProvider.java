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
 * Supplies the traditional, non-relational permissions of a user, such as
 * those granted by a site administrator role.
 *
 * @param <U> the user type
 */
@FunctionalInterface
public interface GlobalPermissionProvider<U> {

    /**
     * @param user the user, possibly {@code null} for anonymous access
     * @return the permission entries of the user; never {@code null}
     */
    @NotNull
    Iterable<PermissionEntry> getGlobalPermissions(@Nullable U user);
}
