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

/**
 * The security behaviour a group (or a global permission entry) applies to a
 * named permission.
 * <p>
 * Values are declared in ascending order of precedence: when several values
 * are combined a {@link #DENY} overrides an {@link #ALLOW}, and an
 * {@link #INHERIT} never overrides anything.
 */
public enum PermissionValue {

    /**
     * No effect on the permission.
     */
    INHERIT,

    /**
     * Enables the permission unless it is superseded by a {@link #DENY}.
     */
    ALLOW,

    /**
     * Prohibits the permission. Overrides any other value.
     */
    DENY;

    /**
     * Combines this value with another one, returning whichever takes
     * precedence.
     *
     * @param other the value to combine with
     * @return the dominant value of the two
     */
    @NotNull
    public PermissionValue combine(@NotNull PermissionValue other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public boolean isAllow() {
        return this == ALLOW;
    }

    public boolean isDeny() {
        return this == DENY;
    }
}
