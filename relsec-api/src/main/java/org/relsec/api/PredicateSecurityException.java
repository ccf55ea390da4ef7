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

import static java.lang.String.format;

/**
 * Base class of the exceptions raised while configuring or evaluating a
 * {@link PredicateFilter}. Every exception carries a type name and a
 * type-specific code, both of which are also part of the message
 * (for example {@code RelSecGroup0002: ...}).
 */
public abstract class PredicateSecurityException extends RuntimeException {

    /**
     * Source name for exceptions thrown by this library.
     */
    public static final String RELSEC = "RelSec";

    /**
     * Type name for errors in the definition or lookup of groups.
     */
    public static final String GROUP = "Group";

    /**
     * Type name for content type violations.
     */
    public static final String TYPE = "Type";

    private static final long serialVersionUID = -3914658770135026457L;

    private final String type;

    private final int code;

    protected PredicateSecurityException(String type, int code, String message) {
        super(format("%s%s%04d: %s", RELSEC, type, code, message));
        this.type = type;
        this.code = code;
    }

    /**
     * Checks whether this exception is of the given type.
     *
     * @param type type name
     * @return {@code true} iff this exception is of the given type
     */
    public boolean isOfType(String type) {
        return this.type.equals(type);
    }

    public String getType() {
        return type;
    }

    public int getCode() {
        return code;
    }
}
