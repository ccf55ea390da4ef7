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

import java.util.Collection;

/**
 * Thrown when a group name resolves to more than one group and the caller
 * did not say which content type it meant.
 */
public class AmbiguousGroupNameException extends PredicateSecurityException {

    private static final long serialVersionUID = 7541906650264911713L;

    private final String groupName;

    public AmbiguousGroupNameException(String groupName, Collection<? extends Class<?>> contentTypes) {
        super(GROUP, 3, "The group name '" + groupName + "' is bound to several content types "
                + contentTypes + "; specify the content type explicitly.");
        this.groupName = groupName;
    }

    public String getGroupName() {
        return groupName;
    }
}
