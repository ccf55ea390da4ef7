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

/**
 * Thrown when a group name is registered for a second content type while
 * reusing group names is disabled.
 */
public class DuplicateGroupNameException extends PredicateSecurityException {

    private static final long serialVersionUID = -1206735547286214420L;

    private final String groupName;

    public DuplicateGroupNameException(String groupName, Class<?> existingType, Class<?> requestedType) {
        super(GROUP, 2, "The group '" + groupName + "' is already defined for content of type "
                + existingType.getName() + " and cannot be redefined for " + requestedType.getName()
                + " unless reusing group names is allowed.");
        this.groupName = groupName;
    }

    public String getGroupName() {
        return groupName;
    }
}
