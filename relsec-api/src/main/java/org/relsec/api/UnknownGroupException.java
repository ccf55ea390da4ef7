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
 * Thrown when a permission is attached to, or membership is tested against, a
 * group name that has not been registered (for the requested content type).
 */
public class UnknownGroupException extends PredicateSecurityException {

    private static final long serialVersionUID = 4428170931246628305L;

    private final String groupName;

    public UnknownGroupException(String groupName) {
        super(GROUP, 1, "There is no group named '" + groupName + "'.");
        this.groupName = groupName;
    }

    public UnknownGroupException(String groupName, Class<?> contentType) {
        super(GROUP, 1, "There is no group named '" + groupName + "' for content of type "
                + contentType.getName() + '.');
        this.groupName = groupName;
    }

    public String getGroupName() {
        return groupName;
    }
}
