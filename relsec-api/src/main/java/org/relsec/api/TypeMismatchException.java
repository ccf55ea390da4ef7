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
 * Thrown when a group's matcher would be applied to content of a type the
 * group was not defined for.
 */
public class TypeMismatchException extends PredicateSecurityException {

    private static final long serialVersionUID = -6650830349912795468L;

    private final Class<?> expectedType;
    private final Class<?> actualType;

    public TypeMismatchException(String groupName, Class<?> expectedType, Class<?> actualType) {
        super(TYPE, 1, "The security group '" + groupName + "' is not relevant to content of type "
                + actualType.getName() + ". It can only be applied to content of type "
                + expectedType.getName() + '.');
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
