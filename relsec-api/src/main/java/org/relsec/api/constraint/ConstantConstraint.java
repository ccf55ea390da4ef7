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

/**
 * A constraint that ignores the content and always evaluates to the same
 * value.
 */
public final class ConstantConstraint<T> extends Constraint<T> {

    private static final ConstantConstraint<Object> TRUE = new ConstantConstraint<Object>(true);

    private static final ConstantConstraint<Object> FALSE = new ConstantConstraint<Object>(false);

    private final boolean value;

    private ConstantConstraint(boolean value) {
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    @NotNull
    public static <T> ConstantConstraint<T> alwaysTrue() {
        return (ConstantConstraint<T>) TRUE;
    }

    @SuppressWarnings("unchecked")
    @NotNull
    public static <T> ConstantConstraint<T> alwaysFalse() {
        return (ConstantConstraint<T>) FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public boolean evaluate(@NotNull T content) {
        return value;
    }

    @Override
    public <R> R accept(@NotNull ConstraintVisitor<T, R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
