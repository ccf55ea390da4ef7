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

import java.util.List;

import com.google.common.collect.Lists;
import org.jetbrains.annotations.NotNull;

/**
 * Factory methods combining constraints. The n-ary combinators never build
 * an {@link AndConstraint} or {@link OrConstraint} with fewer than two
 * operands.
 */
public final class Constraints {

    private Constraints() {
    }

    /**
     * Conjunction of the given constraints; {@code true} if there are none.
     */
    @NotNull
    public static <T> Constraint<T> and(@NotNull List<? extends Constraint<T>> constraints) {
        switch (constraints.size()) {
            case 0:
                return ConstantConstraint.alwaysTrue();
            case 1:
                return constraints.get(0);
            default:
                return new AndConstraint<T>(constraints);
        }
    }

    @SafeVarargs
    @NotNull
    public static <T> Constraint<T> and(@NotNull Constraint<T>... constraints) {
        return and(Lists.newArrayList(constraints));
    }

    /**
     * Disjunction of the given constraints; {@code false} if there are none.
     */
    @NotNull
    public static <T> Constraint<T> or(@NotNull List<? extends Constraint<T>> constraints) {
        switch (constraints.size()) {
            case 0:
                return ConstantConstraint.alwaysFalse();
            case 1:
                return constraints.get(0);
            default:
                return new OrConstraint<T>(constraints);
        }
    }

    @SafeVarargs
    @NotNull
    public static <T> Constraint<T> or(@NotNull Constraint<T>... constraints) {
        return or(Lists.newArrayList(constraints));
    }

    @NotNull
    public static <T> Constraint<T> not(@NotNull Constraint<T> constraint) {
        return new NotConstraint<T>(constraint);
    }
}
