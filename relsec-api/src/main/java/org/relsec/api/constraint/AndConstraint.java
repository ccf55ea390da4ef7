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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An "and" condition over two or more constraints.
 */
public final class AndConstraint<T> extends Constraint<T> {

    private final List<Constraint<T>> constraints;

    public AndConstraint(@NotNull List<? extends Constraint<T>> constraints) {
        checkArgument(constraints.size() > 1, "An 'and' condition needs at least two operands");
        this.constraints = ImmutableList.copyOf(constraints);
    }

    @NotNull
    public List<Constraint<T>> getConstraints() {
        return constraints;
    }

    @Override
    public boolean evaluate(@NotNull T content) {
        for (Constraint<T> constraint : constraints) {
            if (!constraint.evaluate(content)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public <R> R accept(@NotNull ConstraintVisitor<T, R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        StringBuilder buff = new StringBuilder();
        for (Constraint<T> constraint : constraints) {
            if (buff.length() > 0) {
                buff.append(" and ");
            }
            buff.append(protect(constraint));
        }
        return buff.toString();
    }
}
