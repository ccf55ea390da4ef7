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
 * The base class of the nodes of a decision expression. A tree of
 * constraints can either be evaluated against content items in memory, or be
 * walked with a {@link ConstraintVisitor} to translate it into the query
 * language of a content store.
 *
 * @param <T> the content type the constraint is evaluated against
 */
public abstract class Constraint<T> {

    /**
     * Evaluate this constraint for one content item.
     *
     * @param content the item to evaluate
     * @return whether the constraint holds for the item
     */
    public abstract boolean evaluate(@NotNull T content);

    public abstract <R> R accept(@NotNull ConstraintVisitor<T, R> visitor);

    protected static String protect(Constraint<?> constraint) {
        String str = constraint.toString();
        if (str.indexOf(' ') >= 0) {
            return '(' + str + ')';
        } else {
            return str;
        }
    }

    protected static String quote(String name) {
        return '[' + name.replaceAll("]", "]]") + ']';
    }
}
