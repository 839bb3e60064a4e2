/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.openrpc;

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonCreator.Mode;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * An expression which evaluates to a value once the values it depends on are known, such as
 * {@code $params.userId}. Its syntax is not interpreted.
 */
public final class RuntimeExpression {

    /**
     * Returns a new {@link RuntimeExpression}.
     */
    @JsonCreator(mode = Mode.DELEGATING)
    public static RuntimeExpression of(String expression) {
        return new RuntimeExpression(requireNonNull(expression, "expression"));
    }

    private final String expression;

    private RuntimeExpression(String expression) {
        this.expression = expression;
    }

    @JsonValue
    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RuntimeExpression && expression.equals(((RuntimeExpression) o).expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
