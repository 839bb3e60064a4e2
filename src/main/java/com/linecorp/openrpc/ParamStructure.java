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

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * The structure of the {@code params} of a JSON-RPC request which a {@link Method} expects.
 */
@JsonDeserialize(using = ParamStructureJsonDeserializer.class)
public enum ParamStructure {
    /**
     * The {@code params} is an array whose elements are ordered as the parameters are.
     */
    BY_POSITION(0, "by-position"),
    /**
     * The {@code params} is an object keyed by the parameter names.
     */
    BY_NAME(1, "by-name"),
    /**
     * The {@code params} may be either an array or an object.
     */
    EITHER(2, "either");

    /**
     * Returns the {@link ParamStructure} of the specified ordinal value, or {@code null} if there is
     * no such {@link ParamStructure}.
     */
    @Nullable
    public static ParamStructure of(int value) {
        for (ParamStructure structure : values()) {
            if (structure.value == value) {
                return structure;
            }
        }
        return null;
    }

    /**
     * Returns the {@link ParamStructure} whose text is the specified one, such as {@code "by-name"},
     * or {@code null} if there is no such {@link ParamStructure}.
     */
    @Nullable
    public static ParamStructure ofText(String text) {
        requireNonNull(text, "text");
        for (ParamStructure structure : values()) {
            if (structure.text.equals(text)) {
                return structure;
            }
        }
        return null;
    }

    /**
     * Returns the text of the {@link ParamStructure} of the specified ordinal value. A value which
     * has no {@link ParamStructure} is rendered as a decimal number.
     */
    public static String render(int value) {
        final ParamStructure structure = of(value);
        return structure != null ? structure.text : String.valueOf(value);
    }

    private final int value;
    private final String text;

    ParamStructure(int value, String text) {
        this.value = value;
        this.text = text;
    }

    /**
     * Returns the ordinal value, which is {@code 0} for {@link #BY_POSITION}.
     */
    public int value() {
        return value;
    }

    /**
     * Returns the text of this {@link ParamStructure}, such as {@code "by-position"}.
     */
    @JsonValue
    @Override
    public String toString() {
        return text;
    }
}
