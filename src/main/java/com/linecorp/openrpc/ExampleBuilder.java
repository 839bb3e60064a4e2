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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds a new {@link Example}.
 */
public final class ExampleBuilder extends AbstractExtensibleBuilder<ExampleBuilder> {

    @Nullable
    String name;
    @Nullable
    String summary;
    @Nullable
    String description;
    @Nullable
    JsonNode value;
    @Nullable
    String externalValue;

    ExampleBuilder() {}

    public ExampleBuilder name(String name) {
        this.name = requireNonNull(name, "name");
        return this;
    }

    public ExampleBuilder summary(String summary) {
        this.summary = requireNonNull(summary, "summary");
        return this;
    }

    public ExampleBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    /**
     * Sets the embedded value. Use {@link com.fasterxml.jackson.databind.node.NullNode} for an
     * embedded {@code null}.
     */
    public ExampleBuilder value(JsonNode value) {
        this.value = requireNonNull(value, "value");
        return this;
    }

    /**
     * Sets the URL of the value.
     */
    public ExampleBuilder externalValue(String externalValue) {
        this.externalValue = requireNonNull(externalValue, "externalValue");
        return this;
    }

    /**
     * Returns a newly-created {@link Example} based on the properties set so far.
     *
     * @throws IllegalStateException if both {@code value} and {@code externalValue} were set
     */
    public Example build() {
        checkState(value == null || externalValue == null,
                   "value and externalValue are mutually exclusive. value: %s, externalValue: %s",
                   value, externalValue);
        return new Example(name, summary, description, value, externalValue, extensions());
    }
}
