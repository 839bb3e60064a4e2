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

import com.google.common.collect.ImmutableList;

/**
 * Builds a new {@link ServerVariable}.
 */
public final class ServerVariableBuilder extends AbstractExtensibleBuilder<ServerVariableBuilder> {

    private final String defaultValue;
    final ImmutableList.Builder<String> enumValues = ImmutableList.builder();
    @Nullable
    String description;

    ServerVariableBuilder(String defaultValue) {
        this.defaultValue = requireNonNull(defaultValue, "defaultValue");
    }

    /**
     * Adds the specified values to the values the variable is limited to.
     */
    public ServerVariableBuilder enumValues(String... enumValues) {
        return enumValues(ImmutableList.copyOf(requireNonNull(enumValues, "enumValues")));
    }

    /**
     * Adds the specified values to the values the variable is limited to.
     */
    public ServerVariableBuilder enumValues(Iterable<String> enumValues) {
        this.enumValues.addAll(requireNonNull(enumValues, "enumValues"));
        return this;
    }

    public ServerVariableBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    /**
     * Returns a newly-created {@link ServerVariable} based on the properties set so far.
     */
    public ServerVariable build() {
        return new ServerVariable(enumValues.build(), defaultValue, description, extensions());
    }
}
