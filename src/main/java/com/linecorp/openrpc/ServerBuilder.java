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

import java.util.LinkedHashMap;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import com.google.common.collect.ImmutableMap;

/**
 * Builds a new {@link Server}.
 */
public final class ServerBuilder extends AbstractExtensibleBuilder<ServerBuilder> {

    private final String name;
    private final String url;
    @Nullable
    String summary;
    @Nullable
    String description;
    private final Map<String, ServerVariable> variables = new LinkedHashMap<>();

    ServerBuilder(String name, String url) {
        this.name = requireNonNull(name, "name");
        this.url = requireNonNull(url, "url");
    }

    public ServerBuilder summary(String summary) {
        this.summary = requireNonNull(summary, "summary");
        return this;
    }

    public ServerBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    /**
     * Adds a variable of the URL template.
     */
    public ServerBuilder variable(String name, ServerVariable variable) {
        variables.put(requireNonNull(name, "name"), requireNonNull(variable, "variable"));
        return this;
    }

    /**
     * Adds the specified variables of the URL template.
     */
    public ServerBuilder variables(Map<String, ServerVariable> variables) {
        requireNonNull(variables, "variables").forEach(this::variable);
        return this;
    }

    /**
     * Returns a newly-created {@link Server} based on the properties set so far.
     */
    public Server build() {
        return new Server(name, url, summary, description, ImmutableMap.copyOf(variables), extensions());
    }
}
