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
 * Builds a new {@link Link}.
 */
public final class LinkBuilder extends AbstractExtensibleBuilder<LinkBuilder> {

    private final String name;
    @Nullable
    String description;
    @Nullable
    String summary;
    @Nullable
    String method;
    private final Map<String, RuntimeExpression> params = new LinkedHashMap<>();
    @Nullable
    Server server;

    LinkBuilder(String name) {
        this.name = requireNonNull(name, "name");
    }

    public LinkBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    public LinkBuilder summary(String summary) {
        this.summary = requireNonNull(summary, "summary");
        return this;
    }

    /**
     * Sets the name of the linked {@link Method}.
     */
    public LinkBuilder method(String method) {
        this.method = requireNonNull(method, "method");
        return this;
    }

    /**
     * Adds a parameter to pass to the linked {@link Method}.
     */
    public LinkBuilder param(String name, RuntimeExpression expression) {
        params.put(requireNonNull(name, "name"), requireNonNull(expression, "expression"));
        return this;
    }

    /**
     * Adds a parameter to pass to the linked {@link Method}.
     */
    public LinkBuilder param(String name, String expression) {
        return param(name, RuntimeExpression.of(expression));
    }

    public LinkBuilder params(Map<String, RuntimeExpression> params) {
        requireNonNull(params, "params").forEach(this::param);
        return this;
    }

    public LinkBuilder server(Server server) {
        this.server = requireNonNull(server, "server");
        return this;
    }

    /**
     * Returns a newly-created {@link Link} based on the properties set so far.
     */
    public Link build() {
        return new Link(name, description, summary, method, ImmutableMap.copyOf(params), server,
                        extensions());
    }
}
