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

import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.MoreObjects;

/**
 * A design-time link from the result of a {@link Method} to another method. A {@link Link} does not
 * guarantee that the linked method can be invoked successfully.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "description", "summary", "method", "params", "server" })
@JsonDeserialize(using = LinkJsonDeserializer.class)
public final class Link {

    /**
     * Returns a new {@link LinkBuilder}.
     */
    public static LinkBuilder builder(String name) {
        return new LinkBuilder(name);
    }

    private final String name;
    @Nullable
    private final String description;
    @Nullable
    private final String summary;
    @Nullable
    private final String method;
    private final Map<String, RuntimeExpression> params;
    @Nullable
    private final Server server;
    private final Map<String, JsonNode> extensions;

    Link(String name, @Nullable String description, @Nullable String summary, @Nullable String method,
         Map<String, RuntimeExpression> params, @Nullable Server server, Map<String, JsonNode> extensions) {
        this.name = requireNonNull(name, "name");
        this.description = description;
        this.summary = summary;
        this.method = method;
        this.params = params;
        this.server = server;
        this.extensions = extensions;
    }

    @JsonProperty
    public String name() {
        return name;
    }

    @Nullable
    @JsonProperty
    public String description() {
        return description;
    }

    @Nullable
    @JsonProperty
    public String summary() {
        return summary;
    }

    /**
     * Returns the name of the linked {@link Method}.
     */
    @Nullable
    @JsonProperty
    public String method() {
        return method;
    }

    /**
     * Returns the parameters to pass to the linked {@link Method}, keyed by the parameter names.
     */
    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, RuntimeExpression> params() {
        return params;
    }

    /**
     * Returns the {@link Server} to be used by the linked {@link Method}.
     */
    @Nullable
    @JsonProperty
    public Server server() {
        return server;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> extensions() {
        return extensions;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Link)) {
            return false;
        }
        final Link that = (Link) o;
        return name.equals(that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(summary, that.summary) &&
               Objects.equals(method, that.method) &&
               params.equals(that.params) &&
               Objects.equals(server, that.server) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, summary, method, params, server, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("description", description)
                          .add("summary", summary)
                          .add("method", method)
                          .add("params", params.isEmpty() ? null : params)
                          .add("server", server)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
