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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

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
 * A server which serves the methods of an {@link OpenRpcDocument} or a {@link Method}.
 *
 * <p>The {@link #url()} may be a template that contains variables such as {@code {port}}. Use
 * {@link #url(Map)} to substitute them.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "url", "summary", "description", "variables" })
@JsonDeserialize(using = ServerJsonDeserializer.class)
public final class Server {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{([^{}]+)}");

    private static final Server LOCALHOST = builder("default", "localhost").build();

    /**
     * Returns the {@link Server} that is assumed when an {@link OpenRpcDocument} specifies no servers.
     * Its name is {@code "default"} and its URL is {@code "localhost"}.
     */
    public static Server localhost() {
        return LOCALHOST;
    }

    /**
     * Returns a new {@link Server} with the specified name and URL.
     */
    public static Server of(String name, String url) {
        return builder(name, url).build();
    }

    /**
     * Returns a new {@link ServerBuilder}.
     */
    public static ServerBuilder builder(String name, String url) {
        return new ServerBuilder(name, url);
    }

    private final String name;
    private final String url;
    @Nullable
    private final String summary;
    @Nullable
    private final String description;
    private final Map<String, ServerVariable> variables;
    private final Map<String, JsonNode> extensions;

    Server(String name, String url, @Nullable String summary, @Nullable String description,
           Map<String, ServerVariable> variables, Map<String, JsonNode> extensions) {
        this.name = requireNonNull(name, "name");
        this.url = requireNonNull(url, "url");
        this.summary = summary;
        this.description = description;
        this.variables = variables;
        this.extensions = extensions;
    }

    @JsonProperty
    public String name() {
        return name;
    }

    /**
     * Returns the URL of the server, which may contain variables.
     */
    @JsonProperty
    public String url() {
        return url;
    }

    /**
     * Returns the URL of the server whose variables are substituted. A variable takes its value from
     * the specified {@link Map} first and then from {@link ServerVariable#defaultValue()}. A variable
     * that is found in neither is left as is.
     */
    public String url(Map<String, String> values) {
        requireNonNull(values, "values");
        final Matcher matcher = VARIABLE_PATTERN.matcher(url);
        final StringBuilder buf = new StringBuilder(url.length());
        while (matcher.find()) {
            final String variableName = matcher.group(1);
            String value = values.get(variableName);
            if (value == null) {
                final ServerVariable variable = variables.get(variableName);
                value = variable != null ? variable.defaultValue() : matcher.group();
            }
            matcher.appendReplacement(buf, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(buf);
        return buf.toString();
    }

    @Nullable
    @JsonProperty
    public String summary() {
        return summary;
    }

    @Nullable
    @JsonProperty
    public String description() {
        return description;
    }

    /**
     * Returns the variables of the {@link #url()}, keyed by their names.
     */
    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, ServerVariable> variables() {
        return variables;
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
        if (!(o instanceof Server)) {
            return false;
        }
        final Server that = (Server) o;
        return name.equals(that.name) &&
               url.equals(that.url) &&
               Objects.equals(summary, that.summary) &&
               Objects.equals(description, that.description) &&
               variables.equals(that.variables) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, url, summary, description, variables, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("url", url)
                          .add("summary", summary)
                          .add("description", description)
                          .add("variables", variables.isEmpty() ? null : variables)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
