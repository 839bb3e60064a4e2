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
 * Refers to an external resource for extended documentation, found in the {@code externaldocs} of
 * an {@link OpenRpcDocument}, a {@link Method} or a {@link Tag}.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "description", "url" })
@JsonDeserialize(using = ExternalDocumentationJsonDeserializer.class)
public final class ExternalDocumentation {

    /**
     * Returns a new {@link ExternalDocumentation} which refers to the specified URL.
     */
    public static ExternalDocumentation of(String url) {
        return builder(url).build();
    }

    /**
     * Returns a new {@link ExternalDocumentationBuilder}.
     */
    public static ExternalDocumentationBuilder builder(String url) {
        return new ExternalDocumentationBuilder(url);
    }

    @Nullable
    private final String description;
    private final String url;
    private final Map<String, JsonNode> extensions;

    ExternalDocumentation(@Nullable String description, String url, Map<String, JsonNode> extensions) {
        this.description = description;
        this.url = requireNonNull(url, "url");
        this.extensions = extensions;
    }

    @Nullable
    @JsonProperty
    public String description() {
        return description;
    }

    @JsonProperty
    public String url() {
        return url;
    }

    /**
     * Returns the extension fields.
     */
    @JsonAnyGetter
    public Map<String, JsonNode> extensions() {
        return extensions;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExternalDocumentation)) {
            return false;
        }
        final ExternalDocumentation that = (ExternalDocumentation) o;
        return Objects.equals(description, that.description) &&
               url.equals(that.url) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, url, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("description", description)
                          .add("url", url)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
