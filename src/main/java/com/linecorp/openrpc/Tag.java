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
 * Metadata of a tag which is used by {@link Method#tags()} for grouping methods.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "summary", "description", "externaldocs" })
@JsonDeserialize(using = TagJsonDeserializer.class)
public final class Tag {

    /**
     * Returns a new {@link Tag} with the specified name.
     */
    public static Tag of(String name) {
        return builder(name).build();
    }

    /**
     * Returns a new {@link TagBuilder}.
     */
    public static TagBuilder builder(String name) {
        return new TagBuilder(name);
    }

    private final String name;
    @Nullable
    private final String summary;
    @Nullable
    private final String description;
    @Nullable
    private final ExternalDocumentation externalDocs;
    private final Map<String, JsonNode> extensions;

    Tag(String name, @Nullable String summary, @Nullable String description,
        @Nullable ExternalDocumentation externalDocs, Map<String, JsonNode> extensions) {
        this.name = requireNonNull(name, "name");
        this.summary = summary;
        this.description = description;
        this.externalDocs = externalDocs;
        this.extensions = extensions;
    }

    @JsonProperty
    public String name() {
        return name;
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

    @Nullable
    @JsonProperty("externaldocs")
    public ExternalDocumentation externalDocs() {
        return externalDocs;
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
        if (!(o instanceof Tag)) {
            return false;
        }
        final Tag that = (Tag) o;
        return name.equals(that.name) &&
               Objects.equals(summary, that.summary) &&
               Objects.equals(description, that.description) &&
               Objects.equals(externalDocs, that.externalDocs) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, summary, description, externalDocs, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("summary", summary)
                          .add("description", description)
                          .add("externalDocs", externalDocs)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
