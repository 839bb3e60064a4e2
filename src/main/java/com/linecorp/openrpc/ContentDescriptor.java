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

import java.util.List;
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

import com.linecorp.openrpc.jsonschema.Schema;

/**
 * Describes the content of a parameter or a result of a {@link Method}.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "summary", "description", "schema", "required", "deprecated", "examples" })
@JsonDeserialize(using = ContentDescriptorJsonDeserializer.class)
public final class ContentDescriptor {

    /**
     * Returns a new {@link ContentDescriptor} with the specified name and {@link JsonSchema}.
     */
    public static ContentDescriptor of(String name, JsonSchema schema) {
        return builder(name, schema).build();
    }

    /**
     * Returns a new {@link ContentDescriptor} with the specified name and {@link Schema}.
     */
    public static ContentDescriptor of(String name, Schema schema) {
        return builder(name, JsonSchema.of(schema)).build();
    }

    /**
     * Returns a new {@link ContentDescriptorBuilder}.
     */
    public static ContentDescriptorBuilder builder(String name, JsonSchema schema) {
        return new ContentDescriptorBuilder(name, schema);
    }

    /**
     * Returns a new {@link ContentDescriptorBuilder}.
     */
    public static ContentDescriptorBuilder builder(String name, Schema schema) {
        return new ContentDescriptorBuilder(name, JsonSchema.of(schema));
    }

    private final String name;
    @Nullable
    private final String summary;
    @Nullable
    private final String description;
    private final JsonSchema schema;
    private final boolean required;
    private final boolean deprecated;
    private final List<ExamplePairing> examples;
    private final Map<String, JsonNode> extensions;

    ContentDescriptor(String name, @Nullable String summary, @Nullable String description,
                      JsonSchema schema, boolean required, boolean deprecated,
                      List<ExamplePairing> examples, Map<String, JsonNode> extensions) {
        this.name = requireNonNull(name, "name");
        this.summary = summary;
        this.description = description;
        this.schema = requireNonNull(schema, "schema");
        this.required = required;
        this.deprecated = deprecated;
        this.examples = examples;
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

    /**
     * Returns the {@link JsonSchema} which describes the content.
     */
    @JsonProperty
    public JsonSchema schema() {
        return schema;
    }

    /**
     * Returns whether the content is required. A {@link Method} lists its required parameters
     * before its optional ones.
     */
    @JsonProperty("required")
    @JsonInclude(Include.NON_DEFAULT)
    public boolean isRequired() {
        return required;
    }

    @JsonProperty("deprecated")
    @JsonInclude(Include.NON_DEFAULT)
    public boolean isDeprecated() {
        return deprecated;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<ExamplePairing> examples() {
        return examples;
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
        if (!(o instanceof ContentDescriptor)) {
            return false;
        }
        final ContentDescriptor that = (ContentDescriptor) o;
        return name.equals(that.name) &&
               Objects.equals(summary, that.summary) &&
               Objects.equals(description, that.description) &&
               schema.equals(that.schema) &&
               required == that.required &&
               deprecated == that.deprecated &&
               examples.equals(that.examples) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, summary, description, schema, required, deprecated, examples, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("summary", summary)
                          .add("description", description)
                          .add("schema", schema)
                          .add("required", required)
                          .add("deprecated", deprecated)
                          .add("examples", examples.isEmpty() ? null : examples)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
