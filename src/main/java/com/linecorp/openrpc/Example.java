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
 * An example which is intended to match the {@link JsonSchema} of a {@link ContentDescriptor}.
 * An {@link Example} has either an embedded {@link #value()} or an {@link #externalValue()},
 * never both.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "summary", "description", "value", "externalValue" })
@JsonDeserialize(using = ExampleJsonDeserializer.class)
public final class Example {

    /**
     * Returns a new {@link Example} with the specified embedded value.
     */
    public static Example ofValue(JsonNode value) {
        return builder().value(value).build();
    }

    /**
     * Returns a new {@link Example} whose value is found at the specified URL.
     */
    public static Example ofExternalValue(String externalValue) {
        return builder().externalValue(externalValue).build();
    }

    /**
     * Returns a new {@link ExampleBuilder}.
     */
    public static ExampleBuilder builder() {
        return new ExampleBuilder();
    }

    @Nullable
    private final String name;
    @Nullable
    private final String summary;
    @Nullable
    private final String description;
    @Nullable
    private final JsonNode value;
    @Nullable
    private final String externalValue;
    private final Map<String, JsonNode> extensions;

    Example(@Nullable String name, @Nullable String summary, @Nullable String description,
            @Nullable JsonNode value, @Nullable String externalValue, Map<String, JsonNode> extensions) {
        this.name = name;
        this.summary = summary;
        this.description = description;
        this.value = value;
        this.externalValue = externalValue;
        this.extensions = extensions;
    }

    @Nullable
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
     * Returns the embedded value, or {@code null} if absent. An embedded {@code null} is returned as
     * a {@link com.fasterxml.jackson.databind.node.NullNode}.
     */
    @Nullable
    @JsonProperty
    public JsonNode value() {
        return value;
    }

    /**
     * Returns the URL of the value, or {@code null} if the value is embedded.
     */
    @Nullable
    @JsonProperty
    public String externalValue() {
        return externalValue;
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
        if (!(o instanceof Example)) {
            return false;
        }
        final Example that = (Example) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(summary, that.summary) &&
               Objects.equals(description, that.description) &&
               Objects.equals(value, that.value) &&
               Objects.equals(externalValue, that.externalValue) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, summary, description, value, externalValue, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("summary", summary)
                          .add("description", description)
                          .add("value", value)
                          .add("externalValue", externalValue)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
