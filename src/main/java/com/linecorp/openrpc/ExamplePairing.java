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

/**
 * A set of example parameters and the result which a {@link Method} is expected to return for them.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "description", "summary", "params", "result" })
@JsonDeserialize(using = ExamplePairingJsonDeserializer.class)
public final class ExamplePairing {

    /**
     * Returns a new {@link ExamplePairingBuilder}.
     */
    public static ExamplePairingBuilder builder() {
        return new ExamplePairingBuilder();
    }

    @Nullable
    private final String name;
    @Nullable
    private final String description;
    @Nullable
    private final String summary;
    private final List<ReferenceOr<Example>> params;
    @Nullable
    private final ReferenceOr<Example> result;
    private final Map<String, JsonNode> extensions;

    ExamplePairing(@Nullable String name, @Nullable String description, @Nullable String summary,
                   List<ReferenceOr<Example>> params, @Nullable ReferenceOr<Example> result,
                   Map<String, JsonNode> extensions) {
        this.name = name;
        this.description = description;
        this.summary = summary;
        this.params = params;
        this.result = result;
        this.extensions = extensions;
    }

    @Nullable
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
     * Returns the example parameters, in the order of {@link Method#params()}.
     */
    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<ReferenceOr<Example>> params() {
        return params;
    }

    @Nullable
    @JsonProperty
    public ReferenceOr<Example> result() {
        return result;
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
        if (!(o instanceof ExamplePairing)) {
            return false;
        }
        final ExamplePairing that = (ExamplePairing) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(summary, that.summary) &&
               params.equals(that.params) &&
               Objects.equals(result, that.result) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, summary, params, result, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("description", description)
                          .add("summary", summary)
                          .add("params", params.isEmpty() ? null : params)
                          .add("result", result)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
