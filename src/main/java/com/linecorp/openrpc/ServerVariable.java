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

/**
 * A variable of a {@link Server} URL template.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "enum", "default", "description" })
@JsonDeserialize(using = ServerVariableJsonDeserializer.class)
public final class ServerVariable {

    /**
     * Returns a new {@link ServerVariable} with the specified default value.
     */
    public static ServerVariable of(String defaultValue) {
        return builder(defaultValue).build();
    }

    /**
     * Returns a new {@link ServerVariableBuilder}.
     */
    public static ServerVariableBuilder builder(String defaultValue) {
        return new ServerVariableBuilder(defaultValue);
    }

    private final List<String> enumValues;
    private final String defaultValue;
    @Nullable
    private final String description;
    private final Map<String, JsonNode> extensions;

    ServerVariable(List<String> enumValues, String defaultValue, @Nullable String description,
                   Map<String, JsonNode> extensions) {
        this.enumValues = enumValues;
        this.defaultValue = requireNonNull(defaultValue, "defaultValue");
        this.description = description;
        this.extensions = extensions;
    }

    /**
     * Returns the values the variable is limited to, or an empty list if it is not limited.
     */
    @JsonProperty("enum")
    @JsonInclude(Include.NON_EMPTY)
    public List<String> enumValues() {
        return enumValues;
    }

    /**
     * Returns the value to substitute when no other value is supplied.
     */
    @JsonProperty("default")
    public String defaultValue() {
        return defaultValue;
    }

    @Nullable
    @JsonProperty
    public String description() {
        return description;
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
        if (!(o instanceof ServerVariable)) {
            return false;
        }
        final ServerVariable that = (ServerVariable) o;
        return enumValues.equals(that.enumValues) &&
               defaultValue.equals(that.defaultValue) &&
               Objects.equals(description, that.description) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enumValues, defaultValue, description, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("enumValues", enumValues.isEmpty() ? null : enumValues)
                          .add("defaultValue", defaultValue)
                          .add("description", description)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
