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
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import com.linecorp.openrpc.jsonschema.Schema;

/**
 * A JSON-Schema {@link Schema} in an OpenRPC document, which may carry extension fields in addition to
 * the keywords of the {@link Schema}. Both are written at the same level.
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(using = JsonSchemaJsonDeserializer.class)
public final class JsonSchema {

    /**
     * Returns a new {@link JsonSchema} which wraps the specified {@link Schema}.
     */
    public static JsonSchema of(Schema schema) {
        return new JsonSchema(schema, ImmutableMap.of());
    }

    /**
     * Returns a new {@link JsonSchema} which wraps the specified {@link Schema} with the specified
     * extension fields.
     */
    public static JsonSchema of(Schema schema, Map<String, ? extends JsonNode> extensions) {
        return new JsonSchema(schema, Extensions.copyOf(extensions));
    }

    private final Schema schema;
    private final Map<String, JsonNode> extensions;

    private JsonSchema(Schema schema, Map<String, JsonNode> extensions) {
        this.schema = requireNonNull(schema, "schema");
        this.extensions = extensions;
    }

    @JsonUnwrapped
    public Schema schema() {
        return schema;
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
        if (!(o instanceof JsonSchema)) {
            return false;
        }
        final JsonSchema that = (JsonSchema) o;
        return schema.equals(that.schema) && extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("schema", schema)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
