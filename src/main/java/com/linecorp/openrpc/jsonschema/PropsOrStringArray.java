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
package com.linecorp.openrpc.jsonschema;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A value of {@code dependencies}, which is either a {@link Schema} the instance must also match
 * (a schema dependency) or the names of the properties that must also be present
 * (a property dependency).
 *
 * <p>Exactly one of {@link #schema()} and {@link #properties()} is non-{@code null}.
 */
@JsonSerialize(using = PropsOrStringArrayJsonSerializer.class)
@JsonDeserialize(using = PropsOrStringArrayJsonDeserializer.class)
public final class PropsOrStringArray {

    /**
     * Returns a new schema dependency.
     */
    public static PropsOrStringArray of(Schema schema) {
        return new PropsOrStringArray(requireNonNull(schema, "schema"), null);
    }

    /**
     * Returns a new property dependency.
     */
    public static PropsOrStringArray ofProperties(String... properties) {
        return ofProperties(ImmutableList.copyOf(requireNonNull(properties, "properties")));
    }

    /**
     * Returns a new property dependency.
     */
    public static PropsOrStringArray ofProperties(Iterable<String> properties) {
        return new PropsOrStringArray(null, ImmutableList.copyOf(requireNonNull(properties, "properties")));
    }

    @Nullable
    private final Schema schema;
    @Nullable
    private final List<String> properties;

    private PropsOrStringArray(@Nullable Schema schema, @Nullable List<String> properties) {
        this.schema = schema;
        this.properties = properties;
    }

    @Nullable
    public Schema schema() {
        return schema;
    }

    @Nullable
    public List<String> properties() {
        return properties;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropsOrStringArray)) {
            return false;
        }
        final PropsOrStringArray that = (PropsOrStringArray) o;
        return Objects.equals(schema, that.schema) && Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, properties);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("schema", schema)
                          .add("properties", properties)
                          .toString();
    }
}
