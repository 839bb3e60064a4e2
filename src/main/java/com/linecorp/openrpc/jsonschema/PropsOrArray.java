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
 * The value of {@code items}, which is either a single {@link Schema} that every element must match
 * or an array of {@link Schema}s matched by position.
 *
 * <p>Exactly one of {@link #schema()} and {@link #schemas()} is non-{@code null}.
 */
@JsonSerialize(using = PropsOrArrayJsonSerializer.class)
@JsonDeserialize(using = PropsOrArrayJsonDeserializer.class)
public final class PropsOrArray {

    /**
     * Returns a new {@link PropsOrArray} holding a single {@link Schema}.
     */
    public static PropsOrArray of(Schema schema) {
        return new PropsOrArray(requireNonNull(schema, "schema"), null);
    }

    /**
     * Returns a new {@link PropsOrArray} holding an array of {@link Schema}s.
     */
    public static PropsOrArray ofArray(Schema... schemas) {
        return ofArray(ImmutableList.copyOf(requireNonNull(schemas, "schemas")));
    }

    /**
     * Returns a new {@link PropsOrArray} holding an array of {@link Schema}s.
     */
    public static PropsOrArray ofArray(Iterable<Schema> schemas) {
        return new PropsOrArray(null, ImmutableList.copyOf(requireNonNull(schemas, "schemas")));
    }

    @Nullable
    private final Schema schema;
    @Nullable
    private final List<Schema> schemas;

    private PropsOrArray(@Nullable Schema schema, @Nullable List<Schema> schemas) {
        this.schema = schema;
        this.schemas = schemas;
    }

    /**
     * Returns whether this holds an array of {@link Schema}s.
     */
    public boolean isArray() {
        return schemas != null;
    }

    /**
     * Returns the single {@link Schema}, or {@code null} if this holds an array.
     */
    @Nullable
    public Schema schema() {
        return schema;
    }

    /**
     * Returns the array of {@link Schema}s, or {@code null} if this holds a single {@link Schema}.
     */
    @Nullable
    public List<Schema> schemas() {
        return schemas;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropsOrArray)) {
            return false;
        }
        final PropsOrArray that = (PropsOrArray) o;
        return Objects.equals(schema, that.schema) && Objects.equals(schemas, that.schemas);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, schemas);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("schema", schema)
                          .add("schemas", schemas)
                          .toString();
    }
}
