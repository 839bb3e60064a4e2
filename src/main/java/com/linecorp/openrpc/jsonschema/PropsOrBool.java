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

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.MoreObjects;

/**
 * The value of {@code additionalProperties} or {@code additionalItems}, which is either a boolean
 * or a {@link Schema}.
 *
 * <p>When a {@link Schema} is held, {@link #allows()} is always {@code true}. It is kept for display
 * purposes only.
 */
@JsonSerialize(using = PropsOrBoolJsonSerializer.class)
@JsonDeserialize(using = PropsOrBoolJsonDeserializer.class)
public final class PropsOrBool {

    private static final PropsOrBool ALLOW_ALL = new PropsOrBool(true, null);
    private static final PropsOrBool DENY_ALL = new PropsOrBool(false, null);

    /**
     * Returns the {@link PropsOrBool} that allows anything, which is also what an absent
     * {@code additionalProperties} or {@code additionalItems} means.
     */
    public static PropsOrBool allowAll() {
        return ALLOW_ALL;
    }

    /**
     * Returns the {@link PropsOrBool} for the specified boolean.
     */
    public static PropsOrBool of(boolean allows) {
        return allows ? ALLOW_ALL : DENY_ALL;
    }

    /**
     * Returns a new {@link PropsOrBool} holding the specified {@link Schema}.
     */
    public static PropsOrBool of(Schema schema) {
        return new PropsOrBool(true, requireNonNull(schema, "schema"));
    }

    private final boolean allows;
    @Nullable
    private final Schema schema;

    private PropsOrBool(boolean allows, @Nullable Schema schema) {
        this.allows = allows;
        this.schema = schema;
    }

    public boolean allows() {
        return allows;
    }

    /**
     * Returns the {@link Schema}, or {@code null} if this holds a boolean.
     */
    @Nullable
    public Schema schema() {
        return schema;
    }

    public boolean hasSchema() {
        return schema != null;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropsOrBool)) {
            return false;
        }
        final PropsOrBool that = (PropsOrBool) o;
        return allows == that.allows && Objects.equals(schema, that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allows, schema);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("allows", allows)
                          .add("schema", schema)
                          .toString();
    }
}
