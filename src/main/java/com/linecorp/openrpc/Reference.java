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

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.MoreObjects;

/**
 * A pointer to another object in the same or in an external document, such as
 * {@code {"$ref": "#/components/schemas/Pet"}}. A {@link Reference} is never resolved while decoding;
 * use {@link #isReference(JsonNode)} to find one and resolve it against
 * {@link OpenRpcDocument#components()}.
 */
@JsonDeserialize(using = ReferenceJsonDeserializer.class)
public final class Reference {

    private static final String REF = "$ref";

    /**
     * Returns a new {@link Reference} which points to the specified location.
     */
    public static Reference of(String ref) {
        return new Reference(requireNonNull(ref, "ref"));
    }

    /**
     * Returns whether the specified JSON value is a reference, i.e. an object whose only field is
     * a textual {@code $ref}.
     */
    public static boolean isReference(JsonNode node) {
        requireNonNull(node, "node");
        if (!node.isObject() || node.size() != 1) {
            return false;
        }
        final JsonNode ref = node.get(REF);
        return ref != null && ref.isTextual();
    }

    private final String ref;

    private Reference(String ref) {
        this.ref = ref;
    }

    @JsonProperty(REF)
    public String ref() {
        return ref;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Reference && ref.equals(((Reference) o).ref);
    }

    @Override
    public int hashCode() {
        return ref.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("ref", ref).toString();
    }
}
