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
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.MoreObjects;

/**
 * A conditional {@link ContentDescriptor}, which specifies that the content must match the nested
 * {@link ContentDescriptor}. It is used only in place of a {@link ContentDescriptor}.
 */
@JsonDeserialize(using = OneOfJsonDeserializer.class)
public final class OneOf {

    /**
     * Returns a new {@link OneOf} with the specified {@link ContentDescriptor}.
     */
    public static OneOf of(ContentDescriptor contentDescriptor) {
        return new OneOf(requireNonNull(contentDescriptor, "contentDescriptor"));
    }

    private final ContentDescriptor contentDescriptor;

    private OneOf(ContentDescriptor contentDescriptor) {
        this.contentDescriptor = contentDescriptor;
    }

    @JsonProperty("oneOf")
    public ContentDescriptor contentDescriptor() {
        return contentDescriptor;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof OneOf && contentDescriptor.equals(((OneOf) o).contentDescriptor);
    }

    @Override
    public int hashCode() {
        return contentDescriptor.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("oneOf", contentDescriptor).toString();
    }
}
