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

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.MoreObjects;

/**
 * A position of an {@link OpenRpcDocument} which holds either a value of type {@code T} or
 * a {@link Reference} to a value defined elsewhere, usually under {@link OpenRpcDocument#components()}.
 *
 * <p>A JSON object with a {@code $ref} field is decoded as a {@link Reference} and is never resolved.
 * Any other JSON value is decoded as {@code T}.
 *
 * @param <T> the type of the value
 */
@JsonSerialize(using = ReferenceOrJsonSerializer.class)
public final class ReferenceOr<T> {

    /**
     * Returns a new {@link ReferenceOr} holding the specified value.
     */
    public static <T> ReferenceOr<T> of(T value) {
        return new ReferenceOr<>(requireNonNull(value, "value"), null);
    }

    /**
     * Returns a new {@link ReferenceOr} holding the specified {@link Reference}.
     */
    public static <T> ReferenceOr<T> ofReference(Reference reference) {
        return new ReferenceOr<>(null, requireNonNull(reference, "reference"));
    }

    /**
     * Returns a new {@link ReferenceOr} holding a {@link Reference} to the specified location,
     * such as {@code "#/components/contentDescriptors/PetId"}.
     */
    public static <T> ReferenceOr<T> ofReference(String ref) {
        return ofReference(Reference.of(ref));
    }

    @Nullable
    private final T value;
    @Nullable
    private final Reference reference;

    private ReferenceOr(@Nullable T value, @Nullable Reference reference) {
        this.value = value;
        this.reference = reference;
    }

    public boolean isReference() {
        return reference != null;
    }

    /**
     * Returns the value, or {@code null} if this holds a {@link Reference}.
     */
    @Nullable
    public T value() {
        return value;
    }

    /**
     * Returns the {@link Reference}, or {@code null} if this holds a value.
     */
    @Nullable
    public Reference reference() {
        return reference;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReferenceOr)) {
            return false;
        }
        final ReferenceOr<?> that = (ReferenceOr<?>) o;
        return Objects.equals(value, that.value) && Objects.equals(reference, that.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reference);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("value", value)
                          .add("reference", reference)
                          .toString();
    }
}
