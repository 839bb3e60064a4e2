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
package com.linecorp.openrpc.internal;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map.Entry;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.linecorp.openrpc.InvalidShapeException;
import com.linecorp.openrpc.MissingFieldException;
import com.linecorp.openrpc.Reference;
import com.linecorp.openrpc.ReferenceOr;

/**
 * Typed access to the fields of a JSON object being decoded by an {@link AbstractObjectJsonDeserializer}.
 *
 * <p>An absent field and a field whose value is {@code null} are treated alike, except by
 * {@link #raw(String)} which keeps a JSON {@code null} as is. Every error raised here or by a nested
 * deserializer carries the path of the offending field.
 */
public final class ObjectFields {

    private static final String REF = "$ref";

    private final JsonParser parser;
    private final Class<?> type;
    private final DeserializationContext ctx;
    private final ObjectNode node;
    private final ImmutableMap<String, JsonNode> extensions;

    ObjectFields(JsonParser parser, Class<?> type, DeserializationContext ctx, ObjectNode node,
                 ImmutableMap<String, JsonNode> extensions) {
        this.parser = parser;
        this.type = type;
        this.ctx = ctx;
        this.node = node;
        this.extensions = extensions;
    }

    /**
     * Returns whether the specified field is present with a non-{@code null} value.
     */
    public boolean contains(String name) {
        return get(name) != null;
    }

    /**
     * Returns the {@code x-*} fields of the object in the order they appeared.
     */
    public ImmutableMap<String, JsonNode> extensions() {
        return extensions;
    }

    @Nullable
    public String string(String name) throws JsonMappingException {
        final JsonNode value = get(name);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            throw invalidShape(name, "a string", value);
        }
        return value.textValue();
    }

    public String requiredString(String name) throws JsonMappingException {
        final String value = string(name);
        if (value == null) {
            throw missing(name);
        }
        return value;
    }

    public boolean bool(String name) throws JsonMappingException {
        final JsonNode value = get(name);
        if (value == null) {
            return false;
        }
        if (!value.isBoolean()) {
            throw invalidShape(name, "a boolean", value);
        }
        return value.booleanValue();
    }

    @Nullable
    public Double number(String name) throws JsonMappingException {
        final JsonNode value = get(name);
        if (value == null) {
            return null;
        }
        if (!value.isNumber()) {
            throw invalidShape(name, "a number", value);
        }
        final double d = value.doubleValue();
        if (!Double.isFinite(d)) {
            // Out of the range of a double, e.g. 1e400.
            throw invalid(name, '\'' + name + "' must be a finite number but was " + value.asText());
        }
        return d;
    }

    @Nullable
    public Long integer(String name) throws JsonMappingException {
        final JsonNode value = get(name);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw invalidShape(name, "an integer", value);
        }
        return value.longValue();
    }

    public long requiredInteger(String name) throws JsonMappingException {
        final Long value = integer(name);
        if (value == null) {
            throw missing(name);
        }
        return value;
    }

    /**
     * Returns the value of the specified field as an opaque JSON value. Unlike the other accessors,
     * a JSON {@code null} is returned as a {@link com.fasterxml.jackson.databind.node.NullNode}.
     */
    @Nullable
    public JsonNode raw(String name) {
        return node.get(name);
    }

    public <T> @Nullable T value(String name, Class<T> valueType) throws IOException {
        final JsonNode value = get(name);
        if (value == null) {
            return null;
        }
        try {
            return ctx.readTreeAsValue(value, valueType);
        } catch (JsonMappingException e) {
            e.prependPath(type, name);
            throw e;
        }
    }

    public <T> T requiredValue(String name, Class<T> valueType) throws IOException {
        final T value = value(name, valueType);
        if (value == null) {
            throw missing(name);
        }
        return value;
    }

    /**
     * Returns the value of the specified field as a {@link ReferenceOr}. An object with a {@code $ref}
     * field is read as a {@link Reference}, anything else as {@code valueType}.
     */
    public <T> @Nullable ReferenceOr<T> referenceOr(String name, Class<T> valueType) throws IOException {
        final JsonNode value = get(name);
        if (value == null) {
            return null;
        }
        try {
            return readReferenceOr(value, valueType);
        } catch (JsonMappingException e) {
            e.prependPath(type, name);
            throw e;
        }
    }

    public <T> ReferenceOr<T> requiredReferenceOr(String name, Class<T> valueType) throws IOException {
        final ReferenceOr<T> value = referenceOr(name, valueType);
        if (value == null) {
            throw missing(name);
        }
        return value;
    }

    /**
     * Returns the elements of the specified array field, or an empty list if the field is absent.
     */
    public <T> ImmutableList<T> list(String name, Class<T> elementType) throws IOException {
        final JsonNode value = get(name);
        if (value == null) {
            return ImmutableList.of();
        }
        return readList(name, value, element -> readElement(element, elementType));
    }

    public <T> ImmutableList<T> requiredList(String name, Class<T> elementType) throws IOException {
        final JsonNode value = get(name);
        if (value == null) {
            throw missing(name);
        }
        return readList(name, value, element -> readElement(element, elementType));
    }

    /**
     * Returns the elements of the specified array field as {@link ReferenceOr}s, or an empty list if
     * the field is absent.
     */
    public <T> ImmutableList<ReferenceOr<T>> referenceOrList(String name, Class<T> elementType)
            throws IOException {
        final JsonNode value = get(name);
        if (value == null) {
            return ImmutableList.of();
        }
        return readList(name, value, element -> readReferenceOr(element, elementType));
    }

    public <T> ImmutableList<ReferenceOr<T>> requiredReferenceOrList(String name, Class<T> elementType)
            throws IOException {
        final JsonNode value = get(name);
        if (value == null) {
            throw missing(name);
        }
        return readList(name, value, element -> readReferenceOr(element, elementType));
    }

    public ImmutableList<String> stringList(String name) throws JsonMappingException {
        final JsonNode value = get(name);
        if (value == null) {
            return ImmutableList.of();
        }
        if (!value.isArray()) {
            throw invalidShape(name, "an array of strings", value);
        }
        final ImmutableList.Builder<String> builder = ImmutableList.builderWithExpectedSize(value.size());
        for (int i = 0; i < value.size(); i++) {
            final JsonNode element = value.get(i);
            if (!element.isTextual()) {
                final JsonMappingException e = invalidShape(null, "a string", element);
                e.prependPath(value, i);
                e.prependPath(type, name);
                throw e;
            }
            builder.add(element.textValue());
        }
        return builder.build();
    }

    /**
     * Returns the elements of the specified array field as opaque JSON values. {@code null} elements
     * are kept.
     */
    public ImmutableList<JsonNode> rawList(String name) throws JsonMappingException {
        final JsonNode value = get(name);
        if (value == null) {
            return ImmutableList.of();
        }
        if (!value.isArray()) {
            throw invalidShape(name, "an array", value);
        }
        return ImmutableList.copyOf(value);
    }

    /**
     * Returns the entries of the specified object field in their original order, or an empty map
     * if the field is absent.
     */
    public <T> ImmutableMap<String, T> map(String name, Class<T> valueType) throws IOException {
        final JsonNode value = get(name);
        if (value == null) {
            return ImmutableMap.of();
        }
        if (!value.isObject()) {
            throw invalidShape(name, "an object", value);
        }

        final ImmutableMap.Builder<String, T> builder = ImmutableMap.builderWithExpectedSize(value.size());
        for (final Iterator<Entry<String, JsonNode>> i = value.fields(); i.hasNext();) {
            final Entry<String, JsonNode> e = i.next();
            final String key = e.getKey();
            try {
                builder.put(key, readElement(e.getValue(), valueType));
            } catch (JsonMappingException ex) {
                ex.prependPath(value, key);
                ex.prependPath(type, name);
                throw ex;
            }
        }
        return builder.build();
    }

    public ImmutableMap<String, String> stringMap(String name) throws JsonMappingException {
        final JsonNode value = get(name);
        if (value == null) {
            return ImmutableMap.of();
        }
        if (!value.isObject()) {
            throw invalidShape(name, "an object", value);
        }

        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builderWithExpectedSize(value.size());
        for (final Iterator<Entry<String, JsonNode>> i = value.fields(); i.hasNext();) {
            final Entry<String, JsonNode> e = i.next();
            if (!e.getValue().isTextual()) {
                final JsonMappingException ex = invalidShape(null, "a string", e.getValue());
                ex.prependPath(value, e.getKey());
                ex.prependPath(type, name);
                throw ex;
            }
            builder.put(e.getKey(), e.getValue().textValue());
        }
        return builder.build();
    }

    /**
     * Returns a new {@link InvalidShapeException} for the specified field, with the path of the field.
     */
    public JsonMappingException invalid(String name, String message) {
        final InvalidShapeException e = InvalidShapeException.of(parser, type, message);
        e.prependPath(type, name);
        return e;
    }

    private <T> ImmutableList<T> readList(String name, JsonNode value, ElementReader<T> reader)
            throws IOException {
        if (!value.isArray()) {
            throw invalidShape(name, "an array", value);
        }

        final ImmutableList.Builder<T> builder = ImmutableList.builderWithExpectedSize(value.size());
        for (int i = 0; i < value.size(); i++) {
            try {
                builder.add(reader.read(value.get(i)));
            } catch (JsonMappingException e) {
                e.prependPath(value, i);
                e.prependPath(type, name);
                throw e;
            }
        }
        return builder.build();
    }

    private <T> T readElement(JsonNode element, Class<T> elementType) throws IOException {
        if (element.isNull()) {
            throw InvalidShapeException.of(parser, elementType,
                                           elementType.getSimpleName() + " must not be null");
        }
        return ctx.readTreeAsValue(element, elementType);
    }

    private <T> ReferenceOr<T> readReferenceOr(JsonNode element, Class<T> valueType) throws IOException {
        if (element.isObject() && element.has(REF)) {
            return ReferenceOr.ofReference(ctx.readTreeAsValue(element, Reference.class));
        }
        return ReferenceOr.of(readElement(element, valueType));
    }

    @Nullable
    private JsonNode get(String name) {
        final JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return value;
    }

    private JsonMappingException invalidShape(@Nullable String name, String expected, JsonNode actual) {
        final InvalidShapeException e = InvalidShapeException.of(
                parser, type, (name != null ? '\'' + name + "' must be " : "must be ") +
                              expected + " but was " + describe(actual));
        if (name != null) {
            e.prependPath(type, name);
        }
        return e;
    }

    private MissingFieldException missing(String name) {
        final MissingFieldException e = MissingFieldException.of(parser, type, name);
        e.prependPath(type, name);
        return e;
    }

    /**
     * Returns the name of the type of the specified JSON value, such as {@code "array"}.
     */
    public static String describe(JsonNode node) {
        return Ascii.toLowerCase(node.getNodeType().name());
    }

    @FunctionalInterface
    private interface ElementReader<T> {
        T read(JsonNode element) throws IOException;
    }
}
