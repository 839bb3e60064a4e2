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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

/**
 * Builds a new {@link Schema}.
 */
public final class SchemaBuilder {

    @Nullable
    String id;
    @Nullable
    String schemaUrl;
    @Nullable
    String ref;
    @Nullable
    String title;
    @Nullable
    String description;
    @Nullable
    String type;
    boolean nullable;
    @Nullable
    String format;
    @Nullable
    String pattern;
    @Nullable
    JsonNode defaultValue;
    @Nullable
    Double maximum;
    boolean exclusiveMaximum;
    @Nullable
    Double minimum;
    boolean exclusiveMinimum;
    @Nullable
    Double multipleOf;
    @Nullable
    Long maxLength;
    @Nullable
    Long minLength;
    @Nullable
    Long maxItems;
    @Nullable
    Long minItems;
    boolean uniqueItems;
    @Nullable
    Long maxProperties;
    @Nullable
    Long minProperties;
    final ImmutableList.Builder<JsonNode> enumValues = ImmutableList.builder();
    final ImmutableList.Builder<String> required = ImmutableList.builder();
    @Nullable
    PropsOrArray items;
    final ImmutableList.Builder<Schema> allOf = ImmutableList.builder();
    final ImmutableList.Builder<Schema> oneOf = ImmutableList.builder();
    final ImmutableList.Builder<Schema> anyOf = ImmutableList.builder();
    @Nullable
    Schema not;
    final Map<String, Schema> properties = new LinkedHashMap<>();
    @Nullable
    PropsOrBool additionalProperties;
    final Map<String, Schema> patternProperties = new LinkedHashMap<>();
    final Map<String, PropsOrStringArray> dependencies = new LinkedHashMap<>();
    @Nullable
    PropsOrBool additionalItems;
    final Map<String, Schema> definitions = new LinkedHashMap<>();
    @Nullable
    SchemaExternalDocs externalDocs;
    @Nullable
    JsonNode example;

    SchemaBuilder() {}

    SchemaBuilder(Schema schema) {
        id = schema.id();
        schemaUrl = schema.schemaUrl();
        ref = schema.ref();
        title = schema.title();
        description = schema.description();
        type = schema.type();
        nullable = schema.isNullable();
        format = schema.format();
        pattern = schema.pattern();
        defaultValue = schema.defaultValue();
        maximum = schema.maximum();
        exclusiveMaximum = schema.isExclusiveMaximum();
        minimum = schema.minimum();
        exclusiveMinimum = schema.isExclusiveMinimum();
        multipleOf = schema.multipleOf();
        maxLength = schema.maxLength();
        minLength = schema.minLength();
        maxItems = schema.maxItems();
        minItems = schema.minItems();
        uniqueItems = schema.isUniqueItems();
        maxProperties = schema.maxProperties();
        minProperties = schema.minProperties();
        enumValues.addAll(schema.enumValues());
        required.addAll(schema.required());
        items = schema.items();
        allOf.addAll(schema.allOf());
        oneOf.addAll(schema.oneOf());
        anyOf.addAll(schema.anyOf());
        not = schema.not();
        properties.putAll(schema.properties());
        additionalProperties = schema.rawAdditionalProperties();
        patternProperties.putAll(schema.patternProperties());
        dependencies.putAll(schema.dependencies());
        additionalItems = schema.rawAdditionalItems();
        definitions.putAll(schema.definitions());
        externalDocs = schema.externalDocs();
        example = schema.example();
    }

    public SchemaBuilder id(String id) {
        this.id = requireNonNull(id, "id");
        return this;
    }

    /**
     * Sets the {@code $schema} URL.
     */
    public SchemaBuilder schemaUrl(String schemaUrl) {
        this.schemaUrl = requireNonNull(schemaUrl, "schemaUrl");
        return this;
    }

    /**
     * Sets the {@code $ref} pointer.
     */
    public SchemaBuilder ref(String ref) {
        this.ref = requireNonNull(ref, "ref");
        return this;
    }

    public SchemaBuilder title(String title) {
        this.title = requireNonNull(title, "title");
        return this;
    }

    public SchemaBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    public SchemaBuilder type(String type) {
        this.type = requireNonNull(type, "type");
        return this;
    }

    public SchemaBuilder nullable(boolean nullable) {
        this.nullable = nullable;
        return this;
    }

    public SchemaBuilder format(String format) {
        this.format = requireNonNull(format, "format");
        return this;
    }

    public SchemaBuilder pattern(String pattern) {
        this.pattern = requireNonNull(pattern, "pattern");
        return this;
    }

    /**
     * Sets the {@code default} value. Use {@link com.fasterxml.jackson.databind.node.NullNode} for
     * a {@code null} default.
     */
    public SchemaBuilder defaultValue(JsonNode defaultValue) {
        this.defaultValue = requireNonNull(defaultValue, "defaultValue");
        return this;
    }

    public SchemaBuilder maximum(double maximum) {
        checkArgument(Double.isFinite(maximum), "maximum: %s (expected: a finite number)", maximum);
        this.maximum = maximum;
        return this;
    }

    public SchemaBuilder exclusiveMaximum(boolean exclusiveMaximum) {
        this.exclusiveMaximum = exclusiveMaximum;
        return this;
    }

    public SchemaBuilder minimum(double minimum) {
        checkArgument(Double.isFinite(minimum), "minimum: %s (expected: a finite number)", minimum);
        this.minimum = minimum;
        return this;
    }

    public SchemaBuilder exclusiveMinimum(boolean exclusiveMinimum) {
        this.exclusiveMinimum = exclusiveMinimum;
        return this;
    }

    public SchemaBuilder multipleOf(double multipleOf) {
        checkArgument(Double.isFinite(multipleOf), "multipleOf: %s (expected: a finite number)", multipleOf);
        this.multipleOf = multipleOf;
        return this;
    }

    public SchemaBuilder maxLength(long maxLength) {
        this.maxLength = maxLength;
        return this;
    }

    public SchemaBuilder minLength(long minLength) {
        this.minLength = minLength;
        return this;
    }

    public SchemaBuilder maxItems(long maxItems) {
        this.maxItems = maxItems;
        return this;
    }

    public SchemaBuilder minItems(long minItems) {
        this.minItems = minItems;
        return this;
    }

    public SchemaBuilder uniqueItems(boolean uniqueItems) {
        this.uniqueItems = uniqueItems;
        return this;
    }

    public SchemaBuilder maxProperties(long maxProperties) {
        this.maxProperties = maxProperties;
        return this;
    }

    public SchemaBuilder minProperties(long minProperties) {
        this.minProperties = minProperties;
        return this;
    }

    /**
     * Adds the specified values to {@code enum}.
     */
    public SchemaBuilder enumValues(JsonNode... enumValues) {
        return enumValues(ImmutableList.copyOf(requireNonNull(enumValues, "enumValues")));
    }

    /**
     * Adds the specified values to {@code enum}.
     */
    public SchemaBuilder enumValues(List<? extends JsonNode> enumValues) {
        this.enumValues.addAll(requireNonNull(enumValues, "enumValues"));
        return this;
    }

    /**
     * Adds the specified property names to {@code required}.
     */
    public SchemaBuilder required(String... required) {
        return required(ImmutableList.copyOf(requireNonNull(required, "required")));
    }

    /**
     * Adds the specified property names to {@code required}.
     */
    public SchemaBuilder required(Iterable<String> required) {
        this.required.addAll(requireNonNull(required, "required"));
        return this;
    }

    public SchemaBuilder items(PropsOrArray items) {
        this.items = requireNonNull(items, "items");
        return this;
    }

    /**
     * Sets {@code items} to the specified single schema.
     */
    public SchemaBuilder items(Schema items) {
        return items(PropsOrArray.of(items));
    }

    public SchemaBuilder allOf(Iterable<Schema> allOf) {
        this.allOf.addAll(requireNonNull(allOf, "allOf"));
        return this;
    }

    public SchemaBuilder allOf(Schema... allOf) {
        return allOf(ImmutableList.copyOf(requireNonNull(allOf, "allOf")));
    }

    public SchemaBuilder oneOf(Iterable<Schema> oneOf) {
        this.oneOf.addAll(requireNonNull(oneOf, "oneOf"));
        return this;
    }

    public SchemaBuilder oneOf(Schema... oneOf) {
        return oneOf(ImmutableList.copyOf(requireNonNull(oneOf, "oneOf")));
    }

    public SchemaBuilder anyOf(Iterable<Schema> anyOf) {
        this.anyOf.addAll(requireNonNull(anyOf, "anyOf"));
        return this;
    }

    public SchemaBuilder anyOf(Schema... anyOf) {
        return anyOf(ImmutableList.copyOf(requireNonNull(anyOf, "anyOf")));
    }

    public SchemaBuilder not(Schema not) {
        this.not = requireNonNull(not, "not");
        return this;
    }

    /**
     * Adds a property with the specified name and {@link Schema}.
     */
    public SchemaBuilder property(String name, Schema schema) {
        properties.put(requireNonNull(name, "name"), requireNonNull(schema, "schema"));
        return this;
    }

    public SchemaBuilder properties(Map<String, Schema> properties) {
        requireNonNull(properties, "properties").forEach(this::property);
        return this;
    }

    public SchemaBuilder additionalProperties(PropsOrBool additionalProperties) {
        this.additionalProperties = requireNonNull(additionalProperties, "additionalProperties");
        return this;
    }

    public SchemaBuilder additionalProperties(boolean allows) {
        return additionalProperties(PropsOrBool.of(allows));
    }

    public SchemaBuilder additionalProperties(Schema schema) {
        return additionalProperties(PropsOrBool.of(schema));
    }

    /**
     * Adds a property pattern with the specified regular expression and {@link Schema}.
     */
    public SchemaBuilder patternProperty(String pattern, Schema schema) {
        patternProperties.put(requireNonNull(pattern, "pattern"), requireNonNull(schema, "schema"));
        return this;
    }

    public SchemaBuilder patternProperties(Map<String, Schema> patternProperties) {
        requireNonNull(patternProperties, "patternProperties").forEach(this::patternProperty);
        return this;
    }

    /**
     * Adds a dependency of the specified property.
     */
    public SchemaBuilder dependency(String property, PropsOrStringArray dependency) {
        dependencies.put(requireNonNull(property, "property"), requireNonNull(dependency, "dependency"));
        return this;
    }

    public SchemaBuilder dependencies(Map<String, PropsOrStringArray> dependencies) {
        requireNonNull(dependencies, "dependencies").forEach(this::dependency);
        return this;
    }

    public SchemaBuilder additionalItems(PropsOrBool additionalItems) {
        this.additionalItems = requireNonNull(additionalItems, "additionalItems");
        return this;
    }

    public SchemaBuilder additionalItems(boolean allows) {
        return additionalItems(PropsOrBool.of(allows));
    }

    /**
     * Adds a definition with the specified name and {@link Schema}.
     */
    public SchemaBuilder definition(String name, Schema schema) {
        definitions.put(requireNonNull(name, "name"), requireNonNull(schema, "schema"));
        return this;
    }

    public SchemaBuilder definitions(Map<String, Schema> definitions) {
        requireNonNull(definitions, "definitions").forEach(this::definition);
        return this;
    }

    public SchemaBuilder externalDocs(SchemaExternalDocs externalDocs) {
        this.externalDocs = requireNonNull(externalDocs, "externalDocs");
        return this;
    }

    public SchemaBuilder example(JsonNode example) {
        this.example = requireNonNull(example, "example");
        return this;
    }

    /**
     * Returns a newly-created {@link Schema} based on the properties set so far.
     */
    public Schema build() {
        return new Schema(this);
    }
}
