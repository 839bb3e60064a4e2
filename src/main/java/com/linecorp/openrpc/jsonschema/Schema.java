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

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * A JSON-Schema node following <a href="https://json-schema.org/specification-links#draft-4">Draft 4</a>.
 *
 * <p>Optional constraints are {@code null} when absent so that an absent bound is never confused
 * with a bound of {@code 0}. Optional lists and maps are empty when absent.
 *
 * <p>A {@link Schema} does not carry {@code x-*} extension fields. Only the top-level node of a schema
 * position keeps them, through {@link com.linecorp.openrpc.JsonSchema#extensions()}. An {@code x-*} field
 * of a nested node, such as one under {@code properties}, is dropped while decoding under either unknown
 * field policy, so encoding a decoded document does not write it back.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({
        "id", "$schema", "$ref", "title", "description", "type", "nullable", "format", "pattern",
        "default", "maximum", "exclusiveMaximum", "minimum", "exclusiveMinimum", "multipleOf",
        "maxLength", "minLength", "maxItems", "minItems", "uniqueItems", "maxProperties", "minProperties",
        "enum", "required", "items", "allOf", "oneOf", "anyOf", "not", "properties",
        "additionalProperties", "patternProperties", "dependencies", "additionalItems", "definitions",
        "externalDocs", "example"
})
@JsonDeserialize(using = SchemaJsonDeserializer.class)
public final class Schema {

    private static final Schema EMPTY = builder().build();

    /**
     * Returns the empty {@link Schema}, which has no constraints.
     */
    public static Schema of() {
        return EMPTY;
    }

    /**
     * Returns a new {@link Schema} which only has the specified {@code type}.
     */
    public static Schema ofType(String type) {
        return builder().type(type).build();
    }

    /**
     * Returns a new {@link SchemaBuilder}.
     */
    public static SchemaBuilder builder() {
        return new SchemaBuilder();
    }

    @Nullable
    private final String id;
    @Nullable
    private final String schemaUrl;
    @Nullable
    private final String ref;
    @Nullable
    private final String title;
    @Nullable
    private final String description;
    @Nullable
    private final String type;
    private final boolean nullable;
    @Nullable
    private final String format;
    @Nullable
    private final String pattern;
    @Nullable
    private final JsonNode defaultValue;
    @Nullable
    private final Double maximum;
    private final boolean exclusiveMaximum;
    @Nullable
    private final Double minimum;
    private final boolean exclusiveMinimum;
    @Nullable
    private final Double multipleOf;
    @Nullable
    private final Long maxLength;
    @Nullable
    private final Long minLength;
    @Nullable
    private final Long maxItems;
    @Nullable
    private final Long minItems;
    private final boolean uniqueItems;
    @Nullable
    private final Long maxProperties;
    @Nullable
    private final Long minProperties;
    private final List<JsonNode> enumValues;
    private final List<String> required;
    @Nullable
    private final PropsOrArray items;
    private final List<Schema> allOf;
    private final List<Schema> oneOf;
    private final List<Schema> anyOf;
    @Nullable
    private final Schema not;
    private final Map<String, Schema> properties;
    @JsonProperty("additionalProperties")
    @Nullable
    private final PropsOrBool additionalProperties;
    private final Map<String, Schema> patternProperties;
    private final Map<String, PropsOrStringArray> dependencies;
    @JsonProperty("additionalItems")
    @Nullable
    private final PropsOrBool additionalItems;
    private final Map<String, Schema> definitions;
    @Nullable
    private final SchemaExternalDocs externalDocs;
    @Nullable
    private final JsonNode example;

    Schema(SchemaBuilder builder) {
        id = builder.id;
        schemaUrl = builder.schemaUrl;
        ref = builder.ref;
        title = builder.title;
        description = builder.description;
        type = builder.type;
        nullable = builder.nullable;
        format = builder.format;
        pattern = builder.pattern;
        defaultValue = builder.defaultValue;
        maximum = builder.maximum;
        exclusiveMaximum = builder.exclusiveMaximum;
        minimum = builder.minimum;
        exclusiveMinimum = builder.exclusiveMinimum;
        multipleOf = builder.multipleOf;
        maxLength = builder.maxLength;
        minLength = builder.minLength;
        maxItems = builder.maxItems;
        minItems = builder.minItems;
        uniqueItems = builder.uniqueItems;
        maxProperties = builder.maxProperties;
        minProperties = builder.minProperties;
        enumValues = builder.enumValues.build();
        required = builder.required.build();
        items = builder.items;
        allOf = builder.allOf.build();
        oneOf = builder.oneOf.build();
        anyOf = builder.anyOf.build();
        not = builder.not;
        properties = ImmutableMap.copyOf(builder.properties);
        additionalProperties = builder.additionalProperties;
        patternProperties = ImmutableMap.copyOf(builder.patternProperties);
        dependencies = ImmutableMap.copyOf(builder.dependencies);
        additionalItems = builder.additionalItems;
        definitions = ImmutableMap.copyOf(builder.definitions);
        externalDocs = builder.externalDocs;
        example = builder.example;
    }

    @Nullable
    @JsonProperty
    public String id() {
        return id;
    }

    /**
     * Returns the {@code $schema} URL of the dialect this schema is written in.
     */
    @Nullable
    @JsonProperty("$schema")
    public String schemaUrl() {
        return schemaUrl;
    }

    /**
     * Returns the {@code $ref} pointer. This model never resolves it.
     */
    @Nullable
    @JsonProperty("$ref")
    public String ref() {
        return ref;
    }

    @Nullable
    @JsonProperty
    public String title() {
        return title;
    }

    @Nullable
    @JsonProperty
    public String description() {
        return description;
    }

    @Nullable
    @JsonProperty
    public String type() {
        return type;
    }

    @JsonProperty("nullable")
    @JsonInclude(Include.NON_DEFAULT)
    public boolean isNullable() {
        return nullable;
    }

    @Nullable
    @JsonProperty
    public String format() {
        return format;
    }

    @Nullable
    @JsonProperty
    public String pattern() {
        return pattern;
    }

    /**
     * Returns the {@code default} value, or {@code null} if absent. A JSON {@code null} default is
     * returned as a {@link com.fasterxml.jackson.databind.node.NullNode}.
     */
    @Nullable
    @JsonProperty("default")
    public JsonNode defaultValue() {
        return defaultValue;
    }

    @Nullable
    @JsonProperty
    @JsonSerialize(using = CompactDoubleJsonSerializer.class)
    public Double maximum() {
        return maximum;
    }

    @JsonProperty("exclusiveMaximum")
    @JsonInclude(Include.NON_DEFAULT)
    public boolean isExclusiveMaximum() {
        return exclusiveMaximum;
    }

    @Nullable
    @JsonProperty
    @JsonSerialize(using = CompactDoubleJsonSerializer.class)
    public Double minimum() {
        return minimum;
    }

    @JsonProperty("exclusiveMinimum")
    @JsonInclude(Include.NON_DEFAULT)
    public boolean isExclusiveMinimum() {
        return exclusiveMinimum;
    }

    @Nullable
    @JsonProperty
    @JsonSerialize(using = CompactDoubleJsonSerializer.class)
    public Double multipleOf() {
        return multipleOf;
    }

    @Nullable
    @JsonProperty
    public Long maxLength() {
        return maxLength;
    }

    @Nullable
    @JsonProperty
    public Long minLength() {
        return minLength;
    }

    @Nullable
    @JsonProperty
    public Long maxItems() {
        return maxItems;
    }

    @Nullable
    @JsonProperty
    public Long minItems() {
        return minItems;
    }

    @JsonProperty("uniqueItems")
    @JsonInclude(Include.NON_DEFAULT)
    public boolean isUniqueItems() {
        return uniqueItems;
    }

    @Nullable
    @JsonProperty
    public Long maxProperties() {
        return maxProperties;
    }

    @Nullable
    @JsonProperty
    public Long minProperties() {
        return minProperties;
    }

    @JsonProperty("enum")
    @JsonInclude(Include.NON_EMPTY)
    public List<JsonNode> enumValues() {
        return enumValues;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<String> required() {
        return required;
    }

    @Nullable
    @JsonProperty
    public PropsOrArray items() {
        return items;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<Schema> allOf() {
        return allOf;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<Schema> oneOf() {
        return oneOf;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<Schema> anyOf() {
        return anyOf;
    }

    @Nullable
    @JsonProperty
    public Schema not() {
        return not;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, Schema> properties() {
        return properties;
    }

    /**
     * Returns whether {@code additionalProperties} was specified.
     */
    public boolean hasAdditionalProperties() {
        return additionalProperties != null;
    }

    /**
     * Returns {@code additionalProperties}, or {@link PropsOrBool#allowAll()} if it was not specified.
     */
    public PropsOrBool additionalProperties() {
        return additionalProperties != null ? additionalProperties : PropsOrBool.allowAll();
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, Schema> patternProperties() {
        return patternProperties;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, PropsOrStringArray> dependencies() {
        return dependencies;
    }

    /**
     * Returns whether {@code additionalItems} was specified.
     */
    public boolean hasAdditionalItems() {
        return additionalItems != null;
    }

    /**
     * Returns {@code additionalItems}, or {@link PropsOrBool#allowAll()} if it was not specified.
     */
    public PropsOrBool additionalItems() {
        return additionalItems != null ? additionalItems : PropsOrBool.allowAll();
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, Schema> definitions() {
        return definitions;
    }

    @Nullable
    @JsonProperty
    public SchemaExternalDocs externalDocs() {
        return externalDocs;
    }

    @Nullable
    @JsonProperty
    public JsonNode example() {
        return example;
    }

    /**
     * Returns a new {@link SchemaBuilder} initialized with the properties of this {@link Schema}.
     */
    public SchemaBuilder toBuilder() {
        return new SchemaBuilder(this);
    }

    @Nullable
    PropsOrBool rawAdditionalProperties() {
        return additionalProperties;
    }

    @Nullable
    PropsOrBool rawAdditionalItems() {
        return additionalItems;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schema)) {
            return false;
        }
        final Schema that = (Schema) o;
        return nullable == that.nullable &&
               exclusiveMaximum == that.exclusiveMaximum &&
               exclusiveMinimum == that.exclusiveMinimum &&
               uniqueItems == that.uniqueItems &&
               Objects.equals(id, that.id) &&
               Objects.equals(schemaUrl, that.schemaUrl) &&
               Objects.equals(ref, that.ref) &&
               Objects.equals(title, that.title) &&
               Objects.equals(description, that.description) &&
               Objects.equals(type, that.type) &&
               Objects.equals(format, that.format) &&
               Objects.equals(pattern, that.pattern) &&
               Objects.equals(defaultValue, that.defaultValue) &&
               Objects.equals(maximum, that.maximum) &&
               Objects.equals(minimum, that.minimum) &&
               Objects.equals(multipleOf, that.multipleOf) &&
               Objects.equals(maxLength, that.maxLength) &&
               Objects.equals(minLength, that.minLength) &&
               Objects.equals(maxItems, that.maxItems) &&
               Objects.equals(minItems, that.minItems) &&
               Objects.equals(maxProperties, that.maxProperties) &&
               Objects.equals(minProperties, that.minProperties) &&
               enumValues.equals(that.enumValues) &&
               required.equals(that.required) &&
               Objects.equals(items, that.items) &&
               allOf.equals(that.allOf) &&
               oneOf.equals(that.oneOf) &&
               anyOf.equals(that.anyOf) &&
               Objects.equals(not, that.not) &&
               properties.equals(that.properties) &&
               Objects.equals(additionalProperties, that.additionalProperties) &&
               patternProperties.equals(that.patternProperties) &&
               dependencies.equals(that.dependencies) &&
               Objects.equals(additionalItems, that.additionalItems) &&
               definitions.equals(that.definitions) &&
               Objects.equals(externalDocs, that.externalDocs) &&
               Objects.equals(example, that.example);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, schemaUrl, ref, title, description, type, nullable, format, pattern,
                            defaultValue, maximum, exclusiveMaximum, minimum, exclusiveMinimum, multipleOf,
                            maxLength, minLength, maxItems, minItems, uniqueItems, maxProperties,
                            minProperties, enumValues, required, items, allOf, oneOf, anyOf, not,
                            properties, additionalProperties, patternProperties, dependencies,
                            additionalItems, definitions, externalDocs, example);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("id", id)
                          .add("$schema", schemaUrl)
                          .add("$ref", ref)
                          .add("title", title)
                          .add("type", type)
                          .add("format", format)
                          .add("pattern", pattern)
                          .add("default", defaultValue)
                          .add("maximum", maximum)
                          .add("minimum", minimum)
                          .add("enum", enumValues.isEmpty() ? null : enumValues)
                          .add("required", required.isEmpty() ? null : required)
                          .add("items", items)
                          .add("properties", properties.isEmpty() ? null : properties.keySet())
                          .add("additionalProperties", additionalProperties)
                          .toString();
    }
}
