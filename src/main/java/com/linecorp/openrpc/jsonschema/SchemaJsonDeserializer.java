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

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonDeserializer;

import com.linecorp.openrpc.internal.AbstractObjectJsonDeserializer;
import com.linecorp.openrpc.internal.ObjectFields;

/**
 * Jackson {@link JsonDeserializer} for {@link Schema}.
 */
final class SchemaJsonDeserializer extends AbstractObjectJsonDeserializer<Schema> {

    private static final long serialVersionUID = -6338180451196387614L;

    SchemaJsonDeserializer() {
        super(Schema.class, false,
              "id", "$schema", "$ref", "title", "description", "type", "nullable", "format", "pattern",
              "default", "maximum", "exclusiveMaximum", "minimum", "exclusiveMinimum", "multipleOf",
              "maxLength", "minLength", "maxItems", "minItems", "uniqueItems", "maxProperties",
              "minProperties", "enum", "required", "items", "allOf", "oneOf", "anyOf", "not", "properties",
              "additionalProperties", "patternProperties", "dependencies", "additionalItems",
              "definitions", "externalDocs", "example");
    }

    @Override
    protected Schema decode(ObjectFields fields) throws IOException {
        final SchemaBuilder builder = Schema.builder();

        builder.id = fields.string("id");
        builder.schemaUrl = fields.string("$schema");
        builder.ref = fields.string("$ref");
        builder.title = fields.string("title");
        builder.description = fields.string("description");
        builder.type = fields.string("type");
        builder.nullable = fields.bool("nullable");
        builder.format = fields.string("format");
        builder.pattern = fields.string("pattern");
        builder.defaultValue = fields.raw("default");

        builder.maximum = fields.number("maximum");
        builder.exclusiveMaximum = fields.bool("exclusiveMaximum");
        builder.minimum = fields.number("minimum");
        builder.exclusiveMinimum = fields.bool("exclusiveMinimum");
        builder.multipleOf = fields.number("multipleOf");
        builder.maxLength = fields.integer("maxLength");
        builder.minLength = fields.integer("minLength");
        builder.maxItems = fields.integer("maxItems");
        builder.minItems = fields.integer("minItems");
        builder.uniqueItems = fields.bool("uniqueItems");
        builder.maxProperties = fields.integer("maxProperties");
        builder.minProperties = fields.integer("minProperties");

        builder.enumValues.addAll(fields.rawList("enum"));
        builder.required.addAll(fields.stringList("required"));
        builder.items = fields.value("items", PropsOrArray.class);
        builder.allOf.addAll(fields.list("allOf", Schema.class));
        builder.oneOf.addAll(fields.list("oneOf", Schema.class));
        builder.anyOf.addAll(fields.list("anyOf", Schema.class));
        builder.not = fields.value("not", Schema.class);

        builder.properties.putAll(fields.map("properties", Schema.class));
        builder.additionalProperties = fields.value("additionalProperties", PropsOrBool.class);
        builder.patternProperties.putAll(fields.map("patternProperties", Schema.class));
        builder.dependencies.putAll(fields.map("dependencies", PropsOrStringArray.class));
        builder.additionalItems = fields.value("additionalItems", PropsOrBool.class);
        builder.definitions.putAll(fields.map("definitions", Schema.class));

        builder.externalDocs = fields.value("externalDocs", SchemaExternalDocs.class);
        builder.example = fields.raw("example");
        return builder.build();
    }
}
