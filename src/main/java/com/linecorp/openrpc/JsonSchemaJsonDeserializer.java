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

import java.io.IOException;
import java.util.Iterator;
import java.util.Map.Entry;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;

import com.linecorp.openrpc.internal.ObjectFields;
import com.linecorp.openrpc.jsonschema.Schema;

/**
 * Jackson {@link JsonDeserializer} for {@link JsonSchema}. The extension fields are taken out first
 * and the remaining fields are decoded as a {@link Schema}.
 */
final class JsonSchemaJsonDeserializer extends StdDeserializer<JsonSchema> {

    private static final long serialVersionUID = -4170986023364185296L;

    JsonSchemaJsonDeserializer() {
        super(JsonSchema.class);
    }

    @Override
    public JsonSchema deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        final JsonNode tree = ctx.readTree(p);
        if (!tree.isObject()) {
            throw InvalidShapeException.of(p, JsonSchema.class,
                                           "JsonSchema must be an object but was " +
                                           ObjectFields.describe(tree));
        }

        final ObjectNode schemaNode = ctx.getNodeFactory().objectNode();
        final ImmutableMap.Builder<String, JsonNode> extensions = ImmutableMap.builder();
        for (final Iterator<Entry<String, JsonNode>> i = tree.fields(); i.hasNext();) {
            final Entry<String, JsonNode> e = i.next();
            if (Extensions.isExtension(e.getKey())) {
                extensions.put(e.getKey(), e.getValue());
            } else {
                schemaNode.set(e.getKey(), e.getValue());
            }
        }

        return JsonSchema.of(ctx.readTreeAsValue(schemaNode, Schema.class), extensions.build());
    }
}
