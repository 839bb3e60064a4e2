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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.google.common.collect.ImmutableList;

import com.linecorp.openrpc.InvalidShapeException;
import com.linecorp.openrpc.internal.ObjectFields;

/**
 * Jackson {@link JsonDeserializer} for {@link PropsOrStringArray}.
 */
final class PropsOrStringArrayJsonDeserializer extends StdDeserializer<PropsOrStringArray> {

    private static final long serialVersionUID = 7719027164385519064L;

    PropsOrStringArrayJsonDeserializer() {
        super(PropsOrStringArray.class);
    }

    @Override
    public PropsOrStringArray deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        final JsonNode tree = ctx.readTree(p);
        if (tree.isObject()) {
            return PropsOrStringArray.of(ctx.readTreeAsValue(tree, Schema.class));
        }

        if (!tree.isArray()) {
            throw InvalidShapeException.of(p, PropsOrStringArray.class,
                                           "must be a schema or an array of property names but was " +
                                           ObjectFields.describe(tree));
        }

        final ImmutableList.Builder<String> properties = ImmutableList.builderWithExpectedSize(tree.size());
        for (int i = 0; i < tree.size(); i++) {
            final JsonNode element = tree.get(i);
            if (!element.isTextual()) {
                final JsonMappingException e = InvalidShapeException.of(
                        p, PropsOrStringArray.class,
                        "must be a property name but was " + ObjectFields.describe(element));
                e.prependPath(tree, i);
                throw e;
            }
            properties.add(element.textValue());
        }
        return PropsOrStringArray.ofProperties(properties.build());
    }
}
