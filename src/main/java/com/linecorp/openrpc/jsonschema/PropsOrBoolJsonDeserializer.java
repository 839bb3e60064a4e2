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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import com.linecorp.openrpc.InvalidShapeException;
import com.linecorp.openrpc.internal.ObjectFields;

/**
 * Jackson {@link JsonDeserializer} for {@link PropsOrBool}.
 */
final class PropsOrBoolJsonDeserializer extends StdDeserializer<PropsOrBool> {

    private static final long serialVersionUID = -3001947205560374271L;

    PropsOrBoolJsonDeserializer() {
        super(PropsOrBool.class);
    }

    @Override
    public PropsOrBool deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        final JsonNode tree = ctx.readTree(p);
        if (tree.isBoolean()) {
            return PropsOrBool.of(tree.booleanValue());
        }
        if (tree.isObject()) {
            return PropsOrBool.of(ctx.readTreeAsValue(tree, Schema.class));
        }
        throw InvalidShapeException.of(p, PropsOrBool.class,
                                       "must be a boolean or a schema but was " + ObjectFields.describe(tree));
    }
}
