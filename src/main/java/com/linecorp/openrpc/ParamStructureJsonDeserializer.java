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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import com.linecorp.openrpc.internal.ObjectFields;

/**
 * Jackson {@link JsonDeserializer} for {@link ParamStructure}, which accepts either the text such as
 * {@code "by-name"} or the ordinal value such as {@code 1}.
 */
final class ParamStructureJsonDeserializer extends StdDeserializer<ParamStructure> {

    private static final long serialVersionUID = 2846150328374903745L;

    ParamStructureJsonDeserializer() {
        super(ParamStructure.class);
    }

    @Override
    public ParamStructure deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        final JsonNode tree = ctx.readTree(p);
        final ParamStructure structure;
        if (tree.isTextual()) {
            structure = ParamStructure.ofText(tree.textValue());
        } else if (tree.isIntegralNumber() && tree.canConvertToInt()) {
            structure = ParamStructure.of(tree.intValue());
        } else {
            throw InvalidShapeException.of(p, ParamStructure.class,
                                           "paramStructure must be a string or an integer but was " +
                                           ObjectFields.describe(tree));
        }

        if (structure == null) {
            throw InvalidShapeException.of(p, ParamStructure.class,
                                           "unknown paramStructure: " + tree +
                                           " (expected: \"by-position\", \"by-name\" or \"either\")");
        }
        return structure;
    }
}
