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

import com.fasterxml.jackson.databind.JsonDeserializer;

import com.linecorp.openrpc.internal.AbstractObjectJsonDeserializer;
import com.linecorp.openrpc.internal.ObjectFields;

/**
 * Jackson {@link JsonDeserializer} for {@link Example}.
 */
final class ExampleJsonDeserializer extends AbstractObjectJsonDeserializer<Example> {

    private static final long serialVersionUID = -7467713880404052983L;

    ExampleJsonDeserializer() {
        super(Example.class, true, "name", "summary", "description", "value", "externalValue");
    }

    @Override
    protected Example decode(ObjectFields fields) throws IOException {
        final ExampleBuilder builder = Example.builder().extensions(fields.extensions());
        builder.name = fields.string("name");
        builder.summary = fields.string("summary");
        builder.description = fields.string("description");
        builder.value = fields.raw("value");
        builder.externalValue = fields.string("externalValue");
        if (builder.value != null && builder.externalValue != null) {
            throw fields.invalid("externalValue", "value and externalValue are mutually exclusive");
        }
        return builder.build();
    }
}
