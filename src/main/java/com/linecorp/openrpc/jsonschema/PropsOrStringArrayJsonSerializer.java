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

import static com.google.common.base.Preconditions.checkState;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Jackson {@link JsonSerializer} for {@link PropsOrStringArray}.
 */
final class PropsOrStringArrayJsonSerializer extends StdSerializer<PropsOrStringArray> {

    private static final long serialVersionUID = 5031842913271698213L;

    PropsOrStringArrayJsonSerializer() {
        super(PropsOrStringArray.class);
    }

    @Override
    public void serialize(PropsOrStringArray value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        final Schema schema = value.schema();
        final List<String> properties = value.properties();
        checkState((schema == null) != (properties == null),
                   "exactly one of schema and properties must be set: %s", value);
        if (schema != null) {
            provider.defaultSerializeValue(schema, gen);
            return;
        }

        gen.writeStartArray();
        for (String property : properties) {
            gen.writeString(property);
        }
        gen.writeEndArray();
    }
}
