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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Jackson {@link JsonSerializer} for {@link PropsOrBool}.
 */
final class PropsOrBoolJsonSerializer extends StdSerializer<PropsOrBool> {

    private static final long serialVersionUID = 2231957434405982650L;

    PropsOrBoolJsonSerializer() {
        super(PropsOrBool.class);
    }

    @Override
    public void serialize(PropsOrBool value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        final Schema schema = value.schema();
        if (schema == null) {
            gen.writeBoolean(value.allows());
            return;
        }

        checkState(value.allows(), "a schema must not be combined with allows=false: %s", value);
        provider.defaultSerializeValue(schema, gen);
    }
}
