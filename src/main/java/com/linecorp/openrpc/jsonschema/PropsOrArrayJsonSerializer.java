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
 * Jackson {@link JsonSerializer} for {@link PropsOrArray}.
 */
final class PropsOrArrayJsonSerializer extends StdSerializer<PropsOrArray> {

    private static final long serialVersionUID = -7340512965137815316L;

    PropsOrArrayJsonSerializer() {
        super(PropsOrArray.class);
    }

    @Override
    public void serialize(PropsOrArray value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        final Schema schema = value.schema();
        final List<Schema> schemas = value.schemas();
        checkState((schema == null) != (schemas == null),
                   "exactly one of schema and schemas must be set: %s", value);
        if (schema != null) {
            provider.defaultSerializeValue(schema, gen);
        } else {
            provider.defaultSerializeValue(schemas, gen);
        }
    }
}
