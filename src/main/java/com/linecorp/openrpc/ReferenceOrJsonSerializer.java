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

import static com.google.common.base.Preconditions.checkState;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Jackson {@link JsonSerializer} for {@link ReferenceOr}. Writes the {@link Reference} as
 * {@code {"$ref": ...}} or the value as is.
 */
final class ReferenceOrJsonSerializer extends StdSerializer<ReferenceOr<?>> {

    private static final long serialVersionUID = -4630129457330961841L;

    ReferenceOrJsonSerializer() {
        super(ReferenceOr.class, false);
    }

    @Override
    public void serialize(ReferenceOr<?> value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        final Reference reference = value.reference();
        if (reference != null) {
            checkState(value.value() == null, "a reference must not be combined with a value: %s", value);
            provider.defaultSerializeValue(reference, gen);
            return;
        }

        final Object v = value.value();
        checkState(v != null, "neither a reference nor a value: %s", value);
        provider.defaultSerializeValue(v, gen);
    }
}
