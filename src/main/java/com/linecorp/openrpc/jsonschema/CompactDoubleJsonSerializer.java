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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Jackson {@link JsonSerializer} that writes a {@link Double} with an integral value without
 * a fraction, so that {@code "maximum": 10} is written back as {@code 10} rather than {@code 10.0}.
 */
final class CompactDoubleJsonSerializer extends StdSerializer<Double> {

    private static final long serialVersionUID = -1658426095430577045L;

    // Doubles are exact integers within this range.
    private static final double MAX_EXACT_INTEGER = 9007199254740992.0;

    CompactDoubleJsonSerializer() {
        super(Double.class);
    }

    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        final double d = value;
        if (d == Math.rint(d) && Math.abs(d) <= MAX_EXACT_INTEGER &&
            Double.doubleToRawLongBits(d) != Double.doubleToRawLongBits(-0.0)) {
            gen.writeNumber((long) d);
        } else {
            gen.writeNumber(d);
        }
    }
}
