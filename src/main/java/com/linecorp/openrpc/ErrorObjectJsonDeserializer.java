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
 * Jackson {@link JsonDeserializer} for {@link ErrorObject}.
 */
final class ErrorObjectJsonDeserializer extends AbstractObjectJsonDeserializer<ErrorObject> {

    private static final long serialVersionUID = -5154409338466123306L;

    ErrorObjectJsonDeserializer() {
        super(ErrorObject.class, true, "code", "message", "data");
    }

    @Override
    protected ErrorObject decode(ObjectFields fields) throws IOException {
        final ErrorObjectBuilder builder =
                ErrorObject.builder(ErrorCode.of(fields.requiredInteger("code")),
                                    fields.requiredString("message"))
                           .extensions(fields.extensions());
        builder.data = fields.raw("data");
        return builder.build();
    }
}
