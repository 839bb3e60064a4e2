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
 * Jackson {@link JsonDeserializer} for {@link ExternalDocumentation}.
 */
final class ExternalDocumentationJsonDeserializer
        extends AbstractObjectJsonDeserializer<ExternalDocumentation> {

    private static final long serialVersionUID = -1580225043361528617L;

    ExternalDocumentationJsonDeserializer() {
        super(ExternalDocumentation.class, true, "description", "url");
    }

    @Override
    protected ExternalDocumentation decode(ObjectFields fields) throws IOException {
        final ExternalDocumentationBuilder builder = ExternalDocumentation.builder(fields.requiredString("url"))
                                                                          .extensions(fields.extensions());
        builder.description = fields.string("description");
        return builder.build();
    }
}
