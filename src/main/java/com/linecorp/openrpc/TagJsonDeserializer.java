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
 * Jackson {@link JsonDeserializer} for {@link Tag}.
 */
final class TagJsonDeserializer extends AbstractObjectJsonDeserializer<Tag> {

    private static final long serialVersionUID = 5230467197312840813L;

    TagJsonDeserializer() {
        super(Tag.class, true, "name", "summary", "description", "externaldocs");
    }

    @Override
    protected Tag decode(ObjectFields fields) throws IOException {
        final TagBuilder builder = Tag.builder(fields.requiredString("name"))
                                      .extensions(fields.extensions());
        builder.summary = fields.string("summary");
        builder.description = fields.string("description");
        builder.externalDocs = fields.value("externaldocs", ExternalDocumentation.class);
        return builder.build();
    }
}
