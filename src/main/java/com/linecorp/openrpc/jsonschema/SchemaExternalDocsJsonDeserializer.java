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

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonDeserializer;

import com.linecorp.openrpc.internal.AbstractObjectJsonDeserializer;
import com.linecorp.openrpc.internal.ObjectFields;

/**
 * Jackson {@link JsonDeserializer} for {@link SchemaExternalDocs}.
 */
final class SchemaExternalDocsJsonDeserializer extends AbstractObjectJsonDeserializer<SchemaExternalDocs> {

    private static final long serialVersionUID = 2094483116537062155L;

    SchemaExternalDocsJsonDeserializer() {
        super(SchemaExternalDocs.class, false, "description", "url");
    }

    @Override
    protected SchemaExternalDocs decode(ObjectFields fields) throws IOException {
        final String url = fields.requiredString("url");
        @Nullable
        final String description = fields.string("description");
        return description != null ? SchemaExternalDocs.of(description, url) : SchemaExternalDocs.of(url);
    }
}
