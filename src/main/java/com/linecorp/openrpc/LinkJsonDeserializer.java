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
 * Jackson {@link JsonDeserializer} for {@link Link}.
 */
final class LinkJsonDeserializer extends AbstractObjectJsonDeserializer<Link> {

    private static final long serialVersionUID = 1107626594906446306L;

    LinkJsonDeserializer() {
        super(Link.class, true, "name", "description", "summary", "method", "params", "server");
    }

    @Override
    protected Link decode(ObjectFields fields) throws IOException {
        final LinkBuilder builder = Link.builder(fields.requiredString("name"))
                                        .extensions(fields.extensions());
        fields.stringMap("params").forEach(builder::param);
        builder.description = fields.string("description");
        builder.summary = fields.string("summary");
        builder.method = fields.string("method");
        builder.server = fields.value("server", Server.class);
        return builder.build();
    }
}
