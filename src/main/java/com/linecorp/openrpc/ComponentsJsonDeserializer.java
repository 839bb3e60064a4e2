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
 * Jackson {@link JsonDeserializer} for {@link Components}.
 */
final class ComponentsJsonDeserializer extends AbstractObjectJsonDeserializer<Components> {

    private static final long serialVersionUID = 5803337006958131716L;

    ComponentsJsonDeserializer() {
        super(Components.class, true,
              "contentDescriptors", "schemas", "examples", "links", "errors", "examplePairingObjects",
              "tags");
    }

    @Override
    protected Components decode(ObjectFields fields) throws IOException {
        return Components.builder()
                         .contentDescriptors(fields.map("contentDescriptors", ContentDescriptor.class))
                         .schemas(fields.map("schemas", JsonSchema.class))
                         .examples(fields.map("examples", Example.class))
                         .links(fields.map("links", Link.class))
                         .errors(fields.map("errors", ErrorObject.class))
                         .examplePairingObjects(fields.map("examplePairingObjects", ExamplePairing.class))
                         .tags(fields.map("tags", Tag.class))
                         .extensions(fields.extensions())
                         .build();
    }
}
