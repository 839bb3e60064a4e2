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
 * Jackson {@link JsonDeserializer} for {@link Method}.
 */
final class MethodJsonDeserializer extends AbstractObjectJsonDeserializer<Method> {

    private static final long serialVersionUID = -1241961385024436025L;

    MethodJsonDeserializer() {
        super(Method.class, true,
              "name", "tags", "summary", "description", "externaldocs", "params", "result", "deprecated",
              "servers", "errors", "links", "paramStructure", "examples");
    }

    @Override
    protected Method decode(ObjectFields fields) throws IOException {
        final String name = fields.requiredString("name");
        final MethodBuilder builder =
                Method.builder(name, fields.requiredReferenceOr("result", ContentDescriptor.class))
                      .servers(fields.list("servers", Server.class))
                      .extensions(fields.extensions());
        builder.params.addAll(fields.requiredReferenceOrList("params", ContentDescriptor.class));
        builder.tags.addAll(fields.referenceOrList("tags", Tag.class));
        builder.errors.addAll(fields.referenceOrList("errors", ErrorObject.class));
        builder.links.addAll(fields.referenceOrList("links", Link.class));
        builder.examples.addAll(fields.referenceOrList("examples", ExamplePairing.class));
        builder.summary = fields.string("summary");
        builder.description = fields.string("description");
        builder.externalDocs = fields.value("externaldocs", ExternalDocumentation.class);
        builder.deprecated = fields.bool("deprecated");
        builder.paramStructure = fields.value("paramStructure", ParamStructure.class);
        return builder.build();
    }
}
