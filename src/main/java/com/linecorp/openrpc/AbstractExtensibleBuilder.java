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

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.collect.ImmutableMap;

/**
 * A skeletal builder of an OpenRPC object which carries extension fields.
 *
 * @param <SELF> the type of this builder
 */
abstract class AbstractExtensibleBuilder<SELF extends AbstractExtensibleBuilder<SELF>> {

    private final Map<String, JsonNode> extensions = new LinkedHashMap<>();

    AbstractExtensibleBuilder() {}

    @SuppressWarnings("unchecked")
    final SELF self() {
        return (SELF) this;
    }

    /**
     * Adds an extension field. An existing extension field with the same name is replaced.
     *
     * @param name the name of the extension field, which must start with {@value Extensions#PREFIX}
     * @param value the value of the extension field. Use
     *              {@link com.fasterxml.jackson.databind.node.NullNode} for {@code null}.
     */
    public SELF extension(String name, JsonNode value) {
        Extensions.validate(name, value);
        extensions.put(name, value);
        return self();
    }

    /**
     * Adds an extension field whose value is a string.
     */
    public SELF extension(String name, String value) {
        return extension(name, TextNode.valueOf(requireNonNull(value, "value")));
    }

    /**
     * Adds the specified extension fields.
     */
    public SELF extensions(Map<String, ? extends JsonNode> extensions) {
        requireNonNull(extensions, "extensions").forEach(this::extension);
        return self();
    }

    final ImmutableMap<String, JsonNode> extensions() {
        return ImmutableMap.copyOf(extensions);
    }
}
