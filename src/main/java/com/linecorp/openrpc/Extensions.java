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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;

/**
 * Utilities for the vendor extension fields of an OpenRPC object.
 *
 * <p>An extension is a patterned field whose name begins with {@value #PREFIX}, for example
 * {@code x-internal-id}. Its value may be any JSON value, including {@code null}. Extensions are
 * kept apart from the named fields of their owner and are written back at the same level
 * after the named fields, in the order they were read or added.
 */
public final class Extensions {

    /**
     * The prefix of every extension field name.
     */
    public static final String PREFIX = "x-";

    /**
     * Returns whether the specified field name denotes an extension field.
     */
    public static boolean isExtension(String fieldName) {
        requireNonNull(fieldName, "fieldName");
        return fieldName.startsWith(PREFIX);
    }

    static ImmutableMap<String, JsonNode> copyOf(Map<String, ? extends JsonNode> extensions) {
        requireNonNull(extensions, "extensions");
        extensions.forEach(Extensions::validate);
        return ImmutableMap.copyOf(extensions);
    }

    static void validate(String name, JsonNode value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        checkArgument(isExtension(name), "name: %s (expected: a name that starts with '%s')", name, PREFIX);
    }

    private Extensions() {}
}
