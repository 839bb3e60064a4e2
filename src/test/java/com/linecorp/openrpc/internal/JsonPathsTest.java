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
package com.linecorp.openrpc.internal;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonMappingException.Reference;
import com.google.common.collect.ImmutableList;

class JsonPathsTest {

    @Test
    void render() {
        assertThat(JsonPaths.render(ImmutableList.of())).isEmpty();
        assertThat(JsonPaths.render(ImmutableList.of(new Reference(null, "methods"),
                                                     new Reference(null, 0),
                                                     new Reference(null, "params"),
                                                     new Reference(null, 1),
                                                     new Reference(null, "schema"),
                                                     new Reference(null, "items"))))
                .isEqualTo("methods[0].params[1].schema.items");
        assertThat(JsonPaths.render(ImmutableList.of(new Reference(null, 2), new Reference(null, "name"))))
                .isEqualTo("[2].name");
    }

    @Test
    void endsWith() {
        final ImmutableList<Reference> path = ImmutableList.of(new Reference(null, "info"),
                                                               new Reference(null, "bogus"));
        assertThat(JsonPaths.endsWith(path, "bogus")).isTrue();
        assertThat(JsonPaths.endsWith(path, "info")).isFalse();
        assertThat(JsonPaths.endsWith(ImmutableList.of(), "info")).isFalse();
    }
}
