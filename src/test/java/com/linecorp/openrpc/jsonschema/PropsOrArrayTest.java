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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

class PropsOrArrayTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    @Test
    void singleSchema() throws Exception {
        final PropsOrArray items = mapper.readValue("{\"type\":\"string\"}", PropsOrArray.class);
        assertThat(items.isArray()).isFalse();
        assertThat(items.schema()).isEqualTo(Schema.ofType("string"));
        assertThat(items.schemas()).isNull();
        assertThat(mapper.writeValueAsString(items)).isEqualTo("{\"type\":\"string\"}");
    }

    @Test
    void arrayOfSchemas() throws Exception {
        final PropsOrArray items = mapper.readValue("[{\"type\":\"string\"},{}]", PropsOrArray.class);
        assertThat(items.isArray()).isTrue();
        assertThat(items.schema()).isNull();
        assertThat(items.schemas()).containsExactly(Schema.ofType("string"), Schema.of());
        assertThat(items).isEqualTo(PropsOrArray.ofArray(Schema.ofType("string"), Schema.of()));
        assertThat(mapper.writeValueAsString(items)).isEqualTo("[{\"type\":\"string\"},{}]");
    }

    @Test
    void emptyArrayIsArray() throws Exception {
        final PropsOrArray items = mapper.readValue("[]", PropsOrArray.class);
        assertThat(items.isArray()).isTrue();
        assertThat(items.schemas()).isEmpty();
        assertThat(mapper.writeValueAsString(items)).isEqualTo("[]");
    }

    @Test
    void variantsAreNotEqual() {
        assertThat(PropsOrArray.of(Schema.of())).isNotEqualTo(PropsOrArray.ofArray(Schema.of()));
    }

    @Test
    void invalidShape() {
        assertThatThrownBy(() -> mapper.readValue("\"string\"", PropsOrArray.class))
                .isInstanceOf(MismatchedInputException.class)
                .hasMessageContaining("must be a schema or an array of schemas but was string");
        assertThatThrownBy(() -> mapper.readValue("[{}, true]", PropsOrArray.class))
                .isInstanceOfSatisfying(MismatchedInputException.class, e -> {
                    assertThat(e.getOriginalMessage()).isEqualTo("must be a schema but was boolean");
                    assertThat(e.getPath()).hasSize(1);
                    assertThat(e.getPath().get(0).getIndex()).isOne();
                });
    }
}
