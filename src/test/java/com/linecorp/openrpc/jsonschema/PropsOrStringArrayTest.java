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

class PropsOrStringArrayTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    @Test
    void propertyNames() throws Exception {
        final PropsOrStringArray value = mapper.readValue("[\"a\",\"b\"]", PropsOrStringArray.class);
        assertThat(value.properties()).containsExactly("a", "b");
        assertThat(value.schema()).isNull();
        assertThat(value).isEqualTo(PropsOrStringArray.ofProperties("a", "b"));
        assertThat(mapper.writeValueAsString(value)).isEqualTo("[\"a\",\"b\"]");
    }

    @Test
    void schema() throws Exception {
        final PropsOrStringArray value = mapper.readValue("{\"required\":[\"a\"]}", PropsOrStringArray.class);
        assertThat(value.properties()).isNull();
        assertThat(value.schema()).isEqualTo(Schema.builder().required("a").build());
        assertThat(mapper.writeValueAsString(value)).isEqualTo("{\"required\":[\"a\"]}");
    }

    @Test
    void invalidShape() {
        assertThatThrownBy(() -> mapper.readValue("true", PropsOrStringArray.class))
                .isInstanceOf(MismatchedInputException.class)
                .hasMessageContaining("must be a schema or an array of property names but was boolean");
        assertThatThrownBy(() -> mapper.readValue("[\"a\",{}]", PropsOrStringArray.class))
                .isInstanceOfSatisfying(MismatchedInputException.class, e -> {
                    assertThat(e.getOriginalMessage()).isEqualTo("must be a property name but was object");
                    assertThat(e.getPath().get(0).getIndex()).isOne();
                });
    }
}
