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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

class PropsOrBoolTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    @ParameterizedTest
    @ValueSource(booleans = { true, false })
    void bool(boolean allows) throws Exception {
        final PropsOrBool value = mapper.readValue(String.valueOf(allows), PropsOrBool.class);
        assertThat(value.allows()).isEqualTo(allows);
        assertThat(value.hasSchema()).isFalse();
        assertThat(value.schema()).isNull();
        assertThat(value).isEqualTo(PropsOrBool.of(allows));
        assertThat(mapper.writeValueAsString(value)).isEqualTo(String.valueOf(allows));
    }

    @Test
    void schema() throws Exception {
        final PropsOrBool value = mapper.readValue("{\"type\":\"integer\"}", PropsOrBool.class);
        assertThat(value.allows()).isTrue();
        assertThat(value.hasSchema()).isTrue();
        assertThat(value.schema()).isEqualTo(Schema.ofType("integer"));
        assertThat(mapper.writeValueAsString(value)).isEqualTo("{\"type\":\"integer\"}");
    }

    @Test
    void allowAll() {
        assertThat(PropsOrBool.allowAll()).isEqualTo(PropsOrBool.of(true));
        assertThat(PropsOrBool.allowAll()).isNotEqualTo(PropsOrBool.of(Schema.of()));
    }

    @ParameterizedTest
    @ValueSource(strings = { "1", "\"true\"", "[]" })
    void invalidShape(String json) {
        assertThatThrownBy(() -> mapper.readValue(json, PropsOrBool.class))
                .isInstanceOf(MismatchedInputException.class)
                .hasMessageContaining("must be a boolean or a schema");
    }
}
