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

import static com.linecorp.openrpc.OpenRpcCodecTest.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ParamStructureTest {

    private static final OpenRpcCodec codec = OpenRpcCodec.builder().strict().build();

    @ParameterizedTest
    @CsvSource({
            "0, by-position",
            "1, by-name",
            "2, either",
            "5, 5",
            "-1, -1",
    })
    void render(int value, String expected) {
        assertThat(ParamStructure.render(value)).isEqualTo(expected);
    }

    @Test
    void lookup() {
        assertThat(ParamStructure.of(1)).isSameAs(ParamStructure.BY_NAME);
        assertThat(ParamStructure.of(3)).isNull();
        assertThat(ParamStructure.ofText("either")).isSameAs(ParamStructure.EITHER);
        assertThat(ParamStructure.ofText("EITHER")).isNull();
        assertThat(ParamStructure.BY_POSITION.value()).isZero();
        assertThat(ParamStructure.BY_POSITION).hasToString("by-position");
    }

    @Test
    void decodeFromTextOrInteger() {
        assertThat(method("'by-name'").paramStructure()).isSameAs(ParamStructure.BY_NAME);
        assertThat(method("2").paramStructure()).isSameAs(ParamStructure.EITHER);

        final Method method = method("0");
        assertThat(method.hasParamStructure()).isTrue();
        assertThat(codec.encode(method)).contains("\"paramStructure\":\"by-position\"");
    }

    @Test
    void absentParamStructure() {
        final Method method = codec.decode(json("{'name':'m','params':[],'result':{'name':'r','schema':{}}}"),
                                           Method.class);
        assertThat(method.hasParamStructure()).isFalse();
        assertThat(method.paramStructure()).isSameAs(ParamStructure.BY_POSITION);
        assertThat(codec.encode(method)).doesNotContain("paramStructure");
    }

    @ParameterizedTest
    @CsvSource(quoteCharacter = '"', value = {
            "'sideways'",
            "7",
            "true",
    })
    void unknownParamStructure(String value) {
        assertThatThrownBy(() -> method(value))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.INVALID_SHAPE);
                    assertThat(e.path()).isEqualTo("paramStructure");
                });
    }

    private static Method method(String paramStructure) {
        return codec.decode(json("{'name':'m','params':[],'result':{'name':'r','schema':{}}," +
                                 "'paramStructure':" + paramStructure + '}'), Method.class);
    }
}
