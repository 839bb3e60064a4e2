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

import com.fasterxml.jackson.databind.node.IntNode;

class ExampleTest {

    private static final OpenRpcCodec codec = OpenRpcCodec.of();

    @Test
    void valueAndExternalValueAreMutuallyExclusive() {
        assertThatThrownBy(() -> Example.builder()
                                        .value(IntNode.valueOf(1))
                                        .externalValue("https://example.com/1.json")
                                        .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("mutually exclusive");

        assertThatThrownBy(() -> codec.decode(json("{'value':1,'externalValue':'https://example.com'}"),
                                              Example.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.INVALID_SHAPE);
                    assertThat(e.path()).isEqualTo("externalValue");
                });
    }

    @Test
    void nullValueIsKept() {
        final Example example = codec.decode(json("{'name':'nothing','value':null}"), Example.class);
        assertThat(example.value()).isNotNull();
        assertThat(example.value().isNull()).isTrue();
        assertThat(codec.decode(json("{'name':'nothing'}"), Example.class).value()).isNull();
    }

    @Test
    void summaryIsWrittenAsSummary() {
        final Example example = Example.builder()
                                       .name("one")
                                       .summary("The number one")
                                       .value(IntNode.valueOf(1))
                                       .build();
        assertThat(codec.encode(example))
                .isEqualTo(json("{'name':'one','summary':'The number one','value':1}"));
    }

    @Test
    void pairing() {
        final String json = json("{'name':'add','params':[{'value':1},{'value':2}],'result':{'value':3}," +
                                 "'x-note':'sums'}");
        final ExamplePairing pairing = codec.decode(json, ExamplePairing.class);
        assertThat(pairing.params()).extracting(p -> p.value().value().intValue()).containsExactly(1, 2);
        assertThat(pairing.result()).isEqualTo(ReferenceOr.of(Example.ofValue(IntNode.valueOf(3))));
        assertThat(pairing.extensions()).containsOnlyKeys("x-note");
        assertThat(codec.encode(pairing)).isEqualTo(json);
    }
}
