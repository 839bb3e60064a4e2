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
import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.TextNode;

import com.linecorp.openrpc.jsonschema.Schema;

class MethodTest {

    private static final OpenRpcCodec codec = OpenRpcCodec.builder().strict().build();

    @Test
    void captureExtensions() {
        final String json = json("{'name':'m','params':[],'result':{'name':'r','schema':{}}," +
                                 "'x-internal-id':'42'}");
        final Method method = codec.decode(json, Method.class);
        assertThat(method.name()).isEqualTo("m");
        assertThat(method.extensions()).containsEntry("x-internal-id", TextNode.valueOf("42"));

        final String encoded = codec.encode(method);
        assertThatJson(encoded).isEqualTo(json);
        // Extensions are written after the named fields.
        assertThat(encoded).endsWith(",\"x-internal-id\":\"42\"}");
    }

    @Test
    void extensionsKeepOrder() {
        final Method method = Method.builder("m", ContentDescriptor.of("r", Schema.of()))
                                    .extension("x-b", "2")
                                    .extension("x-a", "1")
                                    .build();
        assertThat(method.extensions()).containsExactly(
                entry("x-b", TextNode.valueOf("2")),
                entry("x-a", TextNode.valueOf("1")));
        assertThat(codec.encode(method)).isEqualTo(json(
                "{'name':'m','params':[],'result':{'name':'r','schema':{}},'x-b':'2','x-a':'1'}"));
    }

    @Test
    void builder() {
        final Method method =
                Method.builder("get_pet", ContentDescriptor.of("pet", Schema.ofType("object")))
                      .summary("Gets a pet")
                      .params(ContentDescriptor.builder("petId", Schema.ofType("integer"))
                                               .required(true)
                                               .build())
                      .tags(Tag.of("pets"))
                      .errors(ErrorObject.of(ErrorCode.INVALID_PARAMS, "Invalid params"))
                      .links(Link.builder("owner").method("get_owner").param("petId", "$params.petId").build())
                      .paramStructure(ParamStructure.BY_NAME)
                      .deprecated(true)
                      .build();
        assertThatJson(codec.encode(method)).isEqualTo(json(
                "{'name':'get_pet','tags':[{'name':'pets'}],'summary':'Gets a pet'," +
                "'params':[{'name':'petId','schema':{'type':'integer'},'required':true}]," +
                "'result':{'name':'pet','schema':{'type':'object'}},'deprecated':true," +
                "'errors':[{'code':-32602,'message':'Invalid params'}]," +
                "'links':[{'name':'owner','method':'get_owner','params':{'petId':'$params.petId'}}]," +
                "'paramStructure':'by-name'}"));

        final Method copy = method.toBuilder().summary("Finds a pet").build();
        assertThat(copy.summary()).isEqualTo("Finds a pet");
        assertThat(copy.params()).isEqualTo(method.params());
        assertThat(copy).isNotEqualTo(method);
        assertThat(copy.toBuilder().summary("Gets a pet").build()).isEqualTo(method);
    }

    @Test
    void requiredArguments() {
        assertThatThrownBy(() -> Method.builder(null, ContentDescriptor.of("r", Schema.of())))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("name");
        assertThatThrownBy(() -> Method.builder("m", ContentDescriptor.of("r", Schema.of()))
                                       .extension("internal-id", "42"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("x-");
    }

    @Test
    void missingParams() {
        assertThatThrownBy(() -> codec.decode(json("{'name':'m','result':{'name':'r','schema':{}}}"),
                                              Method.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.MISSING_REQUIRED);
                    assertThat(e.path()).isEqualTo("params");
                });
    }
}
