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

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.google.common.collect.ImmutableMap;

import com.linecorp.openrpc.jsonschema.Schema;

class JsonSchemaTest {

    private static final OpenRpcCodec codec = OpenRpcCodec.builder().strict().build();

    @Test
    void extensionsBesideKeywords() {
        final String json = json("{'type':'string','format':'uuid','x-go-type':'UUID'}");
        final JsonSchema schema = codec.decode(json, JsonSchema.class);
        assertThat(schema.schema()).isEqualTo(Schema.builder().type("string").format("uuid").build());
        assertThat(schema.extensions()).containsOnlyKeys("x-go-type");
        assertThat(codec.encode(schema)).isEqualTo(json);
    }

    @Test
    void nestedSchemasDropExtensions() {
        final JsonSchema schema = codec.decode(
                json("{'type':'array','items':{'type':'string','x-nested':1},'x-top':2}"), JsonSchema.class);
        assertThat(schema.extensions()).containsOnlyKeys("x-top");
        assertThat(schema.schema().items().schema()).isEqualTo(Schema.ofType("string"));
        assertThat(codec.encode(schema))
                .isEqualTo(json("{'type':'array','items':{'type':'string'},'x-top':2}"));
    }

    @Test
    void unknownKeyword() {
        assertThatThrownBy(() -> codec.decode(json("{'type':'string','$id':'a'}"), JsonSchema.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.UNKNOWN_FIELD);
                    assertThat(e.path()).isEqualTo("$id");
                });
    }

    @Test
    void mustBeObject() {
        assertThatThrownBy(() -> codec.decode("true", JsonSchema.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.INVALID_SHAPE);
                });
    }

    @Test
    void create() {
        final JsonSchema schema = JsonSchema.of(Schema.ofType("boolean"),
                                                ImmutableMap.of("x-nullable", BooleanNode.TRUE));
        assertThatJson(codec.encode(schema)).isEqualTo(json("{'type':'boolean','x-nullable':true}"));
        assertThat(JsonSchema.of(Schema.of())).isEqualTo(JsonSchema.of(Schema.of(), ImmutableMap.of()));
        assertThatThrownBy(() -> JsonSchema.of(Schema.of(), ImmutableMap.of("nullable", BooleanNode.TRUE)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
