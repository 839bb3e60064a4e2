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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;

import com.linecorp.openrpc.jsonschema.Schema;

class ReferenceTest {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final OpenRpcCodec codec = OpenRpcCodec.builder().strict().build();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "{'$ref':'#/components/schemas/Pet'}        | true",
            "{'$ref':'#/a','description':'d'}           | false",
            "{'$ref':1}                                 | false",
            "{}                                         | false",
            "['$ref']                                   | false",
            "'$ref'                                     | false",
    })
    void isReference(String json, boolean expected) throws Exception {
        assertThat(Reference.isReference(mapper.readTree(json(json)))).isEqualTo(expected);
    }

    @Test
    void reference() {
        final Reference ref = codec.decode(json("{'$ref':'#/components/schemas/Pet','x-dropped':1}"),
                                           Reference.class);
        assertThat(ref).isEqualTo(Reference.of("#/components/schemas/Pet"));
        assertThat(codec.encode(ref)).isEqualTo(json("{'$ref':'#/components/schemas/Pet'}"));

        assertThatThrownBy(() -> codec.decode("{}", Reference.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.MISSING_REQUIRED);
                    assertThat(e.path()).isEqualTo("$ref");
                });
    }

    @Test
    void oneOf() {
        final OneOf oneOf = OneOf.of(ContentDescriptor.of("id", Schema.ofType("integer")));
        final String json = json("{'oneOf':{'name':'id','schema':{'type':'integer'}}}");
        assertThat(codec.encode(oneOf)).isEqualTo(json);
        assertThat(codec.decode(json, OneOf.class)).isEqualTo(oneOf);

        assertThatThrownBy(() -> codec.decode(json("{'oneOf':{'name':'id'}}"), OneOf.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.MISSING_REQUIRED);
                    assertThat(e.path()).isEqualTo("oneOf.schema");
                });
    }

    @Test
    void methodWithReferences() {
        final String json = json(
                "{'name':'get_pet','tags':[{'$ref':'#/components/tags/pets'}]," +
                "'params':[{'$ref':'#/components/contentDescriptors/PetId'}," +
                "{'name':'verbose','schema':{'type':'boolean'}}]," +
                "'result':{'$ref':'#/components/contentDescriptors/Pet'}," +
                "'errors':[{'$ref':'#/components/errors/NotFound'}]," +
                "'links':[{'$ref':'#/components/links/owner'}]," +
                "'examples':[{'$ref':'#/components/examplePairingObjects/one'}]}");
        final Method method = codec.decode(json, Method.class);

        final ReferenceOr<ContentDescriptor> first = method.params().get(0);
        assertThat(first.isReference()).isTrue();
        assertThat(first.reference().ref()).isEqualTo("#/components/contentDescriptors/PetId");
        assertThat(first.value()).isNull();
        assertThat(method.params().get(1).isReference()).isFalse();
        assertThat(method.params().get(1).value().name()).isEqualTo("verbose");
        assertThat(method.result().reference()).isEqualTo(Reference.of("#/components/contentDescriptors/Pet"));
        assertThat(method.tags()).containsExactly(ReferenceOr.ofReference("#/components/tags/pets"));
        assertThat(method.errors()).allMatch(ReferenceOr::isReference);
        assertThat(method.links()).allMatch(ReferenceOr::isReference);
        assertThat(method.examples()).allMatch(ReferenceOr::isReference);

        assertThatJson(codec.encode(method)).isEqualTo(json);
        assertThat(codec.decode(codec.encode(method), Method.class)).isEqualTo(method);
    }

    @Test
    void documentWithReferencedParamsInBothPolicies() {
        final String json = json(
                "{'openrpc':'1.2.6','info':{'title':'t','version':'1'}," +
                "'methods':[{'name':'m','params':[{'$ref':'#/components/contentDescriptors/P'}]," +
                "'result':{'name':'r','schema':{}}}]," +
                "'components':{'contentDescriptors':{'P':{'name':'p','schema':{'type':'string'}}}}}");
        final OpenRpcDocument strictDocument = codec.decode(json);
        final OpenRpcDocument lenientDocument = OpenRpcCodec.builder().lenient().build().decode(json);
        assertThat(lenientDocument).isEqualTo(strictDocument);
        assertThat(strictDocument.methods().get(0).params())
                .containsExactly(ReferenceOr.ofReference("#/components/contentDescriptors/P"));
        assertThatJson(codec.encode(strictDocument)).isEqualTo(json);
    }

    @Test
    void invalidReferenceInList() {
        assertThatThrownBy(() -> codec.decode(json("{'name':'m','params':[{'$ref':5}]," +
                                                   "'result':{'name':'r','schema':{}}}"), Method.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.INVALID_SHAPE);
                    assertThat(e.path()).isEqualTo("params[0].$ref");
                });
        assertThatThrownBy(() -> codec.decode(json("{'name':'m','params':[]," +
                                                   "'result':{'$ref':'#/a','name':'r'}}"), Method.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.UNKNOWN_FIELD);
                    assertThat(e.path()).isEqualTo("result.name");
                });
    }

    @Test
    void buildWithReferences() {
        final Method method =
                Method.builder("m", ReferenceOr.ofReference("#/components/contentDescriptors/R"))
                      .addParam(ReferenceOr.ofReference("#/components/contentDescriptors/P"))
                      .params(ContentDescriptor.of("q", Schema.of()))
                      .addError(ReferenceOr.ofReference(Reference.of("#/components/errors/E")))
                      .build();
        assertThatJson(codec.encode(method)).isEqualTo(json(
                "{'name':'m','params':[{'$ref':'#/components/contentDescriptors/P'}," +
                "{'name':'q','schema':{}}]," +
                "'result':{'$ref':'#/components/contentDescriptors/R'}," +
                "'errors':[{'$ref':'#/components/errors/E'}]}"));
        assertThat(method.toBuilder().build()).isEqualTo(method);
    }

    @Test
    void examplePairingWithReferences() {
        final String json = json("{'name':'one','params':[{'$ref':'#/components/examples/a'},{'value':2}]," +
                                 "'result':{'$ref':'#/components/examples/sum'}}");
        final ExamplePairing pairing = codec.decode(json, ExamplePairing.class);
        assertThat(pairing.params()).containsExactly(ReferenceOr.ofReference("#/components/examples/a"),
                                                     ReferenceOr.of(Example.ofValue(IntNode.valueOf(2))));
        assertThat(pairing.result().isReference()).isTrue();
        assertThat(codec.encode(pairing)).isEqualTo(json);
        assertThat(ExamplePairing.builder()
                                 .name("one")
                                 .addParam(ReferenceOr.ofReference("#/components/examples/a"))
                                 .params(Example.ofValue(IntNode.valueOf(2)))
                                 .result(ReferenceOr.ofReference("#/components/examples/sum"))
                                 .build()).isEqualTo(pairing);
    }
}
