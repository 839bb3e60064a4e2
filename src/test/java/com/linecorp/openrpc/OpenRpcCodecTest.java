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

import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.io.Resources;

import com.linecorp.openrpc.jsonschema.Schema;

class OpenRpcCodecTest {

    private static final OpenRpcCodec strict = OpenRpcCodec.builder().strict().build();
    private static final OpenRpcCodec lenient = OpenRpcCodec.builder().lenient().build();

    private static String petstore;

    @BeforeAll
    static void loadPetstore() throws IOException {
        petstore = Resources.toString(Resources.getResource("petstore.json"), StandardCharsets.UTF_8);
    }

    @Test
    void decodePetstore() {
        final OpenRpcDocument document = strict.decode(petstore);
        assertThat(document.openrpc()).isEqualTo("1.2.6");
        assertThat(document.info().title()).isEqualTo("Petstore");
        assertThat(document.info().contact().email()).isEqualTo("doesntexist@open-rpc.org");
        assertThat(document.info().license().name()).isEqualTo("Apache 2.0");
        assertThat(document.info().extensions()).containsOnlyKeys("x-audience");
        assertThat(document.servers()).hasSize(1);
        assertThat(document.servers().get(0).variables()).containsOnlyKeys("region", "port");
        assertThat(document.methods()).extracting(Method::name).containsExactly("list_pets", "get_pet");
        assertThat(document.externalDocs().url()).isEqualTo("https://example.com/petstore");
        assertThat(document.extensions().get("x-generated-by").textValue()).isEqualTo("hand");

        final Method listPets = document.method("list_pets");
        assertThat(listPets).isNotNull();
        assertThat(listPets.paramStructure()).isSameAs(ParamStructure.BY_NAME);
        assertThat(listPets.tags().get(0).value().externalDocs().url()).isEqualTo("https://example.com/pets");
        assertThat(listPets.params().get(0).value().schema().schema().minimum()).isEqualTo(1.0);
        assertThat(listPets.result().value().schema().schema().items().schema().ref())
                .isEqualTo("#/components/schemas/Pet");
        assertThat(listPets.errors().get(0).value().code()).isEqualTo(ErrorCode.of(100));
        assertThat(listPets.errors().get(0).value().data().get("retryAfter").intValue()).isEqualTo(30);
        assertThat(listPets.errors().get(1).reference())
                .isEqualTo(Reference.of("#/components/errors/NotFound"));
        assertThat(listPets.examples().get(0).value().params().get(0).value().value().intValue()).isOne();
        assertThat(listPets.extensions().get("x-internal-id").textValue()).isEqualTo("42");

        final Method getPet = document.method("get_pet");
        assertThat(getPet).isNotNull();
        assertThat(getPet.isDeprecated()).isTrue();
        assertThat(getPet.hasParamStructure()).isFalse();
        assertThat(getPet.paramStructure()).isSameAs(ParamStructure.BY_POSITION);
        assertThat(getPet.params().get(0).value().isRequired()).isTrue();
        assertThat(getPet.links().get(0).value().params().get("petId").expression()).isEqualTo("$params.petId");

        final Components components = document.components();
        assertThat(components.schemas().get("Pet").extensions().get("x-java-class").textValue())
                .isEqualTo("com.example.Pet");
        assertThat(components.schemas().get("Pet").schema().additionalProperties().allows()).isFalse();
        assertThat(components.errors().get("NotFound").code().isServerError()).isTrue();
        assertThat(components.examples().get("remote").externalValue())
                .isEqualTo("https://example.com/pets/remote.json");
        assertThat(components.examplePairingObjects()).containsOnlyKeys("emptyList");
        assertThat(components.tags().get("pets")).isEqualTo(Tag.of("pets"));
    }

    @Test
    void roundTripPetstore() {
        final OpenRpcDocument document = strict.decode(petstore);
        final String encoded = strict.encode(document);
        assertThatJson(encoded).isEqualTo(petstore);
        assertThat(strict.decode(encoded)).isEqualTo(document);
    }

    @Test
    void decodeInputStream() throws IOException {
        try (InputStream in = Resources.getResource("petstore.json").openStream()) {
            assertThat(strict.decode(in)).isEqualTo(strict.decode(petstore));
        }
    }

    @Test
    void encodeToTree() throws IOException {
        final OpenRpcDocument document = strict.decode(petstore);
        final JsonNode tree = strict.encodeToTree(document);
        assertThatJson(tree).isEqualTo(petstore);
        assertThat(strict.decode(tree)).isEqualTo(document);
    }

    @Test
    void worksWithPlainObjectMapper() throws IOException {
        final ObjectMapper mapper = new ObjectMapper();
        final OpenRpcDocument document = mapper.readValue(petstore, OpenRpcDocument.class);
        assertThat(document).isEqualTo(strict.decode(petstore));
        assertThatJson(mapper.writeValueAsString(document)).isEqualTo(petstore);
    }

    @Test
    void objectMapperIsCopy() {
        assertThat(strict.objectMapper()).isNotSameAs(strict.objectMapper());
    }

    @Test
    void minimalDocument() {
        final String json = json("{'openrpc':'1.2.6','info':{'title':'t','version':'1'},'methods':[]}");
        final OpenRpcDocument document = strict.decode(json);
        assertThat(document.methods()).isEmpty();
        assertThat(document.servers()).isEmpty();
        assertThat(document.serversOrDefault()).containsExactly(Server.localhost());
        assertThat(document.components()).isNull();

        // The required list of methods is written even if empty.
        assertThatJson(strict.encode(document)).isEqualTo(json);
    }

    @Test
    void unknownFieldInStrictMode() {
        final String json = json("{'openrpc':'1.2.6','info':{'title':'t','version':'1'},'methods':[]," +
                                 "'bogusField':1}");
        assertThatThrownBy(() -> strict.decode(json))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.UNKNOWN_FIELD);
                    assertThat(e.path()).isEqualTo("bogusField");
                    assertThat(e).hasMessageStartingWith("UNKNOWN_FIELD at bogusField: ");
                });
    }

    @Test
    void nestedUnknownFieldInStrictMode() {
        final String json = json("{'openrpc':'1.2.6','info':{'title':'t','version':'1'},'methods':[" +
                                 "{'name':'m','params':[],'result':{'name':'r','schema':{}},'bogus':true}]}");
        assertThatThrownBy(() -> strict.decode(json))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.UNKNOWN_FIELD);
                    assertThat(e.path()).isEqualTo("methods[0].bogus");
                });
    }

    @Test
    void unknownFieldInLenientMode() {
        final String json = json("{'openrpc':'1.2.6','info':{'title':'t','version':'1','bogus':2}," +
                                 "'methods':[],'bogusField':1}");
        final OpenRpcDocument document = lenient.decode(json);
        assertThat(document.info()).isEqualTo(Info.of("t", "1"));
        assertThat(document.extensions()).isEmpty();
        assertThatJson(lenient.encode(document)).isEqualTo(
                json("{'openrpc':'1.2.6','info':{'title':'t','version':'1'},'methods':[]}"));
    }

    @Test
    void extensionIsNeverUnknown() {
        final String json = json("{'openrpc':'1.2.6','info':{'title':'t','version':'1'},'methods':[]," +
                                 "'x-anything':{'nested':[1,2]}}");
        final OpenRpcDocument document = strict.decode(json);
        assertThat(document.extensions()).containsOnlyKeys("x-anything");
        assertThatJson(strict.encode(document)).isEqualTo(json);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "{'info':{'title':'t','version':'1'},'methods':[]}                    | openrpc",
            "{'openrpc':'1.2.6','methods':[]}                                     | info",
            "{'openrpc':'1.2.6','info':{'version':'1'},'methods':[]}              | info.title",
            "{'openrpc':'1.2.6','info':{'title':'t'},'methods':[]}                | info.version",
            "{'openrpc':'1.2.6','info':{'title':'t','version':'1'}}               | methods",
            "{'openrpc':'1.2.6','info':{'title':'t','version':'1','license':{}},'methods':[]} " +
            "| info.license.name",
            "{'openrpc':'1.2.6','info':{'title':'t','version':'1'},'methods':[{'name':'m','params':[]}]} " +
            "| methods[0].result",
    })
    void missingRequiredField(String json, String path) {
        assertThatThrownBy(() -> lenient.decode(json(json)))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.MISSING_REQUIRED);
                    assertThat(e.path()).isEqualTo(path);
                });
    }

    @Test
    void nullRequiredFieldIsMissing() {
        final String json = json("{'openrpc':null,'info':{'title':'t','version':'1'},'methods':[]}");
        assertThatThrownBy(() -> lenient.decode(json))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.MISSING_REQUIRED);
                    assertThat(e.path()).isEqualTo("openrpc");
                });
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "{",
            "{'openrpc':}",
            "{} {}",
            "{'openrpc' 1}",
    })
    void malformedJson(String json) {
        assertThatThrownBy(() -> lenient.decode(json(json)))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.MALFORMED_JSON);
                    assertThat(e.path()).isEmpty();
                });
    }

    @Test
    void emptyInput() {
        assertThatThrownBy(() -> lenient.decode(""))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.MALFORMED_JSON);
                    assertThat(e).hasMessage("MALFORMED_JSON: No content");
                });
        assertThatThrownBy(() -> lenient.decode(new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(OpenRpcDecodeException.class);
    }

    @Test
    void nullRoot() {
        assertThatThrownBy(() -> lenient.decode("null"))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.INVALID_SHAPE);
                    assertThat(e.path()).isEmpty();
                });
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "[]                                                              | \"\"",
            "{'openrpc':1,'info':{'title':'t','version':'1'},'methods':[]}   | openrpc",
            "{'openrpc':'1','info':[],'methods':[]}                          | info",
            "{'openrpc':'1','info':{'title':'t','version':'1'},'methods':{}} | methods",
            "{'openrpc':'1','info':{'title':'t','version':'1'},'methods':[null]} | methods[0]",
            "{'openrpc':'1','info':{'title':'t','version':'1'},'methods':[],'servers':[{'name':'s'," +
            "'url':'u','variables':{'v':{'default':1}}}]} | servers[0].variables.v.default",
    })
    void invalidShape(String json, String path) {
        assertThatThrownBy(() -> lenient.decode(json(json)))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.INVALID_SHAPE);
                    assertThat(e.path()).isEqualTo(path);
                });
    }

    @Test
    void invalidShapeDeepInSchema() {
        final String json = json(
                "{'openrpc':'1.2.6','info':{'title':'t','version':'1'},'methods':[" +
                "{'name':'m','params':[{'name':'p','schema':{'type':'array','items':5}}]," +
                "'result':{'name':'r','schema':{}}}]}");
        assertThatThrownBy(() -> strict.decode(json))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.INVALID_SHAPE);
                    assertThat(e.path()).isEqualTo("methods[0].params[0].schema.items");
                    assertThat(e).hasMessageContaining("number");
                });
    }

    @Test
    void decodeOtherTypes() {
        final Schema schema = strict.decode(json("{'type':'string','maxLength':3}"), Schema.class);
        assertThat(schema).isEqualTo(Schema.builder().type("string").maxLength(3).build());

        final JsonNode node = JsonNodeFactory.instance.objectNode().put("name", "n").put("url", "u");
        assertThat(strict.decode(node, Server.class)).isEqualTo(Server.of("n", "u"));
    }

    @Test
    void prettyPrint() {
        final OpenRpcCodec codec = OpenRpcCodec.builder().prettyPrint(true).build();
        assertThat(codec.isPrettyPrint()).isTrue();
        assertThat(codec.encode(Info.of("t", "1"))).contains(System.lineSeparator());
        assertThat(strict.encode(Info.of("t", "1"))).isEqualTo(json("{'title':'t','version':'1'}"));
    }

    @Test
    void defaultCodec() {
        assertThat(OpenRpcCodec.of()).isSameAs(OpenRpcCodec.of());
        assertThat(OpenRpcCodec.of().unknownFieldPolicy()).isSameAs(Flags.unknownFieldPolicy());
        assertThat(OpenRpcCodec.of().isPrettyPrint()).isEqualTo(Flags.prettyPrint());
    }

    static String json(String singleQuoted) {
        return singleQuoted.replace('\'', '"');
    }
}
