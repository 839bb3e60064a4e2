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

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;

import com.linecorp.openrpc.jsonschema.Schema;

class OpenRpcDocumentTest {

    private static final OpenRpcCodec codec = OpenRpcCodec.builder().strict().build();

    private static final Method listPets =
            Method.builder("list_pets", ContentDescriptor.of("pets", Schema.ofType("array"))).build();

    private static final Method getPet =
            Method.builder("get_pet", ContentDescriptor.of("pet", Schema.ofType("object"))).build();

    @Test
    void methodLookup() {
        final OpenRpcDocument document = OpenRpcDocument.builder("1.2.6", Info.of("Petstore", "1.0.0"))
                                                        .methods(listPets, getPet)
                                                        .build();
        assertThat(document.method("get_pet")).isSameAs(getPet);
        assertThat(document.method("delete_pet")).isNull();
    }

    @Test
    void serversOrDefault() {
        final Server server = Server.of("production", "https://example.com/rpc");
        final OpenRpcDocument withServers = OpenRpcDocument.builder("1.2.6", Info.of("t", "1"))
                                                           .servers(server)
                                                           .build();
        assertThat(withServers.serversOrDefault()).containsExactly(server);

        final OpenRpcDocument withoutServers = OpenRpcDocument.builder("1.2.6", Info.of("t", "1")).build();
        assertThat(withoutServers.servers()).isEmpty();
        assertThat(withoutServers.serversOrDefault()).containsExactly(Server.localhost());
        // The default server is not written.
        assertThat(codec.encode(withoutServers)).doesNotContain("servers");
    }

    @Test
    void encodeBuiltDocument() {
        final OpenRpcDocument document =
                OpenRpcDocument.builder("1.2.6",
                                        Info.builder("Petstore", "1.0.0")
                                            .license(License.of("MIT"))
                                            .contact(Contact.builder().email("pets@example.com").build())
                                            .build())
                               .methods(listPets)
                               .components(Components.builder()
                                                     .schema("Pet", JsonSchema.of(Schema.ofType("object")))
                                                     .error("NotFound", ErrorObject.of(-32001, "Not found"))
                                                     .example("one", Example.ofValue(IntNode.valueOf(1)))
                                                     .tag("pets", Tag.builder("pets")
                                                                     .summary("Pets")
                                                                     .externalDocs(ExternalDocumentation.of(
                                                                             "https://example.com/pets"))
                                                                     .build())
                                                     .build())
                               .externalDocs(ExternalDocumentation.builder("https://example.com")
                                                                  .description("Docs")
                                                                  .build())
                               .extension("x-owner", "pets-team")
                               .build();

        final String json = codec.encode(document);
        assertThatJson(json).isEqualTo(json(
                "{'openrpc':'1.2.6','info':{'title':'Petstore','contact':{'email':'pets@example.com'}," +
                "'license':{'name':'MIT'},'version':'1.0.0'}," +
                "'methods':[{'name':'list_pets','params':[]," +
                "'result':{'name':'pets','schema':{'type':'array'}}}]," +
                "'components':{'schemas':{'Pet':{'type':'object'}}," +
                "'examples':{'one':{'value':1}},'errors':{'NotFound':{'code':-32001,'message':'Not found'}}," +
                "'tags':{'pets':{'name':'pets','summary':'Pets'," +
                "'externaldocs':{'url':'https://example.com/pets'}}}}," +
                "'externaldocs':{'description':'Docs','url':'https://example.com'}," +
                "'x-owner':'pets-team'}"));
        assertThat(codec.decode(json)).isEqualTo(document);
        assertThat(document.extensions()).containsEntry("x-owner", TextNode.valueOf("pets-team"));
    }

    @Test
    void emptyComponents() {
        final OpenRpcDocument document = OpenRpcDocument.builder("1.2.6", Info.of("t", "1"))
                                                        .components(Components.builder().build())
                                                        .build();
        assertThat(codec.encode(document)).isEqualTo(json(
                "{'openrpc':'1.2.6','info':{'title':'t','version':'1'},'methods':[],'components':{}}"));
    }

    @Test
    void contentDescriptor() {
        final String json = json(
                "{'name':'limit','summary':'Limit','schema':{'type':'integer','x-int-size':32}," +
                "'required':true,'deprecated':true," +
                "'examples':[{'name':'one','params':[{'value':1}]}],'x-position':0}");
        final ContentDescriptor descriptor = codec.decode(json, ContentDescriptor.class);
        assertThat(descriptor.isRequired()).isTrue();
        assertThat(descriptor.isDeprecated()).isTrue();
        assertThat(descriptor.schema().extensions()).containsOnlyKeys("x-int-size");
        assertThat(descriptor.examples()).hasSize(1);
        assertThat(descriptor.extensions()).containsOnlyKeys("x-position");
        assertThat(codec.encode(descriptor)).isEqualTo(json);
    }

    @Test
    void link() {
        final Link link = Link.builder("owner")
                              .summary("The owner")
                              .method("get_owner")
                              .param("ownerId", "$result.ownerId")
                              .server(Server.of("owners", "https://owners.example.com"))
                              .build();
        final String json = codec.encode(link);
        assertThatJson(json).isEqualTo(json(
                "{'name':'owner','summary':'The owner','method':'get_owner'," +
                "'params':{'ownerId':'$result.ownerId'}," +
                "'server':{'name':'owners','url':'https://owners.example.com'}}"));
        final Link decoded = codec.decode(json, Link.class);
        assertThat(decoded).isEqualTo(link);
        assertThat(decoded.params().get("ownerId")).hasToString("$result.ownerId");
    }
}
