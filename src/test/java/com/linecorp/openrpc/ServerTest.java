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

import com.google.common.collect.ImmutableMap;

class ServerTest {

    private static final Server server =
            Server.builder("production", "https://{region}.example.com:{port}/{path}")
                  .variable("region", ServerVariable.builder("us-east")
                                                    .enumValues("us-east", "eu-west")
                                                    .description("Region")
                                                    .build())
                  .variable("port", ServerVariable.of("8443"))
                  .build();

    @Test
    void substituteVariables() {
        assertThat(server.url(ImmutableMap.of("region", "eu-west")))
                .isEqualTo("https://eu-west.example.com:8443/{path}");
        assertThat(server.url(ImmutableMap.of("path", "rpc", "port", "443")))
                .isEqualTo("https://us-east.example.com:443/rpc");
        assertThat(server.url()).isEqualTo("https://{region}.example.com:{port}/{path}");
    }

    @Test
    void replacementIsLiteral() {
        final Server server = Server.of("s", "http://{host}/");
        assertThat(server.url(ImmutableMap.of("host", "$1\\x"))).isEqualTo("http://$1\\x/");
    }

    @Test
    void localhost() {
        assertThat(Server.localhost().name()).isEqualTo("default");
        assertThat(Server.localhost().url()).isEqualTo("localhost");
    }

    @Test
    void encode() {
        assertThatJson(OpenRpcCodec.of().encode(server)).isEqualTo(json(
                "{'name':'production','url':'https://{region}.example.com:{port}/{path}'," +
                "'variables':{'region':{'enum':['us-east','eu-west'],'default':'us-east'," +
                "'description':'Region'},'port':{'default':'8443'}}}"));
    }

    @Test
    void serverVariableExtensions() {
        final String json = json("{'default':'a','x-label':'A'}");
        final ServerVariable variable = OpenRpcCodec.of().decode(json, ServerVariable.class);
        assertThat(variable.defaultValue()).isEqualTo("a");
        assertThat(variable.enumValues()).isEmpty();
        assertThat(variable.extensions()).containsOnlyKeys("x-label");
        assertThatJson(OpenRpcCodec.of().encode(variable)).isEqualTo(json);
    }
}
