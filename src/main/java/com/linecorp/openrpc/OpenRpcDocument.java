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

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The root object of an <a href="https://spec.open-rpc.org/">OpenRPC</a> document, which describes
 * a JSON-RPC 2.0 API.
 *
 * <p>An {@link OpenRpcDocument} is immutable. Use {@link OpenRpcCodec} to decode one from JSON or to
 * encode one into JSON.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "openrpc", "info", "servers", "methods", "components", "externaldocs" })
@JsonDeserialize(using = OpenRpcDocumentJsonDeserializer.class)
public final class OpenRpcDocument {

    /**
     * Returns a new {@link OpenRpcDocumentBuilder}.
     *
     * @param openrpc the version of the OpenRPC specification the document uses, such as
     *                {@code "1.2.6"}. It is not checked against semantic versioning.
     * @param info the metadata about the API
     */
    public static OpenRpcDocumentBuilder builder(String openrpc, Info info) {
        return new OpenRpcDocumentBuilder(openrpc, info);
    }

    private final String openrpc;
    private final Info info;
    private final List<Server> servers;
    private final List<Method> methods;
    @Nullable
    private final Components components;
    @Nullable
    private final ExternalDocumentation externalDocs;
    private final Map<String, JsonNode> extensions;

    OpenRpcDocument(String openrpc, Info info, List<Server> servers, List<Method> methods,
                    @Nullable Components components, @Nullable ExternalDocumentation externalDocs,
                    Map<String, JsonNode> extensions) {
        this.openrpc = requireNonNull(openrpc, "openrpc");
        this.info = requireNonNull(info, "info");
        this.servers = servers;
        this.methods = methods;
        this.components = components;
        this.externalDocs = externalDocs;
        this.extensions = extensions;
    }

    /**
     * Returns the version of the OpenRPC specification the document uses.
     */
    @JsonProperty
    public String openrpc() {
        return openrpc;
    }

    @JsonProperty
    public Info info() {
        return info;
    }

    /**
     * Returns the {@link Server}s specified in the document, which may be empty.
     *
     * @see #serversOrDefault()
     */
    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<Server> servers() {
        return servers;
    }

    /**
     * Returns the {@link Server}s specified in the document, or a list of {@link Server#localhost()}
     * if none is specified.
     */
    public List<Server> serversOrDefault() {
        return servers.isEmpty() ? ImmutableList.of(Server.localhost()) : servers;
    }

    /**
     * Returns the {@link Method}s of the API, which may be empty.
     */
    @JsonProperty
    public List<Method> methods() {
        return methods;
    }

    /**
     * Returns the first {@link Method} with the specified name, or {@code null} if there is no such
     * {@link Method}.
     */
    @Nullable
    public Method method(String name) {
        requireNonNull(name, "name");
        for (Method method : methods) {
            if (method.name().equals(name)) {
                return method;
            }
        }
        return null;
    }

    @Nullable
    @JsonProperty
    public Components components() {
        return components;
    }

    @Nullable
    @JsonProperty("externaldocs")
    public ExternalDocumentation externalDocs() {
        return externalDocs;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> extensions() {
        return extensions;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OpenRpcDocument)) {
            return false;
        }
        final OpenRpcDocument that = (OpenRpcDocument) o;
        return openrpc.equals(that.openrpc) &&
               info.equals(that.info) &&
               servers.equals(that.servers) &&
               methods.equals(that.methods) &&
               Objects.equals(components, that.components) &&
               Objects.equals(externalDocs, that.externalDocs) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(openrpc, info, servers, methods, components, externalDocs, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("openrpc", openrpc)
                          .add("info", info)
                          .add("servers", servers.isEmpty() ? null : servers)
                          .add("methods", methods)
                          .add("components", components)
                          .add("externalDocs", externalDocs)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
