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

import org.jspecify.annotations.Nullable;

import com.google.common.collect.ImmutableList;

/**
 * Builds a new {@link OpenRpcDocument}.
 */
public final class OpenRpcDocumentBuilder extends AbstractExtensibleBuilder<OpenRpcDocumentBuilder> {

    private final String openrpc;
    private final Info info;
    private final ImmutableList.Builder<Server> servers = ImmutableList.builder();
    private final ImmutableList.Builder<Method> methods = ImmutableList.builder();
    @Nullable
    Components components;
    @Nullable
    ExternalDocumentation externalDocs;

    OpenRpcDocumentBuilder(String openrpc, Info info) {
        this.openrpc = requireNonNull(openrpc, "openrpc");
        this.info = requireNonNull(info, "info");
    }

    public OpenRpcDocumentBuilder servers(Server... servers) {
        return servers(ImmutableList.copyOf(requireNonNull(servers, "servers")));
    }

    public OpenRpcDocumentBuilder servers(Iterable<Server> servers) {
        this.servers.addAll(requireNonNull(servers, "servers"));
        return this;
    }

    public OpenRpcDocumentBuilder methods(Method... methods) {
        return methods(ImmutableList.copyOf(requireNonNull(methods, "methods")));
    }

    public OpenRpcDocumentBuilder methods(Iterable<Method> methods) {
        this.methods.addAll(requireNonNull(methods, "methods"));
        return this;
    }

    public OpenRpcDocumentBuilder components(Components components) {
        this.components = requireNonNull(components, "components");
        return this;
    }

    public OpenRpcDocumentBuilder externalDocs(ExternalDocumentation externalDocs) {
        this.externalDocs = requireNonNull(externalDocs, "externalDocs");
        return this;
    }

    /**
     * Returns a newly-created {@link OpenRpcDocument} based on the properties set so far.
     */
    public OpenRpcDocument build() {
        return new OpenRpcDocument(openrpc, info, servers.build(), methods.build(), components, externalDocs,
                                   extensions());
    }
}
