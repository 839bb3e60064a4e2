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

/**
 * A method of a JSON-RPC API. The {@link #name()} is used as the {@code method} of a JSON-RPC request
 * and must be unique within an {@link OpenRpcDocument}.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({
        "name", "tags", "summary", "description", "externaldocs", "params", "result", "deprecated",
        "servers", "errors", "links", "paramStructure", "examples"
})
@JsonDeserialize(using = MethodJsonDeserializer.class)
public final class Method {

    /**
     * Returns a new {@link MethodBuilder}.
     *
     * @param name the name of the method
     * @param result the {@link ContentDescriptor} of the result
     */
    public static MethodBuilder builder(String name, ContentDescriptor result) {
        return new MethodBuilder(name, ReferenceOr.of(requireNonNull(result, "result")));
    }

    /**
     * Returns a new {@link MethodBuilder}.
     *
     * @param name the name of the method
     * @param result the {@link ContentDescriptor} of the result or a {@link Reference} to it
     */
    public static MethodBuilder builder(String name, ReferenceOr<ContentDescriptor> result) {
        return new MethodBuilder(name, result);
    }

    private final String name;
    private final List<ReferenceOr<Tag>> tags;
    @Nullable
    private final String summary;
    @Nullable
    private final String description;
    @Nullable
    private final ExternalDocumentation externalDocs;
    private final List<ReferenceOr<ContentDescriptor>> params;
    private final ReferenceOr<ContentDescriptor> result;
    private final boolean deprecated;
    private final List<Server> servers;
    private final List<ReferenceOr<ErrorObject>> errors;
    private final List<ReferenceOr<Link>> links;
    @JsonProperty("paramStructure")
    @Nullable
    private final ParamStructure paramStructure;
    private final List<ReferenceOr<ExamplePairing>> examples;
    private final Map<String, JsonNode> extensions;

    Method(MethodBuilder builder) {
        name = builder.name;
        tags = builder.tags.build();
        summary = builder.summary;
        description = builder.description;
        externalDocs = builder.externalDocs;
        params = builder.params.build();
        result = builder.result;
        deprecated = builder.deprecated;
        servers = builder.servers.build();
        errors = builder.errors.build();
        links = builder.links.build();
        paramStructure = builder.paramStructure;
        examples = builder.examples.build();
        extensions = builder.extensions();
    }

    @JsonProperty
    public String name() {
        return name;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<ReferenceOr<Tag>> tags() {
        return tags;
    }

    @Nullable
    @JsonProperty
    public String summary() {
        return summary;
    }

    @Nullable
    @JsonProperty
    public String description() {
        return description;
    }

    @Nullable
    @JsonProperty("externaldocs")
    public ExternalDocumentation externalDocs() {
        return externalDocs;
    }

    /**
     * Returns the {@link ContentDescriptor}s of the parameters. The required parameters come before
     * the optional ones.
     */
    @JsonProperty
    public List<ReferenceOr<ContentDescriptor>> params() {
        return params;
    }

    @JsonProperty
    public ReferenceOr<ContentDescriptor> result() {
        return result;
    }

    @JsonProperty("deprecated")
    @JsonInclude(Include.NON_DEFAULT)
    public boolean isDeprecated() {
        return deprecated;
    }

    /**
     * Returns the {@link Server}s which serve this method in place of {@link OpenRpcDocument#servers()}.
     */
    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<Server> servers() {
        return servers;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<ReferenceOr<ErrorObject>> errors() {
        return errors;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<ReferenceOr<Link>> links() {
        return links;
    }

    /**
     * Returns the expected structure of the {@code params}, which is {@link ParamStructure#BY_POSITION}
     * if not specified.
     */
    public ParamStructure paramStructure() {
        return paramStructure != null ? paramStructure : ParamStructure.BY_POSITION;
    }

    /**
     * Returns whether {@code paramStructure} was specified.
     */
    public boolean hasParamStructure() {
        return paramStructure != null;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public List<ReferenceOr<ExamplePairing>> examples() {
        return examples;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> extensions() {
        return extensions;
    }

    /**
     * Returns a new {@link MethodBuilder} initialized with the properties of this {@link Method}.
     */
    public MethodBuilder toBuilder() {
        return new MethodBuilder(this);
    }

    @Nullable
    ParamStructure rawParamStructure() {
        return paramStructure;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Method)) {
            return false;
        }
        final Method that = (Method) o;
        return name.equals(that.name) &&
               tags.equals(that.tags) &&
               Objects.equals(summary, that.summary) &&
               Objects.equals(description, that.description) &&
               Objects.equals(externalDocs, that.externalDocs) &&
               params.equals(that.params) &&
               result.equals(that.result) &&
               deprecated == that.deprecated &&
               servers.equals(that.servers) &&
               errors.equals(that.errors) &&
               links.equals(that.links) &&
               paramStructure == that.paramStructure &&
               examples.equals(that.examples) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tags, summary, description, externalDocs, params, result, deprecated,
                            servers, errors, links, paramStructure, examples, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("tags", tags.isEmpty() ? null : tags)
                          .add("summary", summary)
                          .add("description", description)
                          .add("externalDocs", externalDocs)
                          .add("params", params)
                          .add("result", result)
                          .add("deprecated", deprecated)
                          .add("servers", servers.isEmpty() ? null : servers)
                          .add("errors", errors.isEmpty() ? null : errors)
                          .add("links", links.isEmpty() ? null : links)
                          .add("paramStructure", paramStructure)
                          .add("examples", examples.isEmpty() ? null : examples)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
