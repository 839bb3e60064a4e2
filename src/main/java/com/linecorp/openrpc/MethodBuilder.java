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
import com.google.common.collect.Iterables;

/**
 * Builds a new {@link Method}.
 *
 * <pre>{@code
 * Method method =
 *     Method.builder("list_pets", ContentDescriptor.of("pets", Schema.ofType("array")))
 *           .params(ContentDescriptor.builder("limit", Schema.ofType("integer"))
 *                                    .required(true)
 *                                    .build())
 *           .paramStructure(ParamStructure.BY_NAME)
 *           .extension("x-internal-id", "42")
 *           .build();
 * }</pre>
 */
public final class MethodBuilder extends AbstractExtensibleBuilder<MethodBuilder> {

    final String name;
    final ImmutableList.Builder<ReferenceOr<Tag>> tags = ImmutableList.builder();
    @Nullable
    String summary;
    @Nullable
    String description;
    @Nullable
    ExternalDocumentation externalDocs;
    final ImmutableList.Builder<ReferenceOr<ContentDescriptor>> params = ImmutableList.builder();
    ReferenceOr<ContentDescriptor> result;
    boolean deprecated;
    final ImmutableList.Builder<Server> servers = ImmutableList.builder();
    final ImmutableList.Builder<ReferenceOr<ErrorObject>> errors = ImmutableList.builder();
    final ImmutableList.Builder<ReferenceOr<Link>> links = ImmutableList.builder();
    @Nullable
    ParamStructure paramStructure;
    final ImmutableList.Builder<ReferenceOr<ExamplePairing>> examples = ImmutableList.builder();

    MethodBuilder(String name, ReferenceOr<ContentDescriptor> result) {
        this.name = requireNonNull(name, "name");
        this.result = requireNonNull(result, "result");
    }

    MethodBuilder(Method method) {
        name = method.name();
        tags.addAll(method.tags());
        summary = method.summary();
        description = method.description();
        externalDocs = method.externalDocs();
        params.addAll(method.params());
        result = method.result();
        deprecated = method.isDeprecated();
        servers.addAll(method.servers());
        errors.addAll(method.errors());
        links.addAll(method.links());
        paramStructure = method.rawParamStructure();
        examples.addAll(method.examples());
        extensions(method.extensions());
    }

    public MethodBuilder tags(Tag... tags) {
        return tags(ImmutableList.copyOf(requireNonNull(tags, "tags")));
    }

    public MethodBuilder tags(Iterable<Tag> tags) {
        this.tags.addAll(Iterables.transform(requireNonNull(tags, "tags"), ReferenceOr::of));
        return this;
    }

    /**
     * Adds the specified {@link Tag} or {@link Reference} to a {@link Tag}.
     */
    public MethodBuilder addTag(ReferenceOr<Tag> tag) {
        tags.add(requireNonNull(tag, "tag"));
        return this;
    }

    public MethodBuilder summary(String summary) {
        this.summary = requireNonNull(summary, "summary");
        return this;
    }

    public MethodBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    public MethodBuilder externalDocs(ExternalDocumentation externalDocs) {
        this.externalDocs = requireNonNull(externalDocs, "externalDocs");
        return this;
    }

    /**
     * Adds the specified parameters. The required parameters must be added before the optional ones.
     */
    public MethodBuilder params(ContentDescriptor... params) {
        return params(ImmutableList.copyOf(requireNonNull(params, "params")));
    }

    /**
     * Adds the specified parameters. The required parameters must be added before the optional ones.
     */
    public MethodBuilder params(Iterable<ContentDescriptor> params) {
        this.params.addAll(Iterables.transform(requireNonNull(params, "params"), ReferenceOr::of));
        return this;
    }

    /**
     * Adds the specified parameter or {@link Reference} to a parameter.
     */
    public MethodBuilder addParam(ReferenceOr<ContentDescriptor> param) {
        params.add(requireNonNull(param, "param"));
        return this;
    }

    public MethodBuilder result(ContentDescriptor result) {
        return result(ReferenceOr.of(requireNonNull(result, "result")));
    }

    public MethodBuilder result(ReferenceOr<ContentDescriptor> result) {
        this.result = requireNonNull(result, "result");
        return this;
    }

    public MethodBuilder deprecated(boolean deprecated) {
        this.deprecated = deprecated;
        return this;
    }

    public MethodBuilder servers(Server... servers) {
        return servers(ImmutableList.copyOf(requireNonNull(servers, "servers")));
    }

    public MethodBuilder servers(Iterable<Server> servers) {
        this.servers.addAll(requireNonNull(servers, "servers"));
        return this;
    }

    public MethodBuilder errors(ErrorObject... errors) {
        return errors(ImmutableList.copyOf(requireNonNull(errors, "errors")));
    }

    public MethodBuilder errors(Iterable<ErrorObject> errors) {
        this.errors.addAll(Iterables.transform(requireNonNull(errors, "errors"), ReferenceOr::of));
        return this;
    }

    public MethodBuilder addError(ReferenceOr<ErrorObject> error) {
        errors.add(requireNonNull(error, "error"));
        return this;
    }

    public MethodBuilder links(Link... links) {
        return links(ImmutableList.copyOf(requireNonNull(links, "links")));
    }

    public MethodBuilder links(Iterable<Link> links) {
        this.links.addAll(Iterables.transform(requireNonNull(links, "links"), ReferenceOr::of));
        return this;
    }

    public MethodBuilder addLink(ReferenceOr<Link> link) {
        links.add(requireNonNull(link, "link"));
        return this;
    }

    public MethodBuilder paramStructure(ParamStructure paramStructure) {
        this.paramStructure = requireNonNull(paramStructure, "paramStructure");
        return this;
    }

    public MethodBuilder examples(ExamplePairing... examples) {
        return examples(ImmutableList.copyOf(requireNonNull(examples, "examples")));
    }

    public MethodBuilder examples(Iterable<ExamplePairing> examples) {
        this.examples.addAll(Iterables.transform(requireNonNull(examples, "examples"), ReferenceOr::of));
        return this;
    }

    public MethodBuilder addExample(ReferenceOr<ExamplePairing> example) {
        examples.add(requireNonNull(example, "example"));
        return this;
    }

    /**
     * Returns a newly-created {@link Method} based on the properties set so far.
     */
    public Method build() {
        return new Method(this);
    }
}
