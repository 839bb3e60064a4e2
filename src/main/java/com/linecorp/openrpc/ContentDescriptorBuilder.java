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
 * Builds a new {@link ContentDescriptor}.
 */
public final class ContentDescriptorBuilder extends AbstractExtensibleBuilder<ContentDescriptorBuilder> {

    private final String name;
    private final JsonSchema schema;
    @Nullable
    String summary;
    @Nullable
    String description;
    boolean required;
    boolean deprecated;
    final ImmutableList.Builder<ExamplePairing> examples = ImmutableList.builder();

    ContentDescriptorBuilder(String name, JsonSchema schema) {
        this.name = requireNonNull(name, "name");
        this.schema = requireNonNull(schema, "schema");
    }

    public ContentDescriptorBuilder summary(String summary) {
        this.summary = requireNonNull(summary, "summary");
        return this;
    }

    public ContentDescriptorBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    public ContentDescriptorBuilder required(boolean required) {
        this.required = required;
        return this;
    }

    public ContentDescriptorBuilder deprecated(boolean deprecated) {
        this.deprecated = deprecated;
        return this;
    }

    public ContentDescriptorBuilder examples(ExamplePairing... examples) {
        return examples(ImmutableList.copyOf(requireNonNull(examples, "examples")));
    }

    public ContentDescriptorBuilder examples(Iterable<ExamplePairing> examples) {
        this.examples.addAll(requireNonNull(examples, "examples"));
        return this;
    }

    /**
     * Returns a newly-created {@link ContentDescriptor} based on the properties set so far.
     */
    public ContentDescriptor build() {
        return new ContentDescriptor(name, summary, description, schema, required, deprecated,
                                     examples.build(), extensions());
    }
}
