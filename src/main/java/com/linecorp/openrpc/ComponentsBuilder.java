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

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Builds a new {@link Components}.
 */
public final class ComponentsBuilder extends AbstractExtensibleBuilder<ComponentsBuilder> {

    private final Map<String, ContentDescriptor> contentDescriptors = new LinkedHashMap<>();
    private final Map<String, JsonSchema> schemas = new LinkedHashMap<>();
    private final Map<String, Example> examples = new LinkedHashMap<>();
    private final Map<String, Link> links = new LinkedHashMap<>();
    private final Map<String, ErrorObject> errors = new LinkedHashMap<>();
    private final Map<String, ExamplePairing> examplePairingObjects = new LinkedHashMap<>();
    private final Map<String, Tag> tags = new LinkedHashMap<>();

    ComponentsBuilder() {}

    public ComponentsBuilder contentDescriptor(String name, ContentDescriptor contentDescriptor) {
        return put(contentDescriptors, name, contentDescriptor, "contentDescriptor");
    }

    public ComponentsBuilder contentDescriptors(Map<String, ContentDescriptor> contentDescriptors) {
        requireNonNull(contentDescriptors, "contentDescriptors").forEach(this::contentDescriptor);
        return this;
    }

    public ComponentsBuilder schema(String name, JsonSchema schema) {
        return put(schemas, name, schema, "schema");
    }

    public ComponentsBuilder schemas(Map<String, JsonSchema> schemas) {
        requireNonNull(schemas, "schemas").forEach(this::schema);
        return this;
    }

    public ComponentsBuilder example(String name, Example example) {
        return put(examples, name, example, "example");
    }

    public ComponentsBuilder examples(Map<String, Example> examples) {
        requireNonNull(examples, "examples").forEach(this::example);
        return this;
    }

    public ComponentsBuilder link(String name, Link link) {
        return put(links, name, link, "link");
    }

    public ComponentsBuilder links(Map<String, Link> links) {
        requireNonNull(links, "links").forEach(this::link);
        return this;
    }

    public ComponentsBuilder error(String name, ErrorObject error) {
        return put(errors, name, error, "error");
    }

    public ComponentsBuilder errors(Map<String, ErrorObject> errors) {
        requireNonNull(errors, "errors").forEach(this::error);
        return this;
    }

    public ComponentsBuilder examplePairingObject(String name, ExamplePairing examplePairing) {
        return put(examplePairingObjects, name, examplePairing, "examplePairing");
    }

    public ComponentsBuilder examplePairingObjects(Map<String, ExamplePairing> examplePairingObjects) {
        requireNonNull(examplePairingObjects, "examplePairingObjects").forEach(this::examplePairingObject);
        return this;
    }

    public ComponentsBuilder tag(String name, Tag tag) {
        return put(tags, name, tag, "tag");
    }

    public ComponentsBuilder tags(Map<String, Tag> tags) {
        requireNonNull(tags, "tags").forEach(this::tag);
        return this;
    }

    private <T> ComponentsBuilder put(Map<String, T> map, String name, T value, String valueName) {
        map.put(requireNonNull(name, "name"), requireNonNull(value, valueName));
        return this;
    }

    /**
     * Returns a newly-created {@link Components} based on the properties set so far.
     */
    public Components build() {
        return new Components(ImmutableMap.copyOf(contentDescriptors), ImmutableMap.copyOf(schemas),
                              ImmutableMap.copyOf(examples), ImmutableMap.copyOf(links),
                              ImmutableMap.copyOf(errors), ImmutableMap.copyOf(examplePairingObjects),
                              ImmutableMap.copyOf(tags), extensions());
    }
}
