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
 * A set of reusable objects, keyed by their names. An object in {@link Components} has no effect
 * unless it is referred to by a {@link Reference} from outside.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({
        "contentDescriptors", "schemas", "examples", "links", "errors", "examplePairingObjects", "tags"
})
@JsonDeserialize(using = ComponentsJsonDeserializer.class)
public final class Components {

    /**
     * Returns a new {@link ComponentsBuilder}.
     */
    public static ComponentsBuilder builder() {
        return new ComponentsBuilder();
    }

    private final Map<String, ContentDescriptor> contentDescriptors;
    private final Map<String, JsonSchema> schemas;
    private final Map<String, Example> examples;
    private final Map<String, Link> links;
    private final Map<String, ErrorObject> errors;
    private final Map<String, ExamplePairing> examplePairingObjects;
    private final Map<String, Tag> tags;
    private final Map<String, JsonNode> extensions;

    Components(Map<String, ContentDescriptor> contentDescriptors, Map<String, JsonSchema> schemas,
               Map<String, Example> examples, Map<String, Link> links, Map<String, ErrorObject> errors,
               Map<String, ExamplePairing> examplePairingObjects, Map<String, Tag> tags,
               Map<String, JsonNode> extensions) {
        this.contentDescriptors = contentDescriptors;
        this.schemas = schemas;
        this.examples = examples;
        this.links = links;
        this.errors = errors;
        this.examplePairingObjects = examplePairingObjects;
        this.tags = tags;
        this.extensions = extensions;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, ContentDescriptor> contentDescriptors() {
        return contentDescriptors;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, JsonSchema> schemas() {
        return schemas;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, Example> examples() {
        return examples;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, Link> links() {
        return links;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, ErrorObject> errors() {
        return errors;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, ExamplePairing> examplePairingObjects() {
        return examplePairingObjects;
    }

    @JsonProperty
    @JsonInclude(Include.NON_EMPTY)
    public Map<String, Tag> tags() {
        return tags;
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
        if (!(o instanceof Components)) {
            return false;
        }
        final Components that = (Components) o;
        return contentDescriptors.equals(that.contentDescriptors) &&
               schemas.equals(that.schemas) &&
               examples.equals(that.examples) &&
               links.equals(that.links) &&
               errors.equals(that.errors) &&
               examplePairingObjects.equals(that.examplePairingObjects) &&
               tags.equals(that.tags) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentDescriptors, schemas, examples, links, errors, examplePairingObjects,
                            tags, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("contentDescriptors", contentDescriptors)
                          .add("schemas", schemas)
                          .add("examples", examples)
                          .add("links", links)
                          .add("errors", errors)
                          .add("examplePairingObjects", examplePairingObjects)
                          .add("tags", tags)
                          .add("extensions", extensions)
                          .toString();
    }
}
