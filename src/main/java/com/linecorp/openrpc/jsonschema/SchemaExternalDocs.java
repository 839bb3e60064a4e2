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
package com.linecorp.openrpc.jsonschema;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.MoreObjects;

/**
 * The {@code externalDocs} of a {@link Schema}, which refers to an external resource for extended
 * documentation.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "description", "url" })
@JsonDeserialize(using = SchemaExternalDocsJsonDeserializer.class)
public final class SchemaExternalDocs {

    /**
     * Returns a new {@link SchemaExternalDocs} which refers to the specified URL.
     */
    public static SchemaExternalDocs of(String url) {
        return new SchemaExternalDocs(null, requireNonNull(url, "url"));
    }

    /**
     * Returns a new {@link SchemaExternalDocs} which refers to the specified URL.
     */
    public static SchemaExternalDocs of(String description, String url) {
        return new SchemaExternalDocs(requireNonNull(description, "description"),
                                      requireNonNull(url, "url"));
    }

    @Nullable
    private final String description;
    private final String url;

    private SchemaExternalDocs(@Nullable String description, String url) {
        this.description = description;
        this.url = url;
    }

    @Nullable
    @JsonProperty
    public String description() {
        return description;
    }

    @JsonProperty
    public String url() {
        return url;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaExternalDocs)) {
            return false;
        }
        final SchemaExternalDocs that = (SchemaExternalDocs) o;
        return Objects.equals(description, that.description) && url.equals(that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, url);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("description", description)
                          .add("url", url)
                          .toString();
    }
}
