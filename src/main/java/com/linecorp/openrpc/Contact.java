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
 * The contact information of an API.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "url", "email" })
@JsonDeserialize(using = ContactJsonDeserializer.class)
public final class Contact {

    /**
     * Returns a new {@link ContactBuilder}.
     */
    public static ContactBuilder builder() {
        return new ContactBuilder();
    }

    @Nullable
    private final String name;
    @Nullable
    private final String url;
    @Nullable
    private final String email;
    private final Map<String, JsonNode> extensions;

    Contact(@Nullable String name, @Nullable String url, @Nullable String email,
            Map<String, JsonNode> extensions) {
        this.name = name;
        this.url = url;
        this.email = email;
        this.extensions = extensions;
    }

    /**
     * Returns the name of the contact person or organization.
     */
    @Nullable
    @JsonProperty
    public String name() {
        return name;
    }

    @Nullable
    @JsonProperty
    public String url() {
        return url;
    }

    @Nullable
    @JsonProperty
    public String email() {
        return email;
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
        if (!(o instanceof Contact)) {
            return false;
        }
        final Contact that = (Contact) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(url, that.url) &&
               Objects.equals(email, that.email) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, url, email, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("url", url)
                          .add("email", email)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
