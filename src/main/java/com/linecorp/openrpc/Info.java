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
 * Metadata about an API, which may be presented by documentation tools.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "title", "description", "termsOfService", "contact", "license", "version" })
@JsonDeserialize(using = InfoJsonDeserializer.class)
public final class Info {

    /**
     * Returns a new {@link Info} with the specified title and version.
     */
    public static Info of(String title, String version) {
        return builder(title, version).build();
    }

    /**
     * Returns a new {@link InfoBuilder}.
     *
     * @param title the title of the application
     * @param version the version of the OpenRPC document, which is distinct from the version of
     *                the OpenRPC specification and of the API implementation
     */
    public static InfoBuilder builder(String title, String version) {
        return new InfoBuilder(title, version);
    }

    private final String title;
    @Nullable
    private final String description;
    @Nullable
    private final String termsOfService;
    @Nullable
    private final Contact contact;
    @Nullable
    private final License license;
    private final String version;
    private final Map<String, JsonNode> extensions;

    Info(String title, @Nullable String description, @Nullable String termsOfService,
         @Nullable Contact contact, @Nullable License license, String version,
         Map<String, JsonNode> extensions) {
        this.title = requireNonNull(title, "title");
        this.description = description;
        this.termsOfService = termsOfService;
        this.contact = contact;
        this.license = license;
        this.version = requireNonNull(version, "version");
        this.extensions = extensions;
    }

    @JsonProperty
    public String title() {
        return title;
    }

    @Nullable
    @JsonProperty
    public String description() {
        return description;
    }

    /**
     * Returns the URL of the Terms of Service of the API.
     */
    @Nullable
    @JsonProperty
    public String termsOfService() {
        return termsOfService;
    }

    @Nullable
    @JsonProperty
    public Contact contact() {
        return contact;
    }

    @Nullable
    @JsonProperty
    public License license() {
        return license;
    }

    @JsonProperty
    public String version() {
        return version;
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
        if (!(o instanceof Info)) {
            return false;
        }
        final Info that = (Info) o;
        return title.equals(that.title) &&
               Objects.equals(description, that.description) &&
               Objects.equals(termsOfService, that.termsOfService) &&
               Objects.equals(contact, that.contact) &&
               Objects.equals(license, that.license) &&
               version.equals(that.version) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, description, termsOfService, contact, license, version, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("title", title)
                          .add("description", description)
                          .add("termsOfService", termsOfService)
                          .add("contact", contact)
                          .add("license", license)
                          .add("version", version)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
