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
 * The license of an API.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "name", "url" })
@JsonDeserialize(using = LicenseJsonDeserializer.class)
public final class License {

    /**
     * Returns a new {@link License} with the specified name.
     */
    public static License of(String name) {
        return builder(name).build();
    }

    /**
     * Returns a new {@link License} with the specified name and URL.
     */
    public static License of(String name, String url) {
        return builder(name).url(url).build();
    }

    /**
     * Returns a new {@link LicenseBuilder}.
     */
    public static LicenseBuilder builder(String name) {
        return new LicenseBuilder(name);
    }

    private final String name;
    @Nullable
    private final String url;
    private final Map<String, JsonNode> extensions;

    License(String name, @Nullable String url, Map<String, JsonNode> extensions) {
        this.name = requireNonNull(name, "name");
        this.url = url;
        this.extensions = extensions;
    }

    @JsonProperty
    public String name() {
        return name;
    }

    @Nullable
    @JsonProperty
    public String url() {
        return url;
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
        if (!(o instanceof License)) {
            return false;
        }
        final License that = (License) o;
        return name.equals(that.name) && Objects.equals(url, that.url) && extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, url, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("name", name)
                          .add("url", url)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
