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

/**
 * Builds a new {@link Info}.
 */
public final class InfoBuilder extends AbstractExtensibleBuilder<InfoBuilder> {

    private final String title;
    private final String version;
    @Nullable
    String description;
    @Nullable
    String termsOfService;
    @Nullable
    Contact contact;
    @Nullable
    License license;

    InfoBuilder(String title, String version) {
        this.title = requireNonNull(title, "title");
        this.version = requireNonNull(version, "version");
    }

    public InfoBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    public InfoBuilder termsOfService(String termsOfService) {
        this.termsOfService = requireNonNull(termsOfService, "termsOfService");
        return this;
    }

    public InfoBuilder contact(Contact contact) {
        this.contact = requireNonNull(contact, "contact");
        return this;
    }

    public InfoBuilder license(License license) {
        this.license = requireNonNull(license, "license");
        return this;
    }

    /**
     * Returns a newly-created {@link Info} based on the properties set so far.
     */
    public Info build() {
        return new Info(title, description, termsOfService, contact, license, version, extensions());
    }
}
