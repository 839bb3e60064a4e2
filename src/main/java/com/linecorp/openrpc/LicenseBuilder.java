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
 * Builds a new {@link License}.
 */
public final class LicenseBuilder extends AbstractExtensibleBuilder<LicenseBuilder> {

    private final String name;
    @Nullable
    String url;

    LicenseBuilder(String name) {
        this.name = requireNonNull(name, "name");
    }

    public LicenseBuilder url(String url) {
        this.url = requireNonNull(url, "url");
        return this;
    }

    /**
     * Returns a newly-created {@link License} based on the properties set so far.
     */
    public License build() {
        return new License(name, url, extensions());
    }
}
