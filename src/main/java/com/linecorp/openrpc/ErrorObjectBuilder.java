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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds a new {@link ErrorObject}.
 */
public final class ErrorObjectBuilder extends AbstractExtensibleBuilder<ErrorObjectBuilder> {

    private final ErrorCode code;
    private final String message;
    @Nullable
    JsonNode data;

    ErrorObjectBuilder(ErrorCode code, String message) {
        this.code = requireNonNull(code, "code");
        this.message = requireNonNull(message, "message");
    }

    /**
     * Sets the additional information about the error. Use
     * {@link com.fasterxml.jackson.databind.node.NullNode} for {@code null}.
     */
    public ErrorObjectBuilder data(JsonNode data) {
        this.data = requireNonNull(data, "data");
        return this;
    }

    /**
     * Returns a newly-created {@link ErrorObject} based on the properties set so far.
     */
    public ErrorObject build() {
        return new ErrorObject(code, message, data, extensions());
    }
}
