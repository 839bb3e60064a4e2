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
 * An application-level error which a {@link Method} may return.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "code", "message", "data" })
@JsonDeserialize(using = ErrorObjectJsonDeserializer.class)
public final class ErrorObject {

    /**
     * Returns a new {@link ErrorObject} with the specified code and message.
     */
    public static ErrorObject of(ErrorCode code, String message) {
        return builder(code, message).build();
    }

    /**
     * Returns a new {@link ErrorObject} with the specified code and message.
     */
    public static ErrorObject of(long code, String message) {
        return builder(ErrorCode.of(code), message).build();
    }

    /**
     * Returns a new {@link ErrorObjectBuilder}.
     */
    public static ErrorObjectBuilder builder(ErrorCode code, String message) {
        return new ErrorObjectBuilder(code, message);
    }

    private final ErrorCode code;
    private final String message;
    @Nullable
    private final JsonNode data;
    private final Map<String, JsonNode> extensions;

    ErrorObject(ErrorCode code, String message, @Nullable JsonNode data, Map<String, JsonNode> extensions) {
        this.code = requireNonNull(code, "code");
        this.message = requireNonNull(message, "message");
        this.data = data;
        this.extensions = extensions;
    }

    @JsonProperty
    public ErrorCode code() {
        return code;
    }

    /**
     * Returns the short description of the error.
     */
    @JsonProperty
    public String message() {
        return message;
    }

    /**
     * Returns the additional information about the error, or {@code null} if absent.
     */
    @Nullable
    @JsonProperty
    public JsonNode data() {
        return data;
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
        if (!(o instanceof ErrorObject)) {
            return false;
        }
        final ErrorObject that = (ErrorObject) o;
        return code.equals(that.code) &&
               message.equals(that.message) &&
               Objects.equals(data, that.data) &&
               extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, data, extensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                          .add("code", code)
                          .add("message", message)
                          .add("data", data)
                          .add("extensions", extensions.isEmpty() ? null : extensions)
                          .toString();
    }
}
