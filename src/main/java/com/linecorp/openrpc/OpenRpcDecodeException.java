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
 * An {@link IllegalArgumentException} raised when an OpenRPC document or a part of it cannot be decoded.
 * The {@link #path()} tells where the problem is found, such as {@code methods[0].params[1].schema.items}.
 */
public final class OpenRpcDecodeException extends IllegalArgumentException {

    private static final long serialVersionUID = 2760812418962407723L;

    private final DecodeErrorType type;
    private final String path;

    /**
     * Creates a new instance.
     *
     * @param type the type of the error
     * @param path the path of the field where the error is found, or an empty string for the root
     * @param message the detail message
     * @param cause the Jackson exception which caused the error
     */
    public OpenRpcDecodeException(DecodeErrorType type, String path, String message,
                                  @Nullable Throwable cause) {
        super(requireNonNull(type, "type") + (requireNonNull(path, "path").isEmpty() ? "" : " at " + path) +
              ": " + requireNonNull(message, "message"), cause);
        this.type = type;
        this.path = path;
    }

    public DecodeErrorType type() {
        return type;
    }

    /**
     * Returns the path of the field where the error is found, or an empty string if the error is found
     * at the root or is not related to any field.
     */
    public String path() {
        return path;
    }
}
