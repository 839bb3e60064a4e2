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

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonCreator.Mode;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.primitives.Longs;

/**
 * The code of an {@link ErrorObject}. Any integer may be used, but the codes from {@code -32768}
 * to {@code -32000} are reserved for the errors pre-defined by JSON-RPC 2.0, and the codes from
 * {@link #SERVER_ERROR_START} to {@link #SERVER_ERROR_END} are reserved for implementation-defined
 * server errors.
 */
public final class ErrorCode implements Comparable<ErrorCode> {

    private static final long RESERVED_START = -32768;
    private static final long RESERVED_END = -32000;

    /**
     * Invalid JSON was received by the server.
     */
    public static final ErrorCode PARSE_ERROR = new ErrorCode(-32700);

    /**
     * The JSON sent is not a valid request object.
     */
    public static final ErrorCode INVALID_REQUEST = new ErrorCode(-32600);

    /**
     * The method does not exist or is not available.
     */
    public static final ErrorCode METHOD_NOT_FOUND = new ErrorCode(-32601);

    /**
     * Invalid method parameters.
     */
    public static final ErrorCode INVALID_PARAMS = new ErrorCode(-32602);

    /**
     * Internal JSON-RPC error.
     */
    public static final ErrorCode INTERNAL_ERROR = new ErrorCode(-32603);

    /**
     * The lowest code reserved for implementation-defined server errors.
     */
    public static final ErrorCode SERVER_ERROR_START = new ErrorCode(-32099);

    /**
     * The highest code reserved for implementation-defined server errors.
     */
    public static final ErrorCode SERVER_ERROR_END = new ErrorCode(-32000);

    /**
     * Returns the {@link ErrorCode} of the specified integer.
     */
    @JsonCreator(mode = Mode.DELEGATING)
    public static ErrorCode of(long code) {
        return new ErrorCode(code);
    }

    private final long code;

    private ErrorCode(long code) {
        this.code = code;
    }

    @JsonValue
    public long code() {
        return code;
    }

    /**
     * Returns whether this code is reserved for the errors pre-defined by JSON-RPC 2.0,
     * i.e. it is between {@code -32768} and {@code -32000}.
     */
    public boolean isReserved() {
        return code >= RESERVED_START && code <= RESERVED_END;
    }

    /**
     * Returns whether this code is reserved for implementation-defined server errors,
     * i.e. it is between {@link #SERVER_ERROR_START} and {@link #SERVER_ERROR_END}.
     */
    public boolean isServerError() {
        return code >= SERVER_ERROR_START.code && code <= SERVER_ERROR_END.code;
    }

    @Override
    public int compareTo(ErrorCode o) {
        return Long.compare(code, o.code);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ErrorCode && code == ((ErrorCode) o).code;
    }

    @Override
    public int hashCode() {
        return Longs.hashCode(code);
    }

    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
