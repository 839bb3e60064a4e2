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

/**
 * The type of an {@link OpenRpcDecodeException}.
 */
public enum DecodeErrorType {
    /**
     * The input is not a syntactically valid JSON document.
     */
    MALFORMED_JSON,
    /**
     * A value does not have any of the shapes allowed at its position, for example {@code items} is
     * a number or {@code paramStructure} is {@code "by-magic"}.
     */
    INVALID_SHAPE,
    /**
     * A field is neither known nor an extension field while {@link UnknownFieldPolicy#STRICT} is in use.
     */
    UNKNOWN_FIELD,
    /**
     * A required field is absent or {@code null}.
     */
    MISSING_REQUIRED
}
