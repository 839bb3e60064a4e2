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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

/**
 * A {@link MismatchedInputException} raised when a JSON value does not have any of the shapes allowed
 * at its position, for example when {@code items} is a number or {@code info} is an array.
 */
public final class InvalidShapeException extends MismatchedInputException {

    private static final long serialVersionUID = -2183473582766930812L;

    /**
     * Returns a new {@link InvalidShapeException}.
     */
    public static InvalidShapeException of(@Nullable JsonParser parser, Class<?> targetType, String message) {
        return new InvalidShapeException(parser, message, targetType);
    }

    private InvalidShapeException(@Nullable JsonParser parser, String message, Class<?> targetType) {
        super(parser, message, targetType);
    }
}
