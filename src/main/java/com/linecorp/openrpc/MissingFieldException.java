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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

/**
 * A {@link MismatchedInputException} raised when a field documented as required is absent
 * or {@code null}.
 */
public final class MissingFieldException extends MismatchedInputException {

    private static final long serialVersionUID = 8422151398466307519L;

    /**
     * Returns a new {@link MissingFieldException} for the specified field of the specified type.
     */
    public static MissingFieldException of(@Nullable JsonParser parser, Class<?> targetType, String fieldName) {
        requireNonNull(fieldName, "fieldName");
        return new MissingFieldException(parser, targetType, fieldName);
    }

    private final String fieldName;

    private MissingFieldException(@Nullable JsonParser parser, Class<?> targetType, String fieldName) {
        super(parser, "Missing required field '" + fieldName + "' of " + targetType.getSimpleName(),
              targetType);
        this.fieldName = fieldName;
    }

    /**
     * Returns the name of the missing field.
     */
    public String fieldName() {
        return fieldName;
    }
}
