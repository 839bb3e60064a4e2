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
package com.linecorp.openrpc.internal;

import java.util.List;

import com.fasterxml.jackson.databind.JsonMappingException.Reference;

/**
 * Renders the path of a {@link com.fasterxml.jackson.databind.JsonMappingException} in the form of
 * {@code methods[0].params[1].schema.items}.
 */
public final class JsonPaths {

    /**
     * Returns the rendered form of the specified path.
     */
    public static String render(List<Reference> path) {
        final StringBuilder buf = new StringBuilder();
        for (Reference ref : path) {
            final String fieldName = ref.getFieldName();
            if (fieldName != null) {
                if (buf.length() > 0) {
                    buf.append('.');
                }
                buf.append(fieldName);
            } else if (ref.getIndex() >= 0) {
                buf.append('[').append(ref.getIndex()).append(']');
            }
        }
        return buf.toString();
    }

    /**
     * Returns whether the specified path ends with the specified field name.
     */
    public static boolean endsWith(List<Reference> path, String fieldName) {
        if (path.isEmpty()) {
            return false;
        }
        return fieldName.equals(path.get(path.size() - 1).getFieldName());
    }

    private JsonPaths() {}
}
