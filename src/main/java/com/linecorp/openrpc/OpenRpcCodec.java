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

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidDefinitionException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import com.google.common.base.MoreObjects;
import com.google.common.base.Throwables;

import com.linecorp.openrpc.internal.JsonPaths;

/**
 * Decodes an {@link OpenRpcDocument} from JSON and encodes it into JSON.
 *
 * <pre>{@code
 * OpenRpcCodec codec = OpenRpcCodec.builder().strict().build();
 * OpenRpcDocument document = codec.decode(json);
 * Method method = document.method("list_pets");
 * }</pre>
 *
 * <p>An {@link OpenRpcCodec} is immutable and may be shared by multiple threads.
 */
public final class OpenRpcCodec {

    private static final OpenRpcCodec DEFAULT = builder().build();

    /**
     * Returns the {@link OpenRpcCodec} configured with {@link Flags}.
     */
    public static OpenRpcCodec of() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link OpenRpcCodecBuilder}.
     */
    public static OpenRpcCodecBuilder builder() {
        return new OpenRpcCodecBuilder();
    }

    private final UnknownFieldPolicy unknownFieldPolicy;
    private final boolean prettyPrint;
    private final ObjectMapper mapper;

    OpenRpcCodec(UnknownFieldPolicy unknownFieldPolicy, boolean prettyPrint) {
        this.unknownFieldPolicy = unknownFieldPolicy;
        this.prettyPrint = prettyPrint;
        mapper = JsonMapper.builder()
                           .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                                      unknownFieldPolicy == UnknownFieldPolicy.STRICT)
                           .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                           .disable(SerializationFeature.WRAP_EXCEPTIONS)
                           .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint)
                           .build();
    }

    public UnknownFieldPolicy unknownFieldPolicy() {
        return unknownFieldPolicy;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    /**
     * Decodes the specified JSON text into an {@link OpenRpcDocument}.
     *
     * @throws OpenRpcDecodeException if the JSON text is malformed or is not a valid OpenRPC document
     */
    public OpenRpcDocument decode(String json) {
        return decode(json, OpenRpcDocument.class);
    }

    /**
     * Decodes the JSON text read from the specified {@link InputStream} into an {@link OpenRpcDocument}.
     * The {@link InputStream} is closed when this method returns.
     *
     * @throws OpenRpcDecodeException if the JSON text is malformed or is not a valid OpenRPC document
     * @throws IOException if failed to read from the {@link InputStream}
     */
    public OpenRpcDocument decode(InputStream in) throws IOException {
        requireNonNull(in, "in");
        final JsonNode tree;
        try {
            tree = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
        return bind(tree, OpenRpcDocument.class);
    }

    /**
     * Decodes the specified JSON tree into an {@link OpenRpcDocument}.
     *
     * @throws OpenRpcDecodeException if the JSON tree is not a valid OpenRPC document
     */
    public OpenRpcDocument decode(JsonNode node) {
        return decode(node, OpenRpcDocument.class);
    }

    /**
     * Decodes the specified JSON text into an object of the specified type, such as {@link Method}
     * or {@link com.linecorp.openrpc.jsonschema.Schema}.
     *
     * @throws OpenRpcDecodeException if the JSON text is malformed or cannot be decoded into
     *                                the specified type
     */
    public <T> T decode(String json, Class<T> type) {
        requireNonNull(json, "json");
        requireNonNull(type, "type");
        final JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
        return bind(tree, type);
    }

    /**
     * Decodes the specified JSON tree into an object of the specified type.
     *
     * @throws OpenRpcDecodeException if the JSON tree cannot be decoded into the specified type
     */
    public <T> T decode(JsonNode node, Class<T> type) {
        requireNonNull(node, "node");
        requireNonNull(type, "type");
        return bind(node, type);
    }

    /**
     * Encodes the specified OpenRPC object into a JSON text. Absent fields are not written and extension
     * fields are written after the named fields.
     *
     * @throws IllegalStateException if the object is in an inconsistent state
     */
    public String encode(Object value) {
        requireNonNull(value, "value");
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw encodeFailure(e);
        }
    }

    /**
     * Encodes the specified OpenRPC object into a JSON tree.
     *
     * @throws IllegalStateException if the object is in an inconsistent state
     */
    public JsonNode encodeToTree(Object value) {
        requireNonNull(value, "value");
        try (TokenBuffer buf = new TokenBuffer(mapper, false)) {
            mapper.writeValue(buf, value);
            return mapper.readTree(buf.asParser());
        } catch (IOException e) {
            throw encodeFailure(e);
        }
    }

    /**
     * Returns a copy of the {@link ObjectMapper} used by this codec.
     */
    public ObjectMapper objectMapper() {
        return mapper.copy();
    }

    private <T> T bind(JsonNode tree, Class<T> type) {
        if (tree.isMissingNode()) {
            throw new OpenRpcDecodeException(DecodeErrorType.MALFORMED_JSON, "", "No content", null);
        }
        if (tree.isNull()) {
            throw new OpenRpcDecodeException(DecodeErrorType.INVALID_SHAPE, "",
                                             type.getSimpleName() + " must not be null", null);
        }

        try {
            return mapper.treeToValue(tree, type);
        } catch (InvalidDefinitionException e) {
            throw new IllegalStateException(e.getOriginalMessage(), e);
        } catch (JsonMappingException e) {
            throw decodeFailure(e);
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    private static OpenRpcDecodeException decodeFailure(JsonMappingException e) {
        final DecodeErrorType type;
        String path = JsonPaths.render(e.getPath());
        if (e instanceof UnrecognizedPropertyException) {
            type = DecodeErrorType.UNKNOWN_FIELD;
            final String propertyName = ((UnrecognizedPropertyException) e).getPropertyName();
            if (!JsonPaths.endsWith(e.getPath(), propertyName)) {
                path = path.isEmpty() ? propertyName : path + '.' + propertyName;
            }
        } else if (e instanceof MissingFieldException) {
            type = DecodeErrorType.MISSING_REQUIRED;
        } else {
            type = DecodeErrorType.INVALID_SHAPE;
        }
        return new OpenRpcDecodeException(type, path, e.getOriginalMessage(), e);
    }

    private static OpenRpcDecodeException malformed(JsonProcessingException e) {
        return new OpenRpcDecodeException(DecodeErrorType.MALFORMED_JSON, "", e.getOriginalMessage(), e);
    }

    private static RuntimeException encodeFailure(IOException e) {
        // Jackson wraps what a serializer raised, such as an IllegalStateException of a union type.
        final Throwable cause = e.getCause();
        if (cause != null) {
            Throwables.throwIfUnchecked(cause);
        }
        return new IllegalArgumentException(e.toString(), e);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("unknownFieldPolicy", unknownFieldPolicy)
                          .add("prettyPrint", prettyPrint)
                          .toString();
    }
}
