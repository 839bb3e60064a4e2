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

import java.io.IOException;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map.Entry;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import com.linecorp.openrpc.Extensions;
import com.linecorp.openrpc.InvalidShapeException;

/**
 * Jackson {@link JsonDeserializer} for a JSON object with a fixed set of named fields.
 *
 * <p>The object is read as a tree first. Every field is then sorted into one of three groups:
 * <ul>
 *   <li>a known field, which {@link #decode(ObjectFields)} reads through {@link ObjectFields},</li>
 *   <li>an extension field ({@code x-*}), which is captured when the target type carries extensions
 *       and dropped otherwise,</li>
 *   <li>an unknown field, which is passed to
 *       {@link DeserializationContext#handleUnknownProperty(JsonParser, JsonDeserializer, Object, String)}
 *       so that it is rejected when {@link DeserializationFeature#FAIL_ON_UNKNOWN_PROPERTIES} is enabled
 *       and ignored otherwise.</li>
 * </ul>
 */
public abstract class AbstractObjectJsonDeserializer<T> extends StdDeserializer<T> {

    private static final long serialVersionUID = 3706419728465811734L;

    private static final Logger logger = LoggerFactory.getLogger(AbstractObjectJsonDeserializer.class);

    private final Set<String> knownFields;
    private final boolean extensible;

    /**
     * Creates a new instance.
     *
     * @param type the type this deserializer produces
     * @param extensible whether the type captures {@code x-*} fields
     * @param knownFields the wire names of the fields the type declares
     */
    protected AbstractObjectJsonDeserializer(Class<T> type, boolean extensible, String... knownFields) {
        super(type);
        this.extensible = extensible;
        this.knownFields = ImmutableSet.copyOf(knownFields);
    }

    @Override
    public final T deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        final JsonNode tree = ctx.readTree(p);
        if (!tree.isObject()) {
            throw InvalidShapeException.of(p, handledType(),
                                           handledType().getSimpleName() + " must be an object but was " +
                                           ObjectFields.describe(tree));
        }

        final ImmutableMap.Builder<String, JsonNode> extensions = ImmutableMap.builder();
        for (final Iterator<Entry<String, JsonNode>> i = tree.fields(); i.hasNext();) {
            final Entry<String, JsonNode> e = i.next();
            final String name = e.getKey();
            if (knownFields.contains(name)) {
                continue;
            }

            if (Extensions.isExtension(name)) {
                if (extensible) {
                    extensions.put(name, e.getValue());
                } else {
                    logger.debug("Dropping an extension field '{}' of {}; it does not accept extensions.",
                                 name, handledType().getSimpleName());
                }
                continue;
            }

            // Throws an UnrecognizedPropertyException unless unknown fields are ignored.
            if (ctx.handleUnknownProperty(p, this, handledType(), name)) {
                logger.debug("Ignoring an unknown field '{}' of {}", name, handledType().getSimpleName());
            }
        }

        return decode(new ObjectFields(p, handledType(), ctx, (ObjectNode) tree, extensions.build()));
    }

    /**
     * Creates a new value from the known fields and the captured extensions.
     */
    protected abstract T decode(ObjectFields fields) throws IOException;

    @Override
    public final Collection<Object> getKnownPropertyNames() {
        return ImmutableList.<Object>copyOf(knownFields);
    }
}
