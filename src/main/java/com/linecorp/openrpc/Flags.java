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

import java.util.Arrays;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;

/**
 * The system properties that affect the default behavior of {@link OpenRpcCodec}.
 *
 * <ul>
 *   <li>{@code -Dcom.linecorp.openrpc.unknownFieldPolicy=<strict|lenient>} - the default
 *       {@link UnknownFieldPolicy}. {@code lenient} if unspecified.</li>
 *   <li>{@code -Dcom.linecorp.openrpc.prettyPrint=<true|false>} - whether the default
 *       {@link OpenRpcCodec} indents its output. {@code false} if unspecified.</li>
 * </ul>
 */
public final class Flags {

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    private static final String PREFIX = "com.linecorp.openrpc.";

    private static final String DEFAULT_UNKNOWN_FIELD_POLICY = "lenient";

    private static final boolean DEFAULT_PRETTY_PRINT = false;

    private static final UnknownFieldPolicy UNKNOWN_FIELD_POLICY = resolveUnknownFieldPolicy();

    private static final boolean PRETTY_PRINT = resolvePrettyPrint();

    /**
     * Returns the default {@link UnknownFieldPolicy} of {@link OpenRpcCodec}.
     *
     * <p>This flag is {@link UnknownFieldPolicy#LENIENT} by default. Specify the
     * {@code -Dcom.linecorp.openrpc.unknownFieldPolicy=strict} JVM option to reject unknown fields.
     */
    public static UnknownFieldPolicy unknownFieldPolicy() {
        return UNKNOWN_FIELD_POLICY;
    }

    /**
     * Returns whether {@link OpenRpcCodec} indents its output by default.
     *
     * <p>This flag is disabled by default. Specify the {@code -Dcom.linecorp.openrpc.prettyPrint=true}
     * JVM option to enable it.
     */
    public static boolean prettyPrint() {
        return PRETTY_PRINT;
    }

    @VisibleForTesting
    static UnknownFieldPolicy resolveUnknownFieldPolicy() {
        final String policy = getNormalized("unknownFieldPolicy", DEFAULT_UNKNOWN_FIELD_POLICY,
                                            value -> Arrays.stream(UnknownFieldPolicy.values())
                                                           .anyMatch(v -> v.name().equalsIgnoreCase(value)));
        return UnknownFieldPolicy.valueOf(Ascii.toUpperCase(policy));
    }

    @VisibleForTesting
    static boolean resolvePrettyPrint() {
        return getBoolean("prettyPrint", DEFAULT_PRETTY_PRINT);
    }

    private static boolean getBoolean(String name, boolean defaultValue) {
        return Boolean.parseBoolean(getNormalized(name, String.valueOf(defaultValue),
                                                  value -> "true".equals(value) || "false".equals(value)));
    }

    private static String getNormalized(String name, String defaultValue, Predicate<String> validator) {
        final String fullName = PREFIX + name;
        String value = System.getProperty(fullName);
        if (value != null) {
            value = Ascii.toLowerCase(value);
        }

        if (value != null) {
            if (validator.test(value)) {
                logger.info("{}: {} (sysprops)", name, value);
                return value;
            }
            logger.warn("{}: {} (sysprops, validation failed)", name, value);
        }
        logger.info("{}: {} (default)", name, defaultValue);
        return defaultValue;
    }

    private Flags() {}
}
