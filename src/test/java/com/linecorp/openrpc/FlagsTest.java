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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class FlagsTest {

    private static final String UNKNOWN_FIELD_POLICY = "com.linecorp.openrpc.unknownFieldPolicy";
    private static final String PRETTY_PRINT = "com.linecorp.openrpc.prettyPrint";

    @AfterEach
    void clearProperties() {
        System.clearProperty(UNKNOWN_FIELD_POLICY);
        System.clearProperty(PRETTY_PRINT);
    }

    @Test
    void defaults() {
        assertThat(Flags.resolveUnknownFieldPolicy()).isSameAs(UnknownFieldPolicy.LENIENT);
        assertThat(Flags.resolvePrettyPrint()).isFalse();
    }

    @Test
    void systemProperties() {
        System.setProperty(UNKNOWN_FIELD_POLICY, "STRICT");
        System.setProperty(PRETTY_PRINT, "true");
        assertThat(Flags.resolveUnknownFieldPolicy()).isSameAs(UnknownFieldPolicy.STRICT);
        assertThat(Flags.resolvePrettyPrint()).isTrue();
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        System.setProperty(UNKNOWN_FIELD_POLICY, "paranoid");
        System.setProperty(PRETTY_PRINT, "yes");
        assertThat(Flags.resolveUnknownFieldPolicy()).isSameAs(UnknownFieldPolicy.LENIENT);
        assertThat(Flags.resolvePrettyPrint()).isFalse();
    }

    @Test
    void builderOverridesFlags() {
        final OpenRpcCodec codec = OpenRpcCodec.builder().strict().prettyPrint(true).build();
        assertThat(codec.unknownFieldPolicy()).isSameAs(UnknownFieldPolicy.STRICT);
        assertThat(codec.isPrettyPrint()).isTrue();
        assertThat(OpenRpcCodec.builder().unknownFieldPolicy(UnknownFieldPolicy.LENIENT).build()
                               .unknownFieldPolicy()).isSameAs(UnknownFieldPolicy.LENIENT);
    }
}
