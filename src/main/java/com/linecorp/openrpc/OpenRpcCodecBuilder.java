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

/**
 * Builds a new {@link OpenRpcCodec}. The defaults are taken from {@link Flags}.
 */
public final class OpenRpcCodecBuilder {

    private UnknownFieldPolicy unknownFieldPolicy = Flags.unknownFieldPolicy();
    private boolean prettyPrint = Flags.prettyPrint();

    OpenRpcCodecBuilder() {}

    /**
     * Sets the {@link UnknownFieldPolicy}.
     */
    public OpenRpcCodecBuilder unknownFieldPolicy(UnknownFieldPolicy unknownFieldPolicy) {
        this.unknownFieldPolicy = requireNonNull(unknownFieldPolicy, "unknownFieldPolicy");
        return this;
    }

    /**
     * Rejects a field which is neither known nor an extension field.
     * This is a shortcut of {@code unknownFieldPolicy(UnknownFieldPolicy.STRICT)}.
     */
    public OpenRpcCodecBuilder strict() {
        return unknownFieldPolicy(UnknownFieldPolicy.STRICT);
    }

    /**
     * Drops a field which is neither known nor an extension field.
     * This is a shortcut of {@code unknownFieldPolicy(UnknownFieldPolicy.LENIENT)}.
     */
    public OpenRpcCodecBuilder lenient() {
        return unknownFieldPolicy(UnknownFieldPolicy.LENIENT);
    }

    /**
     * Sets whether the encoded JSON text is indented.
     */
    public OpenRpcCodecBuilder prettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        return this;
    }

    /**
     * Returns a newly-created {@link OpenRpcCodec} based on the properties set so far.
     */
    public OpenRpcCodec build() {
        return new OpenRpcCodec(unknownFieldPolicy, prettyPrint);
    }
}
