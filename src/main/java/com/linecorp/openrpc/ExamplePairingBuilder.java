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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * Builds a new {@link ExamplePairing}.
 */
public final class ExamplePairingBuilder extends AbstractExtensibleBuilder<ExamplePairingBuilder> {

    @Nullable
    String name;
    @Nullable
    String description;
    @Nullable
    String summary;
    final ImmutableList.Builder<ReferenceOr<Example>> params = ImmutableList.builder();
    @Nullable
    ReferenceOr<Example> result;

    ExamplePairingBuilder() {}

    public ExamplePairingBuilder name(String name) {
        this.name = requireNonNull(name, "name");
        return this;
    }

    public ExamplePairingBuilder description(String description) {
        this.description = requireNonNull(description, "description");
        return this;
    }

    public ExamplePairingBuilder summary(String summary) {
        this.summary = requireNonNull(summary, "summary");
        return this;
    }

    /**
     * Adds the specified example parameters.
     */
    public ExamplePairingBuilder params(Example... params) {
        return params(ImmutableList.copyOf(requireNonNull(params, "params")));
    }

    /**
     * Adds the specified example parameters.
     */
    public ExamplePairingBuilder params(Iterable<Example> params) {
        this.params.addAll(Iterables.transform(requireNonNull(params, "params"), ReferenceOr::of));
        return this;
    }

    /**
     * Adds the specified example parameter or {@link Reference} to an example parameter.
     */
    public ExamplePairingBuilder addParam(ReferenceOr<Example> param) {
        params.add(requireNonNull(param, "param"));
        return this;
    }

    public ExamplePairingBuilder result(Example result) {
        return result(ReferenceOr.of(requireNonNull(result, "result")));
    }

    public ExamplePairingBuilder result(ReferenceOr<Example> result) {
        this.result = requireNonNull(result, "result");
        return this;
    }

    /**
     * Returns a newly-created {@link ExamplePairing} based on the properties set so far.
     */
    public ExamplePairing build() {
        return new ExamplePairing(name, description, summary, params.build(), result, extensions());
    }
}
