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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

class ErrorCodeTest {

    private static final OpenRpcCodec codec = OpenRpcCodec.of();

    @Test
    void predefinedCodes() {
        assertThat(ErrorCode.PARSE_ERROR.code()).isEqualTo(-32700);
        assertThat(ErrorCode.INVALID_REQUEST.code()).isEqualTo(-32600);
        assertThat(ErrorCode.METHOD_NOT_FOUND.code()).isEqualTo(-32601);
        assertThat(ErrorCode.INVALID_PARAMS.code()).isEqualTo(-32602);
        assertThat(ErrorCode.INTERNAL_ERROR.code()).isEqualTo(-32603);
        assertThat(ErrorCode.SERVER_ERROR_START.code()).isEqualTo(-32099);
        assertThat(ErrorCode.SERVER_ERROR_END.code()).isEqualTo(-32000);
        assertThat(ErrorCode.of(-32700)).isEqualTo(ErrorCode.PARSE_ERROR);
    }

    @Test
    void ranges() {
        assertThat(ErrorCode.PARSE_ERROR.isReserved()).isTrue();
        assertThat(ErrorCode.PARSE_ERROR.isServerError()).isFalse();
        assertThat(ErrorCode.of(-32768).isReserved()).isTrue();
        assertThat(ErrorCode.of(-32769).isReserved()).isFalse();
        assertThat(ErrorCode.of(-32050).isServerError()).isTrue();
        assertThat(ErrorCode.of(-31999).isReserved()).isFalse();
        assertThat(ErrorCode.of(1).isReserved()).isFalse();
        assertThat(ErrorCode.of(-32099)).isLessThan(ErrorCode.of(-32000));
    }

    @Test
    void encodedAsNumber() {
        final ErrorObject error = ErrorObject.builder(ErrorCode.METHOD_NOT_FOUND, "Method not found")
                                             .data(JsonNodeFactory.instance.textNode("no such method"))
                                             .build();
        final String json = codec.encode(error);
        assertThat(json).isEqualTo(
                "{\"code\":-32601,\"message\":\"Method not found\",\"data\":\"no such method\"}");
        assertThat(codec.decode(json, ErrorObject.class)).isEqualTo(error);
        assertThat(ErrorCode.of(7)).hasToString("7");
    }

    @Test
    void codeMustBeInteger() {
        final String json = "{\"code\":\"-32601\",\"message\":\"m\"}";
        assertThatThrownBy(() -> codec.decode(json, ErrorObject.class))
                .isInstanceOfSatisfying(OpenRpcDecodeException.class, e -> {
                    assertThat(e.type()).isSameAs(DecodeErrorType.INVALID_SHAPE);
                    assertThat(e.path()).isEqualTo("code");
                });
    }
}
