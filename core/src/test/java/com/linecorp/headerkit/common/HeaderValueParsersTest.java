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
package com.linecorp.headerkit.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Date;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class HeaderValueParsersTest {

    @ParameterizedTest
    @CsvSource({
            "transfer-encoding, token",
            "CONNECTION, token",
            "Expect, token",
            "Via, comma-separated",
            "content-length, non-negative integer",
            "Last-Modified, HTTP-date",
            "Set-Cookie, raw",
            "X-Custom, raw"
    })
    void forName(String headerName, String grammar) {
        assertThat(HeaderValueParsers.forName(headerName).toString()).contains("grammar=" + grammar);
    }

    @Test
    void tokens() {
        assertThat(HeaderValueParsers.TOKENS.parse(" gzip ,, chunked ")).containsExactly("gzip", "chunked");
        assertThat(HeaderValueParsers.TOKENS.parse("100-continue")).containsExactly("100-continue");
        assertThat(HeaderValueParsers.TOKENS.equivalent("Chunked", "chunked")).isTrue();
        assertThat(HeaderValueParsers.TOKENS.equivalent("chunked", "gzip")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = { "", " , ", "a b", "text/plain", "\"quoted\"" })
    void malformedTokens(String value) {
        assertThatThrownBy(() -> HeaderValueParsers.TOKENS.parse(value))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void commaSeparated() {
        assertThat(HeaderValueParsers.COMMA_SEPARATED.parse("1.0 fred, 1.1 p.example.net"))
                .containsExactly("1.0 fred", "1.1 p.example.net");
        assertThat(HeaderValueParsers.COMMA_SEPARATED.equivalent("A", "a")).isFalse();
    }

    @Test
    void nonNegativeLong() {
        assertThat(HeaderValueParsers.NON_NEGATIVE_LONG.parse(" 42 ")).containsExactly(42L);
        assertThat(HeaderValueParsers.NON_NEGATIVE_LONG.format(42L)).isEqualTo("42");
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "-1", "+1", "1, 2", "0x10", "99999999999999999999" })
    void malformedNonNegativeLong(String value) {
        assertThatThrownBy(() -> HeaderValueParsers.NON_NEGATIVE_LONG.parse(value))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void httpDate() {
        final Instant expected = Instant.ofEpochMilli(784111777000L);
        assertThat(HeaderValueParsers.HTTP_DATE.parse("Sun, 06 Nov 1994 08:49:37 GMT"))
                .containsExactly(expected);
        assertThat(HeaderValueParsers.HTTP_DATE.parse("Sunday, 06-Nov-94 08:49:37 GMT"))
                .containsExactly(expected);
        assertThat(HeaderValueParsers.HTTP_DATE.format(expected)).isEqualTo("Sun, 06 Nov 1994 08:49:37 GMT");
        assertThatThrownBy(() -> HeaderValueParsers.HTTP_DATE.parse("yesterday"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid HTTP-date");
    }

    @Test
    void raw() {
        assertThat(HeaderValueParsers.RAW.parse("")).containsExactly("");
        assertThat(HeaderValueParsers.RAW.parse(" a, b ")).containsExactly("a, b");
        assertThat(HeaderValueParsers.RAW.equivalent("a", "A")).isFalse();
    }

    @Test
    void checkValue() {
        assertThat(HeaderValueParsers.NON_NEGATIVE_LONG.checkValue(1L)).isEqualTo(1L);
        assertThatThrownBy(() -> HeaderValueParsers.NON_NEGATIVE_LONG.checkValue("1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeaderValueParsers.RAW.checkValue(Instant.EPOCH))
                .isInstanceOf(IllegalArgumentException.class);
        // A mutable java.util.Date is never stored.
        assertThatThrownBy(() -> HeaderValueParsers.HTTP_DATE.checkValue(new Date()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("java.time.Instant");
    }
}
