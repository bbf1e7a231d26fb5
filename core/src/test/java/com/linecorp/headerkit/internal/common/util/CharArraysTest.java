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
package com.linecorp.headerkit.internal.common.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CharArraysTest {

    @Test
    void trim() {
        final char[] buf = "x \t a b \t x".toCharArray();
        final int start = CharArrays.trimStart(buf, 1, buf.length - 1);
        final int end = CharArrays.trimEnd(buf, start, buf.length - 1);
        assertThat(new String(buf, start, end - start)).isEqualTo("a b");
    }

    @Test
    void trimAllWhitespace() {
        final char[] buf = "   ".toCharArray();
        final int start = CharArrays.trimStart(buf, 0, buf.length);
        assertThat(start).isEqualTo(buf.length);
        assertThat(CharArrays.trimEnd(buf, start, buf.length)).isEqualTo(start);
    }

    @Test
    void indexOf() {
        final char[] buf = "a:b:c".toCharArray();
        assertThat(CharArrays.indexOf(buf, ':', 0, buf.length)).isEqualTo(1);
        assertThat(CharArrays.indexOf(buf, ':', 2, buf.length)).isEqualTo(3);
        assertThat(CharArrays.indexOf(buf, ':', 4, buf.length)).isEqualTo(-1);
        assertThat(CharArrays.indexOf(buf, ':', 0, 1)).isEqualTo(-1);
    }

    @Test
    void equalsIgnoreCase() {
        final char[] buf = "xGZipx".toCharArray();
        assertThat(CharArrays.equalsIgnoreCase("gzip", buf, 1, 4)).isTrue();
        assertThat(CharArrays.equalsIgnoreCase("gzip", buf, 1, 5)).isFalse();
        assertThat(CharArrays.equalsIgnoreCase("gzip", buf, 0, 4)).isFalse();
    }
}
