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

import com.google.common.base.Ascii;

/**
 * Utilities for reading a region of a {@code char[]} without copying it into a {@link String}.
 */
public final class CharArrays {

    /**
     * Returns the index of the first non-whitespace character in {@code [start, end)},
     * or {@code end} if the region is all whitespace.
     */
    public static int trimStart(char[] array, int start, int end) {
        while (start < end && isWhitespace(array[start])) {
            start++;
        }
        return start;
    }

    /**
     * Returns the exclusive end index of {@code [start, end)} after stripping trailing whitespace.
     */
    public static int trimEnd(char[] array, int start, int end) {
        while (end > start && isWhitespace(array[end - 1])) {
            end--;
        }
        return end;
    }

    /**
     * Returns the index of {@code ch} in {@code [start, end)}, or {@code -1}.
     */
    public static int indexOf(char[] array, char ch, int start, int end) {
        for (int i = start; i < end; i++) {
            if (array[i] == ch) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns whether the region {@code [start, start + length)} equals {@code expected}, ignoring the case
     * of ASCII letters.
     */
    public static boolean equalsIgnoreCase(String expected, char[] array, int start, int length) {
        if (expected.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (Ascii.toLowerCase(expected.charAt(i)) != Ascii.toLowerCase(array[start + i])) {
                return false;
            }
        }
        return true;
    }

    private static boolean isWhitespace(char ch) {
        return ch <= ' ';
    }

    private CharArrays() {}
}
