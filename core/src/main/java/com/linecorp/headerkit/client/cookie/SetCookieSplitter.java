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
package com.linecorp.headerkit.client.cookie;

import static java.util.Objects.requireNonNull;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import com.linecorp.headerkit.common.Flags;
import com.linecorp.headerkit.common.annotation.Nullable;

/**
 * Splits a {@code "Set-Cookie"} header value into the cookie definitions it contains, e.g.
 * <pre>{@code
 * SetCookieSplitter.splitToList("id=1; Expires=Wed, 09 Jun 2021 10:18:14 GMT, lang=en");
 * // ["id=1; Expires=Wed, 09 Jun 2021 10:18:14 GMT", "lang=en"]
 * }</pre>
 *
 * <p>Cookie definitions are separated with a comma, but a comma also appears in the date of an
 * {@code Expires} attribute. A comma that follows a day name right after {@code Expires=} does not separate
 * definitions. A double-quoted string is never split.</p>
 *
 * <p>Splitting stops silently at the first malformed definition, i.e. a definition without a cookie name or
 * with an unbalanced double quote. The definitions before it are still returned. The malformed input is
 * logged at {@code DEBUG} level, or {@code WARN} level if {@link Flags#warnMalformedSetCookie()} is enabled.
 * </p>
 */
public final class SetCookieSplitter {

    private static final Logger logger = LoggerFactory.getLogger(SetCookieSplitter.class);

    private static final String EXPIRES = "expires=";

    // The day names of IMF-fixdate, asctime-date and rfc850-date.
    private static final ImmutableSet<String> DAY_NAMES = ImmutableSet.of(
            "mon", "tue", "wed", "thu", "fri", "sat", "sun",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday");

    private static final int MIN_DAY_NAME_LENGTH = 3;
    private static final int MAX_DAY_NAME_LENGTH = 9;

    /**
     * Returns the cookie definitions in the specified {@code "Set-Cookie"} header value, in order of
     * appearance. The definitions are found lazily while iterating, and every {@link Iterable#iterator()}
     * starts over from the beginning of the header value.
     */
    public static Iterable<String> split(String setCookieHeader) {
        requireNonNull(setCookieHeader, "setCookieHeader");
        return () -> new DefinitionIterator(setCookieHeader);
    }

    /**
     * Returns the cookie definitions in the specified {@code "Set-Cookie"} header value, in order of
     * appearance.
     */
    public static List<String> splitToList(String setCookieHeader) {
        return ImmutableList.copyOf(split(setCookieHeader));
    }

    private static final class DefinitionIterator extends AbstractIterator<String> {

        private final String header;
        private int position;

        DefinitionIterator(String header) {
            this.header = header;
        }

        @Nullable
        @Override
        protected String computeNext() {
            final int length = header.length();

            // Skip the whitespace and the empty definitions.
            int start = position;
            while (start < length && (header.charAt(start) == ',' || isWhitespace(header.charAt(start)))) {
                start++;
            }
            if (start == length) {
                position = length;
                return endOfData();
            }

            if (!hasCookieName(start, length)) {
                return malformed(start, "no cookie name");
            }

            int i = start;
            boolean attributeStart = false;
            while (i < length) {
                final char ch = header.charAt(i);
                if (ch == ',') {
                    break;
                }

                if (ch == ';') {
                    attributeStart = true;
                    i++;
                    continue;
                }

                if (ch == '"') {
                    final int closingQuote = header.indexOf('"', i + 1);
                    if (closingQuote < 0) {
                        return malformed(start, "unbalanced double quote");
                    }
                    attributeStart = false;
                    i = closingQuote + 1;
                    continue;
                }

                if (attributeStart && !isWhitespace(ch)) {
                    attributeStart = false;
                    if (header.regionMatches(true, i, EXPIRES, 0, EXPIRES.length())) {
                        i = skipDayName(i + EXPIRES.length(), length);
                        continue;
                    }
                }
                i++;
            }

            int end = i;
            while (end > start && isWhitespace(header.charAt(end - 1))) {
                end--;
            }
            position = Math.min(i + 1, length);
            return header.substring(start, end);
        }

        /**
         * Returns whether the cookie-pair at {@code start} has a non-empty name.
         */
        private boolean hasCookieName(int start, int length) {
            for (int i = start; i < length; i++) {
                final char ch = header.charAt(i);
                if (ch == '=' || ch == ';' || ch == ',') {
                    return i > start;
                }
            }
            return true;
        }

        /**
         * Skips the day name and the following comma of the date at {@code dateStart}, if any.
         *
         * @return the index right after the comma, or {@code dateStart} if the date does not start with
         *         a day name followed by a comma.
         */
        private int skipDayName(int dateStart, int length) {
            int nameStart = dateStart;
            while (nameStart < length && isWhitespace(header.charAt(nameStart))) {
                nameStart++;
            }
            int nameEnd = nameStart;
            while (nameEnd < length && isLetter(header.charAt(nameEnd))) {
                nameEnd++;
            }

            final int nameLength = nameEnd - nameStart;
            if (nameEnd < length && header.charAt(nameEnd) == ',' &&
                nameLength >= MIN_DAY_NAME_LENGTH && nameLength <= MAX_DAY_NAME_LENGTH &&
                DAY_NAMES.contains(Ascii.toLowerCase(header.substring(nameStart, nameEnd)))) {
                return nameEnd + 1;
            }
            return dateStart;
        }

        @Nullable
        private String malformed(int start, String reason) {
            if (Flags.warnMalformedSetCookie()) {
                logger.warn("Stopped splitting a malformed Set-Cookie header at {} ({}): {}",
                            start, reason, header);
            } else {
                logger.debug("Stopped splitting a malformed Set-Cookie header at {} ({}): {}",
                             start, reason, header);
            }
            position = header.length();
            return endOfData();
        }

        private static boolean isWhitespace(char ch) {
            return ch == ' ' || ch == '\t';
        }

        private static boolean isLetter(char ch) {
            return Ascii.isLowerCase(ch) || Ascii.isUpperCase(ch);
        }
    }

    private SetCookieSplitter() {}
}
