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

import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Date;
import java.util.List;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Equivalence;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import io.netty.handler.codec.DateFormatter;

/**
 * The registry of {@link HeaderValueParser}s, keyed by header name. A header without a registered grammar
 * is parsed with {@link #RAW}.
 */
final class HeaderValueParsers {

    private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    // tchar = "!" / "#" / "$" / "%" / "&" / "'" / "*" / "+" / "-" / "." /
    //         "^" / "_" / "`" / "|" / "~" / DIGIT / ALPHA
    private static final CharMatcher TCHAR = CharMatcher.inRange('a', 'z')
                                                        .or(CharMatcher.inRange('A', 'Z'))
                                                        .or(CharMatcher.inRange('0', '9'))
                                                        .or(CharMatcher.anyOf("!#$%&'*+-.^_`|~"))
                                                        .precomputed();

    private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');

    private static final Equivalence<Object> CASE_INSENSITIVE = new Equivalence<Object>() {
        @Override
        protected boolean doEquivalent(Object a, Object b) {
            if (a instanceof String && b instanceof String) {
                return Ascii.equalsIgnoreCase((String) a, (String) b);
            }
            return a.equals(b);
        }

        @Override
        protected int doHash(Object o) {
            return o instanceof String ? Ascii.toLowerCase((String) o).hashCode() : o.hashCode();
        }
    };

    /**
     * The whole trimmed value as a single {@link String}.
     */
    static final HeaderValueParser<String> RAW = new HeaderValueParser<>(
            "raw", String.class, value -> ImmutableList.of(value.trim()),
            Equivalence.equals(), String::toString);

    /**
     * A comma-separated list of RFC 7230 tokens, compared case-insensitively, e.g.
     * {@code "Transfer-Encoding: gzip, chunked"}.
     */
    static final HeaderValueParser<String> TOKENS = new HeaderValueParser<>(
            "token", String.class, HeaderValueParsers::parseTokens, CASE_INSENSITIVE, String::toString);

    /**
     * A comma-separated list of opaque elements, compared case-sensitively, e.g.
     * {@code "Via: 1.0 fred, 1.1 p.example.net"}.
     */
    static final HeaderValueParser<String> COMMA_SEPARATED = new HeaderValueParser<>(
            "comma-separated", String.class, COMMA_SPLITTER::splitToList,
            Equivalence.equals(), String::toString);

    /**
     * A single non-negative decimal integer, e.g. {@code "Content-Length: 42"}.
     */
    static final HeaderValueParser<Long> NON_NEGATIVE_LONG = new HeaderValueParser<>(
            "non-negative integer", Long.class, HeaderValueParsers::parseNonNegativeLong,
            Equivalence.equals(), value -> Long.toString(value));

    /**
     * A single HTTP-date, e.g. {@code "Date: Sun, 06 Nov 1994 08:49:37 GMT"}. All three formats of
     * RFC 7231 are accepted; the value is stored as an {@link Instant} and always rendered as an IMF-fixdate.
     */
    static final HeaderValueParser<Instant> HTTP_DATE = new HeaderValueParser<>(
            "HTTP-date", Instant.class, HeaderValueParsers::parseHttpDate,
            Equivalence.equals(), instant -> DateFormatter.format(Date.from(instant)));

    private static final ImmutableMap<String, HeaderValueParser<?>> parsers;

    static {
        final ImmutableMap.Builder<String, HeaderValueParser<?>> builder = ImmutableMap.builder();
        register(builder, TOKENS,
                 HttpHeaderNames.CONNECTION,
                 HttpHeaderNames.CONTENT_ENCODING,
                 HttpHeaderNames.TRANSFER_ENCODING,
                 HttpHeaderNames.EXPECT,
                 HttpHeaderNames.TRAILER,
                 HttpHeaderNames.VARY,
                 HttpHeaderNames.ALLOW,
                 HttpHeaderNames.ACCEPT_RANGES,
                 HttpHeaderNames.CONTENT_LANGUAGE);
        register(builder, COMMA_SEPARATED,
                 HttpHeaderNames.UPGRADE,
                 HttpHeaderNames.VIA,
                 HttpHeaderNames.PRAGMA,
                 HttpHeaderNames.ACCEPT,
                 HttpHeaderNames.ACCEPT_CHARSET,
                 HttpHeaderNames.ACCEPT_ENCODING,
                 HttpHeaderNames.ACCEPT_LANGUAGE,
                 HttpHeaderNames.IF_MATCH,
                 HttpHeaderNames.IF_NONE_MATCH);
        register(builder, NON_NEGATIVE_LONG,
                 HttpHeaderNames.CONTENT_LENGTH,
                 HttpHeaderNames.AGE,
                 HttpHeaderNames.MAX_FORWARDS);
        register(builder, HTTP_DATE,
                 HttpHeaderNames.DATE,
                 HttpHeaderNames.EXPIRES,
                 HttpHeaderNames.LAST_MODIFIED,
                 HttpHeaderNames.IF_MODIFIED_SINCE,
                 HttpHeaderNames.IF_UNMODIFIED_SINCE);
        parsers = builder.build();
    }

    private static void register(ImmutableMap.Builder<String, HeaderValueParser<?>> builder,
                                 HeaderValueParser<?> parser, String... headerNames) {
        for (String headerName : headerNames) {
            builder.put(Ascii.toLowerCase(headerName), parser);
        }
    }

    /**
     * Returns the {@link HeaderValueParser} of the specified header name. The name is matched
     * case-insensitively.
     */
    static HeaderValueParser<?> forName(String headerName) {
        requireNonNull(headerName, "headerName");
        final HeaderValueParser<?> parser = parsers.get(Ascii.toLowerCase(headerName));
        return parser != null ? parser : RAW;
    }

    private static List<String> parseTokens(String value) {
        final List<String> tokens = COMMA_SPLITTER.splitToList(value);
        for (String token : tokens) {
            if (!TCHAR.matchesAllOf(token)) {
                throw new IllegalArgumentException("invalid token: " + token);
            }
        }
        return tokens;
    }

    private static List<Long> parseNonNegativeLong(String value) {
        final String trimmed = value.trim();
        if (trimmed.isEmpty() || !DIGIT.matchesAllOf(trimmed)) {
            throw new IllegalArgumentException("invalid non-negative integer: " + value);
        }
        try {
            return ImmutableList.of(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("integer out of range: " + value, e);
        }
    }

    private static List<Instant> parseHttpDate(String value) {
        final Date date = DateFormatter.parseHttpDate(value.trim());
        if (date == null) {
            throw new IllegalArgumentException("invalid HTTP-date: " + value);
        }
        return ImmutableList.of(date.toInstant());
    }

    private HeaderValueParsers() {}
}
