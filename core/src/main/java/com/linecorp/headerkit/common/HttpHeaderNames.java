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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.math.IntMath;

import com.linecorp.headerkit.common.annotation.Nullable;
import com.linecorp.headerkit.internal.common.util.CharArrays;

/**
 * Contains constant definitions for the well-known HTTP header field names.
 *
 * <p>Every name is defined in its canonical casing, e.g. {@code "Content-Type"}. The constants are the
 * interned instances returned by {@link #of(CharSequence)} and
 * {@link #lookup(char[], int, int)}, so that parsing a known header name does not allocate a new
 * {@link String}. Interning is an optimization only: header names are always compared case-insensitively
 * by value.</p>
 */
public final class HttpHeaderNames {

    private static final BitSet PROHIBITED_NAME_CHARS;
    private static final String[] PROHIBITED_NAME_CHAR_NAMES;

    static {
        PROHIBITED_NAME_CHARS = new BitSet();
        PROHIBITED_NAME_CHARS.set(0);
        PROHIBITED_NAME_CHARS.set('\t');
        PROHIBITED_NAME_CHARS.set('\n');
        PROHIBITED_NAME_CHARS.set(0xB);
        PROHIBITED_NAME_CHARS.set('\f');
        PROHIBITED_NAME_CHARS.set('\r');
        PROHIBITED_NAME_CHARS.set(' ');
        PROHIBITED_NAME_CHARS.set(',');
        PROHIBITED_NAME_CHARS.set(':');
        PROHIBITED_NAME_CHARS.set(';');
        PROHIBITED_NAME_CHARS.set('=');

        PROHIBITED_NAME_CHAR_NAMES = new String[PROHIBITED_NAME_CHARS.size()];
        PROHIBITED_NAME_CHAR_NAMES[0] = "<NUL>";
        PROHIBITED_NAME_CHAR_NAMES['\t'] = "<TAB>";
        PROHIBITED_NAME_CHAR_NAMES['\n'] = "<LF>";
        PROHIBITED_NAME_CHAR_NAMES[0xB] = "<VT>";
        PROHIBITED_NAME_CHAR_NAMES['\f'] = "<FF>";
        PROHIBITED_NAME_CHAR_NAMES['\r'] = "<CR>";
        PROHIBITED_NAME_CHAR_NAMES[' '] = "<SP>";
        PROHIBITED_NAME_CHAR_NAMES[','] = ",";
        PROHIBITED_NAME_CHAR_NAMES[':'] = ":";
        PROHIBITED_NAME_CHAR_NAMES[';'] = ";";
        PROHIBITED_NAME_CHAR_NAMES['='] = "=";
    }

    /**
     * The HTTP {@code "Accept"} header field name.
     */
    public static final String ACCEPT = "Accept";
    /**
     * The HTTP {@code "Accept-Charset"} header field name.
     */
    public static final String ACCEPT_CHARSET = "Accept-Charset";
    /**
     * The HTTP {@code "Accept-Encoding"} header field name.
     */
    public static final String ACCEPT_ENCODING = "Accept-Encoding";
    /**
     * The HTTP {@code "Accept-Language"} header field name.
     */
    public static final String ACCEPT_LANGUAGE = "Accept-Language";
    /**
     * The HTTP {@code "Accept-Patch"} header field name.
     */
    public static final String ACCEPT_PATCH = "Accept-Patch";
    /**
     * The HTTP {@code "Accept-Ranges"} header field name.
     */
    public static final String ACCEPT_RANGES = "Accept-Ranges";
    /**
     * The HTTP {@code "Access-Control-Allow-Credentials"} header field name.
     */
    public static final String ACCESS_CONTROL_ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";
    /**
     * The HTTP {@code "Access-Control-Allow-Headers"} header field name.
     */
    public static final String ACCESS_CONTROL_ALLOW_HEADERS = "Access-Control-Allow-Headers";
    /**
     * The HTTP {@code "Access-Control-Allow-Methods"} header field name.
     */
    public static final String ACCESS_CONTROL_ALLOW_METHODS = "Access-Control-Allow-Methods";
    /**
     * The HTTP {@code "Access-Control-Allow-Origin"} header field name.
     */
    public static final String ACCESS_CONTROL_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    /**
     * The HTTP {@code "Access-Control-Expose-Headers"} header field name.
     */
    public static final String ACCESS_CONTROL_EXPOSE_HEADERS = "Access-Control-Expose-Headers";
    /**
     * The HTTP {@code "Access-Control-Max-Age"} header field name.
     */
    public static final String ACCESS_CONTROL_MAX_AGE = "Access-Control-Max-Age";
    /**
     * The HTTP {@code "Age"} header field name.
     */
    public static final String AGE = "Age";
    /**
     * The HTTP {@code "Allow"} header field name.
     */
    public static final String ALLOW = "Allow";
    /**
     * The HTTP {@code "Alt-Svc"} header field name.
     */
    public static final String ALT_SVC = "Alt-Svc";
    /**
     * The HTTP {@code "Authorization"} header field name.
     */
    public static final String AUTHORIZATION = "Authorization";
    /**
     * The HTTP {@code "Cache-Control"} header field name.
     */
    public static final String CACHE_CONTROL = "Cache-Control";
    /**
     * The HTTP {@code "Connection"} header field name.
     */
    public static final String CONNECTION = "Connection";
    /**
     * The HTTP {@code "Content-Disposition"} header field name.
     */
    public static final String CONTENT_DISPOSITION = "Content-Disposition";
    /**
     * The HTTP {@code "Content-Encoding"} header field name.
     *
     * <p>{@link com.linecorp.headerkit.client.HttpResponseHeaderReader} compares against this instance by
     * reference to detect the common {@code gzip} and {@code deflate} values.</p>
     */
    public static final String CONTENT_ENCODING = "Content-Encoding";
    /**
     * The HTTP {@code "Content-Language"} header field name.
     */
    public static final String CONTENT_LANGUAGE = "Content-Language";
    /**
     * The HTTP {@code "Content-Length"} header field name.
     */
    public static final String CONTENT_LENGTH = "Content-Length";
    /**
     * The HTTP {@code "Content-Location"} header field name.
     */
    public static final String CONTENT_LOCATION = "Content-Location";
    /**
     * The HTTP {@code "Content-MD5"} header field name.
     */
    public static final String CONTENT_MD5 = "Content-MD5";
    /**
     * The HTTP {@code "Content-Range"} header field name.
     */
    public static final String CONTENT_RANGE = "Content-Range";
    /**
     * The HTTP {@code "Content-Security-Policy"} header field name.
     */
    public static final String CONTENT_SECURITY_POLICY = "Content-Security-Policy";
    /**
     * The HTTP {@code "Content-Type"} header field name.
     */
    public static final String CONTENT_TYPE = "Content-Type";
    /**
     * The HTTP {@code "Cookie"} header field name.
     */
    public static final String COOKIE = "Cookie";
    /**
     * The HTTP {@code "Cookie2"} header field name.
     */
    public static final String COOKIE2 = "Cookie2";
    /**
     * The HTTP {@code "Date"} header field name.
     */
    public static final String DATE = "Date";
    /**
     * The HTTP {@code "ETag"} header field name.
     */
    public static final String ETAG = "ETag";
    /**
     * The HTTP {@code "Expect"} header field name.
     */
    public static final String EXPECT = "Expect";
    /**
     * The HTTP {@code "Expires"} header field name.
     */
    public static final String EXPIRES = "Expires";
    /**
     * The HTTP {@code "From"} header field name.
     */
    public static final String FROM = "From";
    /**
     * The HTTP {@code "Host"} header field name.
     */
    public static final String HOST = "Host";
    /**
     * The HTTP {@code "If-Match"} header field name.
     */
    public static final String IF_MATCH = "If-Match";
    /**
     * The HTTP {@code "If-Modified-Since"} header field name.
     */
    public static final String IF_MODIFIED_SINCE = "If-Modified-Since";
    /**
     * The HTTP {@code "If-None-Match"} header field name.
     */
    public static final String IF_NONE_MATCH = "If-None-Match";
    /**
     * The HTTP {@code "If-Range"} header field name.
     */
    public static final String IF_RANGE = "If-Range";
    /**
     * The HTTP {@code "If-Unmodified-Since"} header field name.
     */
    public static final String IF_UNMODIFIED_SINCE = "If-Unmodified-Since";
    /**
     * The HTTP {@code "Keep-Alive"} header field name.
     */
    public static final String KEEP_ALIVE = "Keep-Alive";
    /**
     * The HTTP {@code "Last-Modified"} header field name.
     */
    public static final String LAST_MODIFIED = "Last-Modified";
    /**
     * The HTTP {@code "Link"} header field name.
     */
    public static final String LINK = "Link";
    /**
     * The HTTP {@code "Location"} header field name.
     */
    public static final String LOCATION = "Location";
    /**
     * The HTTP {@code "Max-Forwards"} header field name.
     */
    public static final String MAX_FORWARDS = "Max-Forwards";
    /**
     * The HTTP {@code "Origin"} header field name.
     */
    public static final String ORIGIN = "Origin";
    /**
     * The HTTP {@code "P3P"} header field name.
     */
    public static final String P3P = "P3P";
    /**
     * The HTTP {@code "Pragma"} header field name.
     */
    public static final String PRAGMA = "Pragma";
    /**
     * The HTTP {@code "Proxy-Authenticate"} header field name.
     */
    public static final String PROXY_AUTHENTICATE = "Proxy-Authenticate";
    /**
     * The HTTP {@code "Proxy-Authorization"} header field name.
     */
    public static final String PROXY_AUTHORIZATION = "Proxy-Authorization";
    /**
     * The HTTP {@code "Proxy-Connection"} header field name.
     */
    public static final String PROXY_CONNECTION = "Proxy-Connection";
    /**
     * The HTTP {@code "Public-Key-Pins"} header field name.
     */
    public static final String PUBLIC_KEY_PINS = "Public-Key-Pins";
    /**
     * The HTTP {@code "Range"} header field name.
     */
    public static final String RANGE = "Range";
    /**
     * The HTTP {@code "Referer"} header field name.
     */
    public static final String REFERER = "Referer";
    /**
     * The HTTP {@code "Retry-After"} header field name.
     */
    public static final String RETRY_AFTER = "Retry-After";
    /**
     * The HTTP {@code "Sec-WebSocket-Accept"} header field name.
     */
    public static final String SEC_WEBSOCKET_ACCEPT = "Sec-WebSocket-Accept";
    /**
     * The HTTP {@code "Sec-WebSocket-Extensions"} header field name.
     */
    public static final String SEC_WEBSOCKET_EXTENSIONS = "Sec-WebSocket-Extensions";
    /**
     * The HTTP {@code "Sec-WebSocket-Key"} header field name.
     */
    public static final String SEC_WEBSOCKET_KEY = "Sec-WebSocket-Key";
    /**
     * The HTTP {@code "Sec-WebSocket-Protocol"} header field name.
     */
    public static final String SEC_WEBSOCKET_PROTOCOL = "Sec-WebSocket-Protocol";
    /**
     * The HTTP {@code "Sec-WebSocket-Version"} header field name.
     */
    public static final String SEC_WEBSOCKET_VERSION = "Sec-WebSocket-Version";
    /**
     * The HTTP {@code "Server"} header field name.
     */
    public static final String SERVER = "Server";
    /**
     * The HTTP {@code "Set-Cookie"} header field name.
     *
     * @see com.linecorp.headerkit.client.cookie.SetCookieSplitter
     */
    public static final String SET_COOKIE = "Set-Cookie";
    /**
     * The HTTP {@code "Set-Cookie2"} header field name.
     */
    public static final String SET_COOKIE2 = "Set-Cookie2";
    /**
     * The HTTP {@code "Strict-Transport-Security"} header field name.
     */
    public static final String STRICT_TRANSPORT_SECURITY = "Strict-Transport-Security";
    /**
     * The HTTP {@code "TE"} header field name.
     */
    public static final String TE = "TE";
    /**
     * The HTTP {@code "TSV"} header field name.
     */
    public static final String TSV = "TSV";
    /**
     * The HTTP {@code "Trailer"} header field name.
     */
    public static final String TRAILER = "Trailer";
    /**
     * The HTTP {@code "Transfer-Encoding"} header field name.
     */
    public static final String TRANSFER_ENCODING = "Transfer-Encoding";
    /**
     * The HTTP {@code "Upgrade"} header field name.
     */
    public static final String UPGRADE = "Upgrade";
    /**
     * The HTTP {@code "Upgrade-Insecure-Requests"} header field name.
     */
    public static final String UPGRADE_INSECURE_REQUESTS = "Upgrade-Insecure-Requests";
    /**
     * The HTTP {@code "User-Agent"} header field name.
     */
    public static final String USER_AGENT = "User-Agent";
    /**
     * The HTTP {@code "Vary"} header field name.
     */
    public static final String VARY = "Vary";
    /**
     * The HTTP {@code "Via"} header field name.
     */
    public static final String VIA = "Via";
    /**
     * The HTTP {@code "WWW-Authenticate"} header field name.
     */
    public static final String WWW_AUTHENTICATE = "WWW-Authenticate";
    /**
     * The HTTP {@code "Warning"} header field name.
     */
    public static final String WARNING = "Warning";
    /**
     * The HTTP {@code "X-AspNet-Version"} header field name.
     */
    public static final String X_ASPNET_VERSION = "X-AspNet-Version";
    /**
     * The HTTP {@code "X-Content-Duration"} header field name.
     */
    public static final String X_CONTENT_DURATION = "X-Content-Duration";
    /**
     * The HTTP {@code "X-Content-Type-Options"} header field name.
     */
    public static final String X_CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";
    /**
     * The HTTP {@code "X-Frame-Options"} header field name.
     */
    public static final String X_FRAME_OPTIONS = "X-Frame-Options";
    /**
     * The HTTP {@code "X-MSEdge-Ref"} header field name.
     */
    public static final String X_MSEDGE_REF = "X-MSEdge-Ref";
    /**
     * The HTTP {@code "X-Powered-By"} header field name.
     */
    public static final String X_POWERED_BY = "X-Powered-By";
    /**
     * The HTTP {@code "X-Request-ID"} header field name.
     */
    public static final String X_REQUEST_ID = "X-Request-ID";
    /**
     * The HTTP {@code "X-UA-Compatible"} header field name.
     */
    public static final String X_UA_COMPATIBLE = "X-UA-Compatible";

    /**
     * Known names grouped by their length, so that a span lookup only compares the candidates that can
     * possibly match.
     */
    private static final String[][] namesByLength;

    /**
     * Known names keyed by their lower-cased form.
     */
    private static final Map<String, String> map;

    static {
        final ImmutableListMultimap.Builder<Integer, String> byLengthBuilder = ImmutableListMultimap.builder();
        final ImmutableMap.Builder<String, String> mapBuilder = ImmutableMap.builder();
        int maxLength = 0;
        for (Field f : HttpHeaderNames.class.getDeclaredFields()) {
            final int m = f.getModifiers();
            if (Modifier.isPublic(m) && Modifier.isStatic(m) && Modifier.isFinal(m) &&
                f.getType() == String.class) {
                final String name;
                try {
                    name = (String) f.get(null);
                } catch (Exception e) {
                    throw new Error(e);
                }
                byLengthBuilder.put(name.length(), name);
                mapBuilder.put(Ascii.toLowerCase(name), name);
                maxLength = Math.max(maxLength, name.length());
            }
        }

        final ImmutableListMultimap<Integer, String> byLength = byLengthBuilder.build();
        namesByLength = new String[maxLength + 1][];
        for (int i = 0; i <= maxLength; i++) {
            final List<String> names = byLength.get(i);
            namesByLength[i] = names.toArray(new String[0]);
        }
        map = mapBuilder.build();
    }

    /**
     * Finds the known header name that equals the specified region of {@code buffer}, ignoring the case of
     * ASCII letters. No {@link String} is allocated for the lookup.
     *
     * @return the canonical constant defined in this class, or {@code null} if the region is not a known
     *         header name.
     */
    @Nullable
    public static String lookup(char[] buffer, int startIndex, int length) {
        requireNonNull(buffer, "buffer");
        if (length <= 0 || length >= namesByLength.length) {
            return null;
        }
        for (String candidate : namesByLength[length]) {
            if (CharArrays.equalsIgnoreCase(candidate, buffer, startIndex, length)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Returns the canonical constant for the specified header name if it is a known name, or the name
     * itself otherwise. e.g. both {@code "content-type"} and {@code "CONTENT-TYPE"} are converted into
     * {@link #CONTENT_TYPE}.
     *
     * @throws IllegalArgumentException if the specified {@code name} is empty.
     */
    public static String of(CharSequence name) {
        requireNonNull(name, "name");
        if (name.length() == 0) {
            throw new IllegalArgumentException("malformed header name: <EMPTY>");
        }
        final String str = name.toString();
        final String cached = map.get(Ascii.toLowerCase(str));
        return cached != null ? cached : str;
    }

    /**
     * Returns whether the specified {@code name} is one of the constants defined in this class,
     * ignoring case.
     */
    public static boolean isKnown(CharSequence name) {
        requireNonNull(name, "name");
        return map.containsKey(Ascii.toLowerCase(name));
    }

    /**
     * Ensures the specified header name does not contain any character prohibited in a header name.
     *
     * @return the specified {@code name}
     * @throws IllegalArgumentException if the specified {@code name} is empty or contains a prohibited
     *                                  character.
     */
    public static String validate(String name) {
        requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("malformed header name: <EMPTY>");
        }

        final int nameLength = name.length();
        for (int i = 0; i < nameLength; i++) {
            if (PROHIBITED_NAME_CHARS.get(name.charAt(i))) {
                throw new IllegalArgumentException(malformedHeaderNameMessage(name));
            }
        }
        return name;
    }

    private static String malformedHeaderNameMessage(String name) {
        final StringBuilder buf = new StringBuilder(IntMath.saturatedAdd(name.length(), 64));
        buf.append("malformed header name: ");

        final int nameLength = name.length();
        for (int i = 0; i < nameLength; i++) {
            final char ch = name.charAt(i);
            if (PROHIBITED_NAME_CHARS.get(ch)) {
                buf.append(PROHIBITED_NAME_CHAR_NAMES[ch]);
            } else {
                buf.append(ch);
            }
        }

        return buf.toString();
    }

    private HttpHeaderNames() {}
}
