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
package com.linecorp.headerkit.client;

import static com.google.common.base.Preconditions.checkPositionIndexes;
import static java.util.Objects.requireNonNull;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Maps;

import com.linecorp.headerkit.common.HttpHeaderNames;
import com.linecorp.headerkit.common.HttpHeaderStore;
import com.linecorp.headerkit.common.annotation.Nullable;
import com.linecorp.headerkit.internal.common.util.CharArrays;

import io.netty.handler.codec.http.HttpHeaderValues;

/**
 * Reads the header lines of an HTTP response from a decoded header block, where each line is terminated with
 * {@code "\r\n"}.
 *
 * <p>The reader is lenient: empty lines and malformed lines without a colon are skipped silently, and the
 * last line does not need to be terminated. No exception is raised for malformed input.</p>
 *
 * <p>A known header name is returned as the constant defined in {@link HttpHeaderNames}, so that reading
 * a known header name does not allocate a new {@link String}.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public final class HttpResponseHeaderReader {

    private static final Logger logger = LoggerFactory.getLogger(HttpResponseHeaderReader.class);

    private static final String GZIP = HttpHeaderValues.GZIP.toString();
    private static final String DEFLATE = HttpHeaderValues.DEFLATE.toString();

    private final char[] buffer;
    private final int endIndex;
    private int position;

    // The region of the last line read by readLineRegion().
    private int lineStart;
    private int lineLength;

    /**
     * Creates a new reader of the region {@code [startIndex, startIndex + length)} of the specified buffer.
     * The buffer must not be modified while it is read.
     */
    public HttpResponseHeaderReader(char[] buffer, int startIndex, int length) {
        requireNonNull(buffer, "buffer");
        checkPositionIndexes(startIndex, startIndex + length, buffer.length);
        this.buffer = buffer;
        position = startIndex;
        endIndex = startIndex + length;
    }

    /**
     * Reads the next header.
     *
     * <p>Empty lines are skipped, as are malformed lines without a colon. The header name is the text before
     * the first colon and the header value is the text after it, stripped of the leading and trailing
     * whitespace.</p>
     *
     * @return the name and value of the next header, or {@code null} if all characters have been read.
     */
    @Nullable
    public Map.Entry<String, String> readHeader() {
        while (readLineRegion()) {
            if (lineLength == 0) {
                continue;
            }

            final int lineEnd = lineStart + lineLength;
            final int colonIndex = CharArrays.indexOf(buffer, ':', lineStart, lineEnd);
            if (colonIndex < 0) {
                if (logger.isTraceEnabled()) {
                    logger.trace("Skipping a header line without a colon: {}",
                                 new String(buffer, lineStart, lineLength));
                }
                continue;
            }

            final int nameLength = colonIndex - lineStart;
            String name = HttpHeaderNames.lookup(buffer, lineStart, nameLength);
            if (name == null) {
                name = new String(buffer, lineStart, nameLength);
            }

            final int valueStart = CharArrays.trimStart(buffer, colonIndex + 1, lineEnd);
            final int valueEnd = CharArrays.trimEnd(buffer, valueStart, lineEnd);
            return Maps.immutableEntry(name, headerValue(name, valueStart, valueEnd - valueStart));
        }
        return null;
    }

    /**
     * Reads the next line.
     *
     * @return the next line without its {@code "\r\n"} terminator, or {@code null} if all characters have
     *         been read. The unterminated remainder of the buffer is returned as the last line.
     */
    @Nullable
    public String readLine() {
        if (!readLineRegion()) {
            return null;
        }
        return new String(buffer, lineStart, lineLength);
    }

    /**
     * Reads all remaining headers into the specified {@link HttpHeaderStore}. A header whose value is
     * rejected by the grammar of the header is dropped.
     *
     * @return the number of headers added to the {@code store}
     */
    public int readInto(HttpHeaderStore store) {
        requireNonNull(store, "store");
        int numAdded = 0;
        for (;;) {
            final Map.Entry<String, String> header = readHeader();
            if (header == null) {
                return numAdded;
            }
            if (store.tryAdd(header.getKey(), header.getValue())) {
                numAdded++;
            } else {
                logger.debug("Dropped a header with a malformed value: {}: {}",
                             header.getKey(), header.getValue());
            }
        }
    }

    /**
     * Finds the next line and stores its region in {@link #lineStart} and {@link #lineLength}.
     *
     * @return {@code false} if all characters have been read.
     */
    private boolean readLineRegion() {
        int i = position;
        while (i < endIndex) {
            if (buffer[i] == '\r') {
                final int next = i + 1;
                if (next < endIndex && buffer[next] == '\n') {
                    lineStart = position;
                    lineLength = i - position;
                    position = i + 2;
                    return true;
                }
            }
            i++;
        }

        if (i > position) {
            lineStart = position;
            lineLength = i - position;
            position = i;
            return true;
        }

        lineStart = 0;
        lineLength = 0;
        return false;
    }

    private String headerValue(String name, int startIndex, int length) {
        if (length == 0) {
            return "";
        }

        // The value of Content-Encoding is very likely to be either gzip or deflate.
        // The identity check is enough because a known name is always the constant.
        if (name == HttpHeaderNames.CONTENT_ENCODING) {
            if (CharArrays.equalsIgnoreCase(GZIP, buffer, startIndex, length)) {
                return GZIP;
            }
            if (CharArrays.equalsIgnoreCase(DEFLATE, buffer, startIndex, length)) {
                return DEFLATE;
            }
        }

        return new String(buffer, startIndex, length);
    }
}
