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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import com.linecorp.headerkit.common.annotation.Nullable;

/**
 * A mutable store of the HTTP headers of a single request or response.
 *
 * <p>Each header name maps to an entry holding the values parsed from the raw header values, in insertion
 * order. The raw values are parsed according to the grammar registered for the header name; e.g. the
 * value {@code "gzip, chunked"} of {@code "Transfer-Encoding"} is stored as two tokens while the value of an
 * unknown header is stored as is. An entry holds either a single value or a list of two or more values.
 * Header names are case-insensitive.</p>
 *
 * <h2>Thread safety</h2>
 * <p>This class is not thread-safe. A store is meant to be populated by a single thread, e.g. while parsing
 * a header block, and then shared for reading only.</p>
 */
public final class HttpHeaderStore {

    private static final Logger logger = LoggerFactory.getLogger(HttpHeaderStore.class);

    private static final String SEPARATOR = ", ";

    private final Map<String, HeaderEntry> entries = new LinkedHashMap<>();

    /**
     * Parses the specified raw header value and adds the parsed values to the header.
     *
     * @throws IllegalArgumentException if the {@code name} is malformed or the {@code value} does not conform
     *                                  to the grammar of the header. The store is left unchanged.
     */
    public void add(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        if (Flags.validateHeaders()) {
            HttpHeaderNames.validate(name);
        }
        final HeaderValueParser<?> parser = HeaderValueParsers.forName(name);
        final List<?> parsed = parser.parse(value);
        final HeaderEntry entry = getOrCreate(name, parser);
        for (Object v : parsed) {
            entry.append(v);
        }
    }

    /**
     * Parses the specified raw header value and adds the parsed values to the header. Unlike
     * {@link #add(String, String)}, this method does not raise an exception for a malformed value.
     *
     * @return {@code true} if the value was added, or {@code false} if the value was malformed, in which
     *         case the store is left unchanged.
     */
    public boolean tryAdd(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        try {
            add(name, value);
            return true;
        } catch (IllegalArgumentException e) {
            logger.debug("Rejected a malformed header: {}: {} ({})", name, value, e.getMessage());
            return false;
        }
    }

    /**
     * Removes the header with the specified name and all its values.
     *
     * @return {@code true} if the header existed.
     */
    public boolean remove(String name) {
        requireNonNull(name, "name");
        return entries.remove(key(name)) != null;
    }

    /**
     * Returns whether the header with the specified name exists.
     */
    public boolean contains(String name) {
        requireNonNull(name, "name");
        return entries.containsKey(key(name));
    }

    /**
     * Returns whether the header with the specified name has a value equivalent to the specified
     * {@code value}. Values are compared as defined by the grammar of the header, e.g. tokens are compared
     * case-insensitively.
     */
    public boolean containsParsedValue(String name, Object value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        final HeaderEntry entry = entries.get(key(name));
        return entry != null && entry.indexOf(value) >= 0;
    }

    /**
     * Returns the parsed values of the header with the specified name.
     *
     * @return {@code null} if the header does not exist, the value itself if the header has a single value,
     *         or an immutable copy of the values in insertion order if the header has two or more values.
     *         The returned {@link List} does not reflect later changes of the header.
     */
    @Nullable
    public Object getParsedValues(String name) {
        requireNonNull(name, "name");
        final HeaderEntry entry = entries.get(key(name));
        if (entry == null) {
            return null;
        }
        final Object value = entry.value;
        if (value instanceof ValueList) {
            return ImmutableList.copyOf((ValueList) value);
        }
        return value;
    }

    /**
     * Adds the specified parsed value to the header with the specified name.
     *
     * @throws IllegalArgumentException if {@code value} is not of the type produced by the grammar of
     *                                  the header.
     */
    public void addParsedValue(String name, Object value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        final HeaderValueParser<?> parser = HeaderValueParsers.forName(name);
        final Object checked = parser.checkValue(value);
        getOrCreate(name, parser).append(checked);
    }

    /**
     * Removes the first value equivalent to the specified {@code value} from the header with the specified
     * name. The header is removed when its last value is removed.
     *
     * @return {@code true} if a value was removed.
     */
    public boolean removeParsedValue(String name, Object value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        final String key = key(name);
        final HeaderEntry entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        final int index = entry.indexOf(value);
        if (index < 0) {
            return false;
        }
        if (entry.removeAt(index)) {
            entries.remove(key);
        }
        return true;
    }

    /**
     * Returns the wire form of the values of the header with the specified name, joined with
     * {@code ", "}, or an empty {@link String} if the header does not exist.
     */
    public String getHeaderString(String name) {
        return getHeaderString(name, null);
    }

    /**
     * Returns the wire form of the values of the header with the specified name, joined with
     * {@code ", "}, leaving out the values equivalent to {@code excludedValue}.
     */
    public String getHeaderString(String name, @Nullable Object excludedValue) {
        requireNonNull(name, "name");
        final HeaderEntry entry = entries.get(key(name));
        if (entry == null) {
            return "";
        }
        final StringBuilder buf = new StringBuilder();
        entry.appendTo(buf, excludedValue);
        return buf.toString();
    }

    /**
     * Returns the names of the headers in insertion order. A known header name is returned in its canonical
     * casing as defined in {@link HttpHeaderNames}; any other name in the casing it was first added with.
     */
    public Set<String> names() {
        final ImmutableSet.Builder<String> builder = ImmutableSet.builderWithExpectedSize(entries.size());
        for (HeaderEntry entry : entries.values()) {
            builder.add(entry.name);
        }
        return builder.build();
    }

    /**
     * Returns the number of headers in this store. A header with more than one value is counted once.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns whether this store has no header.
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Removes all headers.
     */
    public void clear() {
        entries.clear();
    }

    /**
     * Returns the headers in their wire form, i.e. one {@code "<name>: <values>\r\n"} line per header.
     */
    @Override
    public String toString() {
        final StringBuilder buf = new StringBuilder();
        for (HeaderEntry entry : entries.values()) {
            buf.append(entry.name).append(": ");
            entry.appendTo(buf, null);
            buf.append("\r\n");
        }
        return buf.toString();
    }

    private HeaderEntry getOrCreate(String name, HeaderValueParser<?> parser) {
        return entries.computeIfAbsent(key(name), unused -> new HeaderEntry(HttpHeaderNames.of(name), parser));
    }

    private static String key(String name) {
        return Ascii.toLowerCase(name);
    }

    /**
     * The values of a header that has two or more values. Distinguished from a single value by its type.
     */
    @SuppressWarnings("serial")
    private static final class ValueList extends ArrayList<Object> {
        ValueList(Object first, Object second) {
            super(4);
            add(first);
            add(second);
        }
    }

    private static final class HeaderEntry {

        final String name;
        final HeaderValueParser<?> parser;

        /**
         * The single value of the header, or a {@link ValueList} of two or more values.
         */
        @Nullable
        Object value;

        HeaderEntry(String name, HeaderValueParser<?> parser) {
            this.name = name;
            this.parser = parser;
        }

        void append(Object newValue) {
            final Object value = this.value;
            if (value == null) {
                this.value = newValue;
            } else if (value instanceof ValueList) {
                ((ValueList) value).add(newValue);
            } else {
                this.value = new ValueList(value, newValue);
            }
        }

        int indexOf(Object target) {
            final Object value = this.value;
            if (value instanceof ValueList) {
                final ValueList values = (ValueList) value;
                for (int i = 0; i < values.size(); i++) {
                    if (parser.equivalent(values.get(i), target)) {
                        return i;
                    }
                }
                return -1;
            }
            return value != null && parser.equivalent(value, target) ? 0 : -1;
        }

        /**
         * Removes the value at the specified index.
         *
         * @return {@code true} if the entry has no value left.
         */
        boolean removeAt(int index) {
            final Object value = this.value;
            if (!(value instanceof ValueList)) {
                assert index == 0 : index;
                this.value = null;
                return true;
            }

            final ValueList values = (ValueList) value;
            values.remove(index);
            if (values.size() == 1) {
                this.value = values.get(0);
            }
            return false;
        }

        void appendTo(StringBuilder buf, @Nullable Object excludedValue) {
            final Object value = this.value;
            if (value instanceof ValueList) {
                boolean first = true;
                for (Object v : (ValueList) value) {
                    if (excludedValue != null && parser.equivalent(v, excludedValue)) {
                        continue;
                    }
                    if (!first) {
                        buf.append(SEPARATOR);
                    }
                    buf.append(parser.format(v));
                    first = false;
                }
            } else if (value != null) {
                if (excludedValue == null || !parser.equivalent(value, excludedValue)) {
                    buf.append(parser.format(value));
                }
            }
        }
    }
}
