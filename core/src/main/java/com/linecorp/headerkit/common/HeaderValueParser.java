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

import java.util.List;
import java.util.function.Function;

import com.google.common.base.Equivalence;
import com.google.common.base.MoreObjects;

/**
 * The grammar of a header value: how a raw header value is parsed into one or more typed values, how two
 * parsed values are compared, and how a parsed value is rendered back into its wire form.
 *
 * @param <T> the type of the parsed values
 *
 * @see HeaderValueParsers
 */
final class HeaderValueParser<T> {

    private final String grammar;
    private final Class<T> valueType;
    private final Function<String, List<T>> parser;
    private final Equivalence<Object> equivalence;
    private final Function<? super T, String> formatter;

    HeaderValueParser(String grammar, Class<T> valueType, Function<String, List<T>> parser,
                      Equivalence<Object> equivalence, Function<? super T, String> formatter) {
        this.grammar = requireNonNull(grammar, "grammar");
        this.valueType = requireNonNull(valueType, "valueType");
        this.parser = requireNonNull(parser, "parser");
        this.equivalence = requireNonNull(equivalence, "equivalence");
        this.formatter = requireNonNull(formatter, "formatter");
    }

    /**
     * Returns the type of the values produced by this parser.
     */
    Class<T> valueType() {
        return valueType;
    }

    /**
     * Parses the specified raw header value.
     *
     * @return the parsed values in the order of appearance. Never empty.
     * @throws IllegalArgumentException if the value does not conform to this grammar.
     */
    List<T> parse(String value) {
        requireNonNull(value, "value");
        final List<T> parsed = parser.apply(value);
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("no " + grammar + " value in: " + value);
        }
        return parsed;
    }

    /**
     * Returns whether the two parsed values are the same according to this grammar.
     */
    boolean equivalent(Object a, Object b) {
        return equivalence.equivalent(a, b);
    }

    /**
     * Renders the specified parsed value into its wire form.
     */
    String format(Object value) {
        return formatter.apply(valueType.cast(value));
    }

    /**
     * Ensures the specified value can be stored for a header of this grammar.
     *
     * @throws IllegalArgumentException if {@code value} is not an instance of {@link #valueType()}.
     */
    T checkValue(Object value) {
        requireNonNull(value, "value");
        if (!valueType.isInstance(value)) {
            throw new IllegalArgumentException(
                    "value: " + value + " (expected: an instance of " + valueType.getName() + ')');
        }
        return valueType.cast(value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("grammar", grammar)
                          .add("valueType", valueType.getSimpleName())
                          .toString();
    }
}
