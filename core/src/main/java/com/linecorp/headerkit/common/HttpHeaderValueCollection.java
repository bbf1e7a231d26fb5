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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.AbstractCollection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiConsumer;

import com.google.common.collect.Iterators;

import com.linecorp.headerkit.common.annotation.Nullable;

/**
 * A live {@link java.util.Collection} view of the values of a single header in a {@link HttpHeaderStore}.
 *
 * <p>A view holds no state of its own. Every operation reads or writes the store, so a view always reflects
 * the current values of the header and two views of the same header are interchangeable.</p>
 *
 * <h2>Special value</h2>
 * <p>Some headers are lists of values of which the RFC defines a single value, such as
 * {@code "Transfer-Encoding: chunked"}, {@code "Connection: close"} and {@code "Expect: 100-continue"}.
 * A view may be created with such a special value, which is then exposed both as a member of the collection
 * and as the flag {@link #isSpecialValueSet()}. The flag is derived from the membership every time it is
 * read, and it is changed only with {@link #setSpecialValue()} and {@link #removeSpecialValue()}.
 * For example, a response with {@code "Transfer-Encoding: gzip, custom, chunked"} yields a view with the
 * three values {@code gzip}, {@code custom} and {@code chunked} whose flag is set.</p>
 *
 * @param <T> the type of the parsed header values
 */
public final class HttpHeaderValueCollection<T> extends AbstractCollection<T> {

    /**
     * Returns a new view of the values of the specified header.
     */
    public static <T> HttpHeaderValueCollection<T> of(String headerName, HttpHeaderStore store) {
        return new HttpHeaderValueCollection<>(headerName, store, null, null);
    }

    /**
     * Returns a new view of the values of the specified header, which exposes the presence of
     * {@code specialValue} as {@link #isSpecialValueSet()}.
     */
    public static <T> HttpHeaderValueCollection<T> of(String headerName, HttpHeaderStore store,
                                                      T specialValue) {
        requireNonNull(specialValue, "specialValue");
        return new HttpHeaderValueCollection<>(headerName, store, specialValue, null);
    }

    /**
     * Returns a new view of the values of the specified header.
     *
     * @param specialValue the special value of the header, or {@code null} if the header has none
     * @param validator the validator invoked with every item passed to {@link #add(Object)},
     *                  {@link #contains(Object)} and {@link #remove(Object)}. It may reject an item by
     *                  raising an {@link IllegalArgumentException}.
     */
    public static <T> HttpHeaderValueCollection<T> of(
            String headerName, HttpHeaderStore store, @Nullable T specialValue,
            @Nullable BiConsumer<? super HttpHeaderValueCollection<T>, ? super T> validator) {
        return new HttpHeaderValueCollection<>(headerName, store, specialValue, validator);
    }

    /**
     * Returns a new view of the values of the specified header, whose items are validated by
     * the specified {@code validator}.
     */
    public static <T> HttpHeaderValueCollection<T> withValidator(
            String headerName, HttpHeaderStore store,
            BiConsumer<? super HttpHeaderValueCollection<T>, ? super T> validator) {
        requireNonNull(validator, "validator");
        return new HttpHeaderValueCollection<>(headerName, store, null, validator);
    }

    private final String headerName;
    private final HttpHeaderStore store;
    @Nullable
    private final T specialValue;
    @Nullable
    private final BiConsumer<? super HttpHeaderValueCollection<T>, ? super T> validator;

    private HttpHeaderValueCollection(
            String headerName, HttpHeaderStore store, @Nullable T specialValue,
            @Nullable BiConsumer<? super HttpHeaderValueCollection<T>, ? super T> validator) {
        this.headerName = requireNonNull(headerName, "headerName");
        this.store = requireNonNull(store, "store");
        this.specialValue = specialValue;
        this.validator = validator;
    }

    /**
     * Returns the name of the header this view is bound to.
     */
    public String headerName() {
        return headerName;
    }

    /**
     * Adds the specified value to the header.
     *
     * @return {@code true} always, because a header may have duplicate values.
     */
    @Override
    public boolean add(T item) {
        checkValue(item);
        store.addParsedValue(headerName, item);
        return true;
    }

    /**
     * Parses the specified raw header value and adds the parsed values to the header.
     *
     * @throws IllegalArgumentException if the {@code input} does not conform to the grammar of the header.
     */
    public void parseAdd(String input) {
        store.add(headerName, input);
    }

    /**
     * Parses the specified raw header value and adds the parsed values to the header.
     *
     * @return {@code false} if the {@code input} does not conform to the grammar of the header, in which case
     *         the header is left unchanged.
     */
    public boolean tryParseAdd(String input) {
        return store.tryAdd(headerName, input);
    }

    /**
     * Removes the header from the store.
     */
    @Override
    public void clear() {
        store.remove(headerName);
    }

    @Override
    public boolean contains(Object item) {
        return store.containsParsedValue(headerName, checkValue(item));
    }

    @Override
    public boolean remove(Object item) {
        return store.removeParsedValue(headerName, checkValue(item));
    }

    /**
     * Returns the current number of values of the header. The values are counted on every invocation.
     */
    @Override
    public int size() {
        final Object storeValue = store.getParsedValues(headerName);
        if (storeValue == null) {
            return 0;
        }
        if (storeValue instanceof List) {
            return ((List<?>) storeValue).size();
        }
        return 1;
    }

    /**
     * Returns an {@link Iterator} over the values the header has when this method is invoked. Changes made
     * to the header during the iteration are not reflected. {@link Iterator#remove()} removes the first value
     * of the header equivalent to the last returned value, so the inherited bulk operations such as
     * {@link #removeAll(java.util.Collection)} and {@link #removeIf(java.util.function.Predicate)} are
     * supported.
     */
    @Override
    @SuppressWarnings("unchecked")
    public Iterator<T> iterator() {
        final Object storeValue = store.getParsedValues(headerName);
        if (storeValue == null) {
            return Collections.emptyIterator();
        }
        if (storeValue instanceof List) {
            return new SnapshotIterator(((List<T>) storeValue).iterator());
        }
        return new SnapshotIterator(Iterators.singletonIterator((T) storeValue));
    }

    /**
     * Copies the values of the header into the specified array, starting at {@code arrayIndex}.
     *
     * @throws NullPointerException if {@code array} is {@code null}
     * @throws IndexOutOfBoundsException if {@code arrayIndex} is negative or greater than the length of
     *                                   {@code array}. {@code arrayIndex} may be equal to the length of
     *                                   {@code array} if the header has no value.
     * @throws IllegalArgumentException if {@code array} does not have enough room after {@code arrayIndex}
     */
    @SuppressWarnings("unchecked")
    public void copyTo(T[] array, int arrayIndex) {
        requireNonNull(array, "array");
        if (arrayIndex < 0 || arrayIndex > array.length) {
            throw new IndexOutOfBoundsException(
                    "arrayIndex: " + arrayIndex + " (expected: 0 <= arrayIndex <= " + array.length + ')');
        }

        final Object storeValue = store.getParsedValues(headerName);
        if (storeValue == null) {
            return;
        }

        if (storeValue instanceof List) {
            final List<T> values = (List<T>) storeValue;
            checkArgument(array.length - arrayIndex >= values.size(),
                          "array too small: %s (expected: >= %s)", array.length, arrayIndex + values.size());
            for (int i = 0; i < values.size(); i++) {
                array[arrayIndex + i] = values.get(i);
            }
        } else {
            checkArgument(arrayIndex < array.length,
                          "array too small: %s (expected: >= %s)", array.length, arrayIndex + 1);
            array[arrayIndex] = (T) storeValue;
        }
    }

    /**
     * Returns whether this view has a special value and the header currently contains it.
     */
    public boolean isSpecialValueSet() {
        final T specialValue = this.specialValue;
        if (specialValue == null) {
            return false;
        }
        return store.containsParsedValue(headerName, specialValue);
    }

    /**
     * Adds the special value to the header unless the header already contains it.
     *
     * @throws IllegalStateException if this view was created without a special value
     */
    public void setSpecialValue() {
        final T specialValue = specialValue();
        if (!store.containsParsedValue(headerName, specialValue)) {
            store.addParsedValue(headerName, specialValue);
        }
    }

    /**
     * Removes the special value from the header if the header contains it. Only the first occurrence is
     * removed, so {@link #isSpecialValueSet()} remains {@code true} for a header that had the special value
     * more than once, e.g. {@code "Connection: close, close"}. {@link #toStringWithoutSpecialValue()} leaves
     * out every occurrence.
     *
     * @throws IllegalStateException if this view was created without a special value
     */
    public void removeSpecialValue() {
        store.removeParsedValue(headerName, specialValue());
    }

    /**
     * Returns the wire form of the values of the header, joined with {@code ", "}.
     */
    @Override
    public String toString() {
        return store.getHeaderString(headerName);
    }

    /**
     * Returns the wire form of the values of the header without any occurrence of the special value.
     * This is the same as {@link #toString()} if the special value is not set.
     */
    public String toStringWithoutSpecialValue() {
        if (!isSpecialValueSet()) {
            return toString();
        }
        return store.getHeaderString(headerName, specialValue);
    }

    private T specialValue() {
        final T specialValue = this.specialValue;
        checkState(specialValue != null, "%s has no special value.", headerName);
        return specialValue;
    }

    @SuppressWarnings("unchecked")
    private T checkValue(@Nullable Object item) {
        requireNonNull(item, "item");
        final T value = (T) item;
        if (validator != null) {
            validator.accept(this, value);
        }
        return value;
    }

    private final class SnapshotIterator implements Iterator<T> {

        private final Iterator<T> delegate;
        @Nullable
        private T lastReturned;

        SnapshotIterator(Iterator<T> delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public T next() {
            final T next = delegate.next();
            lastReturned = next;
            return next;
        }

        @Override
        public void remove() {
            final T lastReturned = this.lastReturned;
            checkState(lastReturned != null, "next() has not been called or remove() was already called.");
            this.lastReturned = null;
            store.removeParsedValue(headerName, lastReturned);
        }
    }
}
