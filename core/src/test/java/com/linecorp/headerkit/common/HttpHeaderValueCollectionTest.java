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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Iterator;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

class HttpHeaderValueCollectionTest {

    private static HttpHeaderValueCollection<String> connection(HttpHeaderStore store) {
        return HttpHeaderValueCollection.of(HttpHeaderNames.CONNECTION, store, "close");
    }

    @Test
    void specialValueToggle() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> connection = connection(store);
        assertThat(connection.isSpecialValueSet()).isFalse();

        connection.setSpecialValue();
        assertThat(connection).containsExactly("close");
        assertThat(connection.isSpecialValueSet()).isTrue();

        // Setting again is a no-op.
        connection.setSpecialValue();
        assertThat(connection).hasSize(1);
        assertThat(store.getParsedValues("Connection")).isEqualTo("close");

        connection.removeSpecialValue();
        assertThat(connection).isEmpty();
        assertThat(connection.isSpecialValueSet()).isFalse();
        assertThat(store.contains("Connection")).isFalse();

        // Removing again is a no-op.
        connection.removeSpecialValue();
        assertThat(connection).isEmpty();
    }

    @Test
    void specialValueKeepsOtherValues() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> connection = connection(store);
        connection.add("keep-alive");
        connection.setSpecialValue();
        assertThat(connection).containsExactly("keep-alive", "close");

        connection.removeSpecialValue();
        assertThat(connection).containsExactly("keep-alive");
        assertThat(store.getParsedValues("Connection")).isEqualTo("keep-alive");
    }

    @Test
    void specialValueFromWire() {
        final HttpHeaderStore store = new HttpHeaderStore();
        store.add("Transfer-Encoding", "gzip, custom, Chunked");
        final HttpHeaderValueCollection<String> transferEncoding =
                HttpHeaderValueCollection.of(HttpHeaderNames.TRANSFER_ENCODING, store, "chunked");

        assertThat(transferEncoding.isSpecialValueSet()).isTrue();
        assertThat(transferEncoding).containsExactly("gzip", "custom", "Chunked");
        assertThat(transferEncoding.toString()).isEqualTo("gzip, custom, Chunked");
        assertThat(transferEncoding.toStringWithoutSpecialValue()).isEqualTo("gzip, custom");

        // Should not add a duplicate even if the case differs.
        transferEncoding.setSpecialValue();
        assertThat(transferEncoding).hasSize(3);
    }

    @Test
    void toStringWithoutSpecialValueWhenNotSet() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> connection = connection(store);
        assertThat(connection.toStringWithoutSpecialValue()).isEmpty();

        connection.parseAdd("keep-alive, upgrade");
        assertThat(connection.toStringWithoutSpecialValue()).isEqualTo("keep-alive, upgrade");
        assertThat(connection.toStringWithoutSpecialValue()).isEqualTo(connection.toString());
    }

    @Test
    void noSpecialValue() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> vary = HttpHeaderValueCollection.of(HttpHeaderNames.VARY, store);
        vary.add("close");
        assertThat(vary.isSpecialValueSet()).isFalse();
        assertThat(vary.toStringWithoutSpecialValue()).isEqualTo("close");
        assertThatThrownBy(vary::setSpecialValue).isInstanceOf(IllegalStateException.class)
                                                 .hasMessageContaining("Vary");
        assertThatThrownBy(vary::removeSpecialValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void countIsLive() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> a = HttpHeaderValueCollection.of("X-Foo", store);
        final HttpHeaderValueCollection<String> b = HttpHeaderValueCollection.of("x-foo", store);
        assertThat(b.size()).isZero();

        a.add("1");
        assertThat(b.size()).isOne();
        store.add("X-Foo", "2");
        store.add("X-Foo", "3");
        assertThat(b.size()).isEqualTo(3);

        b.clear();
        assertThat(a.size()).isZero();
        assertThat(store.contains("X-Foo")).isFalse();
    }

    @Test
    void iteration() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = HttpHeaderValueCollection.of("X-Foo", store);
        assertThat(view.iterator()).isExhausted();

        view.add("1");
        assertThat(ImmutableList.copyOf(view)).containsExactly("1");

        view.add("2");
        view.add("3");
        assertThat(ImmutableList.copyOf(view)).containsExactly("1", "2", "3");
        // Should be able to iterate again.
        assertThat(ImmutableList.copyOf(view)).containsExactly("1", "2", "3");
    }

    @Test
    void removeWhileIterating() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = HttpHeaderValueCollection.of("X-Foo", store);
        view.parseAdd("1");
        view.parseAdd("2");
        view.parseAdd("3");

        for (String value : view) {
            if ("1".equals(value)) {
                view.remove(value);
            }
            view.add("4");
        }
        assertThat(ImmutableList.copyOf(view)).containsExactly("2", "3", "4", "4", "4");
    }

    @Test
    void iteratorRemove() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = connection(store);
        store.add("Connection", "keep-alive, close, upgrade");

        final Iterator<String> it = view.iterator();
        assertThatThrownBy(it::remove).isInstanceOf(IllegalStateException.class);
        assertThat(it.next()).isEqualTo("keep-alive");
        it.remove();
        assertThatThrownBy(it::remove).isInstanceOf(IllegalStateException.class);
        assertThat(it.next()).isEqualTo("close");
        assertThat(it.next()).isEqualTo("upgrade");
        it.remove();
        assertThat(it.hasNext()).isFalse();
        assertThat(store.getParsedValues("Connection")).isEqualTo("close");
    }

    @Test
    void bulkRemoval() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = connection(store);
        store.add("Connection", "keep-alive, close, upgrade, close");

        assertThat(view.removeAll(ImmutableList.of("close"))).isTrue();
        assertThat(view.toString()).isEqualTo("keep-alive, upgrade");
        assertThat(view.isSpecialValueSet()).isFalse();

        assertThat(view.removeIf("keep-alive"::equals)).isTrue();
        assertThat(view.toString()).isEqualTo("upgrade");

        view.add("close");
        assertThat(view.retainAll(ImmutableList.of("close"))).isTrue();
        assertThat(view.toString()).isEqualTo("close");
        assertThat(view.retainAll(ImmutableList.of("close"))).isFalse();

        assertThat(view.removeIf("close"::equals)).isTrue();
        assertThat(view).isEmpty();
        assertThat(store.contains("Connection")).isFalse();
    }

    @Test
    void removeSpecialValueRemovesOneOccurrence() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = connection(store);
        store.add("Connection", "close, keep-alive, close");

        assertThat(view.toStringWithoutSpecialValue()).isEqualTo("keep-alive");
        view.removeSpecialValue();
        assertThat(view.isSpecialValueSet()).isTrue();
        assertThat(view.toString()).isEqualTo("keep-alive, close");
        assertThat(view.toStringWithoutSpecialValue()).isEqualTo("keep-alive");

        view.removeSpecialValue();
        assertThat(view.isSpecialValueSet()).isFalse();
        assertThat(view.toStringWithoutSpecialValue()).isEqualTo("keep-alive");
    }

    @Test
    void addContainsRemove() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = HttpHeaderValueCollection.of("X-Foo", store);
        assertThat(view.add("a")).isTrue();
        assertThat(view.add("a")).isTrue();
        assertThat(view).containsExactly("a", "a");
        assertThat(view.contains("a")).isTrue();
        assertThat(view.contains("b")).isFalse();

        assertThat(view.remove("a")).isTrue();
        assertThat(view).containsExactly("a");
        assertThat(view.remove("b")).isFalse();

        assertThatThrownBy(() -> view.add(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> view.contains(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> view.remove(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void validator() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = HttpHeaderValueCollection.withValidator(
                "X-Foo", store, (collection, item) -> {
                    checkArgument(!item.isEmpty(), "empty %s value", collection.headerName());
                });

        view.add("a");
        assertThatThrownBy(() -> view.add("")).isInstanceOf(IllegalArgumentException.class)
                                              .hasMessage("empty X-Foo value");
        assertThatThrownBy(() -> view.contains("")).isInstanceOf(IllegalArgumentException.class);
        assertThat(view).containsExactly("a");
    }

    @Test
    void parseAdd() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<Long> contentLength =
                HttpHeaderValueCollection.of(HttpHeaderNames.CONTENT_LENGTH, store);

        assertThat(contentLength.tryParseAdd("abc")).isFalse();
        assertThat(contentLength).isEmpty();
        assertThatThrownBy(() -> contentLength.parseAdd("abc")).isInstanceOf(IllegalArgumentException.class);

        contentLength.parseAdd("42");
        assertThat(contentLength.contains(42L)).isTrue();
        assertThat(contentLength).containsExactly(42L);
        assertThat(contentLength.toString()).isEqualTo("42");
    }

    @Test
    void copyTo() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = HttpHeaderValueCollection.of("X-Foo", store);
        view.add("1");
        view.add("2");
        view.add("3");

        final String[] array = new String[3];
        view.copyTo(array, 0);
        assertThat(array).containsExactly("1", "2", "3");

        final String[] larger = new String[5];
        view.copyTo(larger, 2);
        assertThat(larger).containsExactly(null, null, "1", "2", "3");

        assertThatThrownBy(() -> view.copyTo(new String[2], 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> view.copyTo(new String[3], 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copyToSingleValue() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = HttpHeaderValueCollection.of("X-Foo", store);
        view.add("1");

        final String[] array = new String[2];
        view.copyTo(array, 1);
        assertThat(array).containsExactly(null, "1");
        assertThatThrownBy(() -> view.copyTo(new String[2], 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> view.copyTo(new String[0], 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copyToEmpty() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = HttpHeaderValueCollection.of("X-Foo", store);

        view.copyTo(new String[0], 0);
        final String[] array = { "a", "b" };
        view.copyTo(array, 2);
        view.copyTo(array, 0);
        assertThat(array).containsExactly("a", "b");
    }

    @Test
    void copyToRejectsInvalidArguments() {
        final HttpHeaderStore store = new HttpHeaderStore();
        final HttpHeaderValueCollection<String> view = HttpHeaderValueCollection.of("X-Foo", store);
        assertThatThrownBy(() -> view.copyTo(null, 0)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> view.copyTo(new String[2], -1))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> view.copyTo(new String[2], 3))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
