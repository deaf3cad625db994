/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2023 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.safe;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.Seq;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Implements a mutable, thread-safe set that iterates in the order in which
 * elements were first added.
 * <p>
 * Each element is stored under a key computed by the set's key extractor. Two
 * elements with equal keys are duplicates; adding a duplicate leaves the set
 * unchanged. By default the key is the element itself, so duplicates are
 * decided by {@code equals} and {@code hashCode}. Element types without a
 * meaningful {@code equals} can be deduplicated by content with
 * {@link #byFingerprint()}.
 * <p>
 * Locking follows {@link SafeOrderedMap}: one reader/writer lock per set,
 * callbacks run under the read lock, and binary operations copy the other
 * set's keys before they read this set.
 *
 * @param <T> the element type
 */
public final class SafeSet<T> {
    private static final Logger logger = LoggerFactory.getLogger(SafeSet.class);
    private static final Function<Object, String> FINGERPRINT = Fingerprints::sha256;

    private final ReadWriteGuard guard = new ReadWriteGuard();
    private final Function<? super T, ?> keyExtractor;
    private final OrderedEntries<Object, T> entries;

    private SafeSet(Function<? super T, ?> keyExtractor, OrderedEntries<Object, T> entries) {
        this.keyExtractor = keyExtractor;
        this.entries = entries;
    }

    public SafeSet() {
        this(Function.identity(), new OrderedEntries<>());
    }

    public static <T> SafeSet<T> empty() {
        return new SafeSet<>();
    }

    @SafeVarargs
    public static <T> SafeSet<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return SafeSet.<T>empty().addAll(Arrays.asList(elements));
    }

    public static <T> SafeSet<T> ofAll(Iterable<? extends T> elements) {
        return SafeSet.<T>empty().addAll(elements);
    }

    /**
     * Returns an empty set that treats two elements as duplicates if the key
     * extractor maps them to equal keys.
     *
     * @param keyExtractor computes the identity of an element
     * @param <T>          the element type
     * @return a new, empty set
     */
    public static <T> SafeSet<T> keyedBy(Function<? super T, ?> keyExtractor) {
        Objects.requireNonNull(keyExtractor, "keyExtractor is null");
        return new SafeSet<>(keyExtractor, new OrderedEntries<>());
    }

    /**
     * Returns an empty set that deduplicates elements by their
     * {@linkplain Fingerprints#sha256(Object) fingerprint}.
     */
    public static <T> SafeSet<T> byFingerprint() {
        return keyedBy(FINGERPRINT);
    }

    private Object keyOf(T element) {
        return keyExtractor.apply(element);
    }

    private SafeSet<T> derive(OrderedEntries<Object, T> derived) {
        return new SafeSet<>(keyExtractor, derived);
    }

    // -- CRUD

    /**
     * Adds the element unless a duplicate is already present.
     *
     * @return this set
     */
    public SafeSet<T> add(T element) {
        Object key = keyOf(element);
        return guard.write(() -> {
            entries.putIfAbsent(key, element);
            return this;
        });
    }

    public SafeSet<T> addAll(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        List<Tuple2<Object, T>> keyed = new ArrayList<>();
        for (T element : elements) {
            keyed.add(Tuple.of(keyOf(element), element));
        }
        return guard.write(() -> {
            for (Tuple2<Object, T> t : keyed) {
                entries.putIfAbsent(t._1, t._2);
            }
            return this;
        });
    }

    /**
     * Removes the element, or its duplicate, if present.
     *
     * @return this set
     */
    public SafeSet<T> remove(T element) {
        Object key = keyOf(element);
        return guard.write(() -> {
            entries.removeKey(key);
            return this;
        });
    }

    /**
     * Returns the element at the given position of the insertion order.
     *
     * @param index a zero-based position
     * @return {@code None} if {@code index} is out of range
     */
    public Option<T> get(int index) {
        return guard.read(() -> index < 0 || index >= entries.size()
                ? Option.<T>none()
                : Option.some(entries.valueAt(index)));
    }

    /**
     * Removes the element at the given position. Does nothing if
     * {@code index} is out of range.
     *
     * @return this set
     */
    public SafeSet<T> delete(int index) {
        return guard.write(() -> {
            if (index >= 0 && index < entries.size()) {
                entries.removeKey(entries.keyAt(index));
            }
            return this;
        });
    }

    public Option<T> first() {
        return get(0);
    }

    public Option<T> last() {
        return guard.read(() -> entries.isEmpty()
                ? Option.<T>none()
                : Option.some(entries.valueAt(entries.size() - 1)));
    }

    public Seq<T> values() {
        return guard.read(entries::values);
    }

    // -- meta

    public boolean contains(T element) {
        Object key = keyOf(element);
        return guard.read(() -> entries.containsKey(key));
    }

    public int size() {
        return guard.read(entries::size);
    }

    public boolean isEmpty() {
        return guard.read(entries::isEmpty);
    }

    @Override
    public SafeSet<T> clone() {
        return guard.read(() -> derive(new OrderedEntries<>(entries)));
    }

    // -- higher-order functions

    public boolean all(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> entries.allMatch((key, element) -> predicate.test(element)));
    }

    public boolean any(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> entries.anyMatch((key, element) -> predicate.test(element)));
    }

    /**
     * Returns a new set of the mapped elements. Mapped elements that are
     * duplicates collapse into one, at the position of the first. This set is
     * not modified.
     * <p>
     * If this set deduplicates by {@linkplain #byFingerprint() fingerprint}, so
     * does the result; otherwise the result uses {@code equals}.
     */
    public <U> SafeSet<U> map(Function<? super T, ? extends U> mapper) {
        Function<? super U, ?> mappedKey = keyExtractor == FINGERPRINT ? FINGERPRINT : Function.<U>identity();
        return map(mapper, mappedKey);
    }

    /**
     * Returns a new set of the mapped elements, deduplicated by the given key
     * extractor. This set is not modified.
     */
    public <U> SafeSet<U> map(Function<? super T, ? extends U> mapper, Function<? super U, ?> keyExtractor) {
        Objects.requireNonNull(mapper, "mapper is null");
        Objects.requireNonNull(keyExtractor, "keyExtractor is null");
        return guard.read(() -> {
            OrderedEntries<Object, U> mapped = new OrderedEntries<>();
            entries.forEach((key, element) -> {
                U u = mapper.apply(element);
                mapped.putIfAbsent(keyExtractor.apply(u), u);
            });
            return new SafeSet<U>(keyExtractor, mapped);
        });
    }

    public SafeSet<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> derive(entries.filter((key, element) -> predicate.test(element))));
    }

    public SafeSet<T> each(Consumer<? super T> action) {
        Objects.requireNonNull(action, "action is null");
        return guard.read(() -> {
            entries.forEach((key, element) -> action.accept(element));
            return this;
        });
    }

    public <U> U reduce(BiFunction<? super U, ? super T, ? extends U> reducer, U initial) {
        Objects.requireNonNull(reducer, "reducer is null");
        return guard.read(() -> entries.<U>foldLeft(initial, (acc, key, element) -> reducer.apply(acc, element)));
    }

    public Option<T> find(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> entries.findFirst((key, element) -> predicate.test(element)).map(Tuple2::_2));
    }

    /**
     * Returns the longest prefix of elements that satisfy the predicate.
     */
    public SafeSet<T> takeWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> derive(entries.takeWhile((key, element) -> predicate.test(element))));
    }

    /**
     * Returns the elements starting with the first one that does not satisfy
     * the predicate.
     */
    public SafeSet<T> dropWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> derive(entries.dropWhile((key, element) -> predicate.test(element))));
    }

    // -- set operations

    /**
     * Returns the elements of this set followed by the elements of
     * {@code other} that are not in this set. Duplicates are decided by the key
     * extractor of this set.
     */
    public SafeSet<T> union(SafeSet<? extends T> other) {
        Objects.requireNonNull(other, "other is null");
        List<Tuple2<Object, T>> theirs = Iterator.<T>ofAll(other.values())
                .map(element -> Tuple.of(keyOf(element), element))
                .toJavaList();
        return guard.read(() -> derive(entries.union(theirs)));
    }

    /**
     * Returns the elements of this set that {@code other} does not contain.
     */
    public SafeSet<T> difference(SafeSet<T> other) {
        Objects.requireNonNull(other, "other is null");
        Set<Object> theirs = other.keySet();
        return guard.read(() -> derive(entries.filter((key, element) -> !theirs.contains(other.keyOf(element)))));
    }

    public SafeSet<T> intersection(SafeSet<T> other) {
        Objects.requireNonNull(other, "other is null");
        Set<Object> theirs = other.keySet();
        return guard.read(() -> derive(entries.filter((key, element) -> theirs.contains(other.keyOf(element)))));
    }

    /**
     * Tests whether {@code other} contains every element of this set.
     */
    public boolean subset(SafeSet<T> other) {
        Objects.requireNonNull(other, "other is null");
        Set<Object> theirs = other.keySet();
        return guard.read(() -> entries.allMatch((key, element) -> theirs.contains(other.keyOf(element))));
    }

    public boolean superset(SafeSet<T> other) {
        Objects.requireNonNull(other, "other is null");
        return other.subset(this);
    }

    private Set<Object> keySet() {
        return guard.read(entries::keySet);
    }

    // -- conversion

    /**
     * Writes the elements as a JSON array, in insertion order.
     */
    public String toJson() throws JsonProcessingException {
        return JsonSupport.write(values().toJavaList());
    }

    /**
     * Replaces the contents of this set with the elements of a JSON array.
     * Duplicates in the array are dropped. If parsing fails, this set is left
     * unchanged.
     *
     * @throws JsonProcessingException if {@code json} is not a JSON array of
     *                                 {@code elementType}
     */
    public void readJson(String json, Class<T> elementType) throws JsonProcessingException {
        List<T> decoded = JsonSupport.readArray(json, JsonSupport.typeOf(elementType));
        OrderedEntries<Object, T> replacement = new OrderedEntries<>();
        for (T element : decoded) {
            replacement.putIfAbsent(keyOf(element), element);
        }
        int size = guard.write(() -> {
            entries.clear();
            replacement.forEach(entries::putLast);
            return entries.size();
        });
        logger.debug("Replaced set contents with {} elements from JSON", size);
    }

    @Override
    public String toString() {
        return values().mkString("[", ", ", "]");
    }
}
