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

import ch.randelshofer.vavr.safe.statistics.Statistics;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.vavr.collection.Map;
import io.vavr.collection.Seq;
import io.vavr.collection.Vector;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Implements a mutable, thread-safe sequence of elements. Duplicates are
 * allowed; elements are compared with {@code equals}.
 * <p>
 * The slice offers the same vocabulary as {@link SafeSet}, plus
 * {@link #unique()}, {@link #frequency()} and {@link #mode()}. It shares no
 * storage with the map or the set, only the locking scheme.
 *
 * @param <T> the element type
 */
public final class SafeSlice<T> {
    private static final Logger logger = LoggerFactory.getLogger(SafeSlice.class);

    private final ReadWriteGuard guard = new ReadWriteGuard();
    private final ArrayList<T> elements;

    public SafeSlice() {
        this.elements = new ArrayList<>();
    }

    private SafeSlice(ArrayList<T> elements) {
        this.elements = elements;
    }

    public static <T> SafeSlice<T> empty() {
        return new SafeSlice<>();
    }

    @SafeVarargs
    public static <T> SafeSlice<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        return new SafeSlice<>(new ArrayList<>(Arrays.asList(elements)));
    }

    public static <T> SafeSlice<T> ofAll(Iterable<? extends T> elements) {
        return SafeSlice.<T>empty().addAll(elements);
    }

    // -- CRUD

    /**
     * Appends the element.
     *
     * @return this slice
     */
    public SafeSlice<T> add(T element) {
        return guard.write(() -> {
            elements.add(element);
            return this;
        });
    }

    public SafeSlice<T> addAll(Iterable<? extends T> items) {
        Objects.requireNonNull(items, "items is null");
        List<T> copy = new ArrayList<>();
        items.forEach(copy::add);
        return guard.write(() -> {
            elements.addAll(copy);
            return this;
        });
    }

    /**
     * Returns the element at {@code index}, or {@code None} if the index is out
     * of range.
     */
    public Option<T> get(int index) {
        return guard.read(() -> index < 0 || index >= elements.size()
                ? Option.<T>none()
                : Option.some(elements.get(index)));
    }

    /**
     * Removes the element at {@code index}. Does nothing if the index is out
     * of range.
     *
     * @return this slice
     */
    public SafeSlice<T> delete(int index) {
        return guard.write(() -> {
            if (index >= 0 && index < elements.size()) {
                elements.remove(index);
            }
            return this;
        });
    }

    public Option<T> first() {
        return get(0);
    }

    public Option<T> last() {
        return guard.read(() -> elements.isEmpty()
                ? Option.<T>none()
                : Option.some(elements.get(elements.size() - 1)));
    }

    public Seq<T> values() {
        return guard.read(() -> Vector.ofAll(elements));
    }

    // -- meta

    public boolean contains(T element) {
        return guard.read(() -> elements.contains(element));
    }

    public int size() {
        return guard.read(elements::size);
    }

    public boolean isEmpty() {
        return guard.read(elements::isEmpty);
    }

    @Override
    public SafeSlice<T> clone() {
        return guard.read(() -> new SafeSlice<>(new ArrayList<>(elements)));
    }

    /**
     * Returns the position of the first occurrence of the element.
     */
    public Option<Integer> index(T element) {
        return guard.read(() -> {
            int i = elements.indexOf(element);
            return i < 0 ? Option.<Integer>none() : Option.some(i);
        });
    }

    /**
     * Returns a new slice without duplicates; the first occurrence of each
     * element is kept.
     */
    public SafeSlice<T> unique() {
        return guard.read(() -> new SafeSlice<>(new ArrayList<>(new LinkedHashSet<>(elements))));
    }

    // -- higher-order functions

    public boolean all(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> {
            for (T element : elements) {
                if (!predicate.test(element)) {
                    return false;
                }
            }
            return true;
        });
    }

    public boolean any(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> {
            for (T element : elements) {
                if (predicate.test(element)) {
                    return true;
                }
            }
            return false;
        });
    }

    public <U> SafeSlice<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        return guard.read(() -> {
            ArrayList<U> mapped = new ArrayList<>(elements.size());
            for (T element : elements) {
                mapped.add(mapper.apply(element));
            }
            return new SafeSlice<>(mapped);
        });
    }

    public SafeSlice<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> {
            ArrayList<T> result = new ArrayList<>();
            for (T element : elements) {
                if (predicate.test(element)) {
                    result.add(element);
                }
            }
            return new SafeSlice<>(result);
        });
    }

    public SafeSlice<T> each(Consumer<? super T> action) {
        Objects.requireNonNull(action, "action is null");
        return guard.read(() -> {
            elements.forEach(action);
            return this;
        });
    }

    public <U> U reduce(BiFunction<? super U, ? super T, ? extends U> reducer, U initial) {
        Objects.requireNonNull(reducer, "reducer is null");
        return guard.read(() -> {
            U accumulator = initial;
            for (T element : elements) {
                accumulator = reducer.apply(accumulator, element);
            }
            return accumulator;
        });
    }

    public Option<T> find(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> {
            for (T element : elements) {
                if (predicate.test(element)) {
                    return Option.some(element);
                }
            }
            return Option.<T>none();
        });
    }

    public SafeSlice<T> takeWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> {
            int end = 0;
            while (end < elements.size() && predicate.test(elements.get(end))) {
                end++;
            }
            return new SafeSlice<>(new ArrayList<>(elements.subList(0, end)));
        });
    }

    public SafeSlice<T> dropWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> {
            int start = 0;
            while (start < elements.size() && predicate.test(elements.get(start))) {
                start++;
            }
            return new SafeSlice<>(new ArrayList<>(elements.subList(start, elements.size())));
        });
    }

    // -- set operations

    /**
     * Returns the elements of this slice, duplicates included, followed by the
     * elements of {@code other} that are not yet in the result.
     */
    public SafeSlice<T> union(SafeSlice<? extends T> other) {
        Objects.requireNonNull(other, "other is null");
        Seq<? extends T> theirs = other.values();
        return guard.read(() -> {
            ArrayList<T> result = new ArrayList<>(elements);
            Set<T> seen = new HashSet<>(elements);
            for (T element : theirs) {
                if (seen.add(element)) {
                    result.add(element);
                }
            }
            return new SafeSlice<>(result);
        });
    }

    /**
     * Returns the elements of this slice that {@code other} does not contain.
     */
    public SafeSlice<T> difference(SafeSlice<?> other) {
        Objects.requireNonNull(other, "other is null");
        Set<Object> theirs = other.elementSet();
        return filter(element -> !theirs.contains(element));
    }

    /**
     * Returns the elements of this slice that {@code other} also contains.
     */
    public SafeSlice<T> intersection(SafeSlice<?> other) {
        Objects.requireNonNull(other, "other is null");
        Set<Object> theirs = other.elementSet();
        return filter(theirs::contains);
    }

    public boolean subset(SafeSlice<?> other) {
        Objects.requireNonNull(other, "other is null");
        Set<Object> theirs = other.elementSet();
        return all(theirs::contains);
    }

    public boolean superset(SafeSlice<?> other) {
        Objects.requireNonNull(other, "other is null");
        return other.subset(this);
    }

    private Set<Object> elementSet() {
        return guard.read(() -> new HashSet<>(elements));
    }

    // -- statistics

    /**
     * Counts the occurrences of each element. The map iterates in order of
     * first occurrence.
     */
    public Map<T, Integer> frequency() {
        return Statistics.frequency(values());
    }

    /**
     * Returns the most frequent elements, in order of first occurrence. If
     * every element occurs once, all elements are returned. An empty slice
     * has no mode.
     */
    public Seq<T> mode() {
        Map<T, Integer> frequency = frequency();
        int highest = frequency.values().max().getOrElse(0);
        return frequency.filter((element, count) -> count == highest).keySet().toVector();
    }

    // -- conversion

    /**
     * Writes the elements as a JSON array.
     */
    public String toJson() throws JsonProcessingException {
        return JsonSupport.write(values().toJavaList());
    }

    /**
     * Replaces the contents of this slice with the elements of a JSON array.
     * If parsing fails, this slice is left unchanged.
     *
     * @throws JsonProcessingException if {@code json} is not a JSON array of
     *                                 {@code elementType}
     */
    public void readJson(String json, Class<T> elementType) throws JsonProcessingException {
        List<T> decoded = JsonSupport.readArray(json, JsonSupport.typeOf(elementType));
        int size = guard.write(() -> {
            elements.clear();
            elements.addAll(decoded);
            return elements.size();
        });
        logger.debug("Replaced slice contents with {} elements from JSON", size);
    }

    @Override
    public String toString() {
        return values().mkString("[", ", ", "]");
    }
}
