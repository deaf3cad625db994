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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.vavr.Function3;
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Seq;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Implements a mutable, thread-safe map with {@code String} keys that
 * iterates in the order in which keys were first inserted.
 * <p>
 * Features:
 * <ul>
 *     <li>is thread-safe, a single instance may be shared by any number of threads</li>
 *     <li>iterates in insertion order; re-adding a present key updates its value
 *     but does not move it</li>
 *     <li>allows null values, but not null keys</li>
 *     <li>reads from and writes to a JSON object</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>add, get, contains: O(1)</li>
 *     <li>delete, index: O(N)</li>
 *     <li>keys, values, clone: O(N)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * The entries live in an {@link OrderedEntries} store, a hash map plus a list
 * of keys in insertion order. All access to the store is guarded by one
 * reader/writer lock. Mutations hold the write lock; queries, traversals and
 * the builders of derived maps hold the read lock for their whole duration.
 * Derived maps are populated through the store directly, they are not visible
 * to other threads until they are returned.
 * <p>
 * Binary operations ({@link #union}, {@link #difference}, {@link #intersection},
 * {@link #subset}) copy what they need from the other map under the other
 * map's read lock, release it, and only then read this map. A thread never
 * holds the locks of two maps at the same time.
 * <p>
 * Callbacks passed to traversal methods run while the read lock is held. A
 * callback that tries to mutate the map it is called from gets an
 * {@link IllegalStateException}.
 *
 * @param <V> the value type
 */
public final class SafeOrderedMap<V> {
    private static final Logger logger = LoggerFactory.getLogger(SafeOrderedMap.class);

    private final ReadWriteGuard guard = new ReadWriteGuard();
    private final OrderedEntries<String, V> entries;

    public SafeOrderedMap() {
        this.entries = new OrderedEntries<>();
    }

    private SafeOrderedMap(OrderedEntries<String, V> entries) {
        this.entries = entries;
    }

    /**
     * Delegating creator: a {@code SafeOrderedMap<V>} property of a bean is
     * read from a JSON object.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    private SafeOrderedMap(Map<String, V> map) {
        this(copyOf(map));
    }

    private static <V> OrderedEntries<String, V> copyOf(Map<String, ? extends V> map) {
        OrderedEntries<String, V> entries = new OrderedEntries<>();
        if (map != null) {
            for (Map.Entry<String, ? extends V> e : map.entrySet()) {
                entries.putLast(requireKey(e.getKey()), e.getValue());
            }
        }
        return entries;
    }

    private static String requireKey(String key) {
        return Objects.requireNonNull(key, "key is null");
    }

    public static <V> SafeOrderedMap<V> empty() {
        return new SafeOrderedMap<>();
    }

    public static <V> SafeOrderedMap<V> of(String key, V value) {
        return SafeOrderedMap.<V>empty().add(key, value);
    }

    public static <V> SafeOrderedMap<V> of(String k1, V v1, String k2, V v2) {
        return SafeOrderedMap.<V>empty().add(k1, v1).add(k2, v2);
    }

    public static <V> SafeOrderedMap<V> of(String k1, V v1, String k2, V v2, String k3, V v3) {
        return SafeOrderedMap.<V>empty().add(k1, v1).add(k2, v2).add(k3, v3);
    }

    /**
     * Returns a {@code SafeOrderedMap} with the entries of a {@code java.util.Map},
     * in the iteration order of that map.
     *
     * @param map A map
     * @param <V> The value type
     * @return A new map containing the given entries
     * @throws NullPointerException if {@code map} or one of its keys is null
     */
    public static <V> SafeOrderedMap<V> ofAll(Map<String, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        return new SafeOrderedMap<>(copyOf(map));
    }

    /**
     * Reads a new map from a JSON object. Fields are added in document order.
     *
     * @param json      a JSON object
     * @param valueType the type of the field values
     * @param <V>       The value type
     * @return A new map
     * @throws JsonProcessingException if {@code json} is not a JSON object whose
     *                                 values can be read as {@code valueType}
     */
    public static <V> SafeOrderedMap<V> fromJson(String json, Class<V> valueType) throws JsonProcessingException {
        SafeOrderedMap<V> map = empty();
        map.readJson(json, valueType);
        return map;
    }

    // -- CRUD

    /**
     * Inserts or updates an entry. A new key is appended at the end of the
     * order, a present key keeps its position.
     *
     * @param key   a key
     * @param value a value
     * @return this map
     */
    public SafeOrderedMap<V> add(String key, V value) {
        requireKey(key);
        return guard.write(() -> {
            entries.putLast(key, value);
            return this;
        });
    }

    public Option<V> get(String key) {
        return guard.read(() -> entries.containsKey(key) ? Option.some(entries.get(key)) : Option.<V>none());
    }

    /**
     * Removes the entry with the given key. The remaining keys keep their
     * relative order. Does nothing if the key is absent.
     *
     * @param key a key
     * @return this map
     */
    public SafeOrderedMap<V> delete(String key) {
        return guard.write(() -> {
            entries.removeKey(key);
            return this;
        });
    }

    // -- keys and values

    /**
     * Returns the keys in insertion order. The returned sequence is an
     * immutable snapshot.
     */
    public Seq<String> keys() {
        return guard.read(entries::keys);
    }

    /**
     * Returns the values in the order of {@link #keys()}: the value at index
     * {@code i} belongs to the key at index {@code i}.
     */
    public Seq<V> values() {
        return guard.read(entries::values);
    }

    /**
     * Returns a snapshot of the entries as a {@link LinkedHashMap} in insertion
     * order. This is also the JSON representation of the map.
     */
    @JsonValue
    public LinkedHashMap<String, V> toJavaMap() {
        return guard.read(entries::toJavaMap);
    }

    // -- meta

    public boolean contains(String key) {
        return guard.read(() -> entries.containsKey(key));
    }

    public int size() {
        return guard.read(entries::size);
    }

    public boolean isEmpty() {
        return guard.read(entries::isEmpty);
    }

    /**
     * Returns an independent copy with the same entries in the same order.
     */
    @Override
    public SafeOrderedMap<V> clone() {
        return guard.read(() -> new SafeOrderedMap<>(new OrderedEntries<>(entries)));
    }

    /**
     * Returns the zero-based position of the key in the insertion order,
     * together with its value.
     *
     * @param key a key
     * @return {@code Some((position, value))}, or {@code None} if the key is absent
     */
    public Option<Tuple2<Integer, V>> index(String key) {
        return guard.read(() -> {
            int position = entries.indexOf(key);
            if (position < 0) {
                return Option.<Tuple2<Integer, V>>none();
            }
            return Option.some(Tuple.of(position, entries.valueAt(position)));
        });
    }

    // -- higher-order functions

    /**
     * Tests whether every entry satisfies the predicate. Stops at the first
     * entry that does not. Returns true for an empty map.
     */
    public boolean all(BiPredicate<? super String, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> entries.allMatch(predicate));
    }

    /**
     * Tests whether some entry satisfies the predicate. Stops at the first
     * entry that does. Returns false for an empty map.
     */
    public boolean any(BiPredicate<? super String, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> entries.anyMatch(predicate));
    }

    /**
     * Returns a new map with the same keys in the same order, and the values
     * computed by {@code mapper}. This map is not modified.
     */
    public <W> SafeOrderedMap<W> map(BiFunction<? super String, ? super V, ? extends W> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        return guard.read(() -> new SafeOrderedMap<W>(entries.<W>mapValues(mapper)));
    }

    public SafeOrderedMap<V> filter(BiPredicate<? super String, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> new SafeOrderedMap<>(entries.filter(predicate)));
    }

    /**
     * Performs the action on every entry, in order.
     *
     * @return this map
     */
    public SafeOrderedMap<V> each(BiConsumer<? super String, ? super V> action) {
        Objects.requireNonNull(action, "action is null");
        return guard.read(() -> {
            entries.forEach(action);
            return this;
        });
    }

    /**
     * Folds the entries from left to right, starting with {@code initial}.
     * Returns {@code initial} for an empty map.
     *
     * @param reducer receives the accumulator, the key and the value
     * @param initial the start value
     * @param <U>     the accumulator type
     * @return the accumulated value
     */
    public <U> U reduce(Function3<? super U, ? super String, ? super V, ? extends U> reducer, U initial) {
        Objects.requireNonNull(reducer, "reducer is null");
        return guard.read(() -> entries.foldLeft(initial, reducer));
    }

    /**
     * Returns the first entry, in order, that satisfies the predicate.
     */
    public Option<Tuple2<String, V>> find(BiPredicate<? super String, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> entries.findFirst(predicate));
    }

    /**
     * Returns the longest prefix of entries that satisfy the predicate.
     */
    public SafeOrderedMap<V> takeWhile(BiPredicate<? super String, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> new SafeOrderedMap<>(entries.takeWhile(predicate)));
    }

    /**
     * Returns the entries starting with the first one that does not satisfy
     * the predicate.
     */
    public SafeOrderedMap<V> dropWhile(BiPredicate<? super String, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return guard.read(() -> new SafeOrderedMap<>(entries.dropWhile(predicate)));
    }

    // -- set operations

    /**
     * Returns the entries of this map in order, followed by the entries of
     * {@code other} whose keys are not in this map, in the order of {@code other}.
     */
    public SafeOrderedMap<V> union(SafeOrderedMap<? extends V> other) {
        Objects.requireNonNull(other, "other is null");
        List<? extends Tuple2<String, ? extends V>> theirs = other.tuples();
        return guard.read(() -> new SafeOrderedMap<>(entries.union(theirs)));
    }

    /**
     * Returns the entries of this map whose keys are not in {@code other}.
     */
    public SafeOrderedMap<V> difference(SafeOrderedMap<?> other) {
        Objects.requireNonNull(other, "other is null");
        Set<String> theirs = other.keySet();
        return guard.read(() -> new SafeOrderedMap<>(entries.retainKeys(theirs, false)));
    }

    /**
     * Returns the entries of this map whose keys are also in {@code other}.
     * The values of this map are kept.
     */
    public SafeOrderedMap<V> intersection(SafeOrderedMap<?> other) {
        Objects.requireNonNull(other, "other is null");
        Set<String> theirs = other.keySet();
        return guard.read(() -> new SafeOrderedMap<>(entries.retainKeys(theirs, true)));
    }

    /**
     * Tests whether every key of this map is a key of {@code other}. Values are
     * not compared.
     */
    public boolean subset(SafeOrderedMap<?> other) {
        Objects.requireNonNull(other, "other is null");
        Set<String> theirs = other.keySet();
        return guard.read(() -> entries.allMatch((key, value) -> theirs.contains(key)));
    }

    public boolean superset(SafeOrderedMap<?> other) {
        Objects.requireNonNull(other, "other is null");
        return other.subset(this);
    }

    private Set<String> keySet() {
        return guard.read(entries::keySet);
    }

    private List<Tuple2<String, V>> tuples() {
        return guard.read(entries::toTuples);
    }

    // -- conversion

    /**
     * Writes the map as a JSON object with the fields in insertion order.
     *
     * @throws JsonProcessingException if a value cannot be written as JSON
     */
    public String toJson() throws JsonProcessingException {
        return JsonSupport.write(toJavaMap());
    }

    /**
     * Replaces the contents of this map with the fields of a JSON object.
     * The keys are ordered as the fields appear in the document.
     * <p>
     * The document is parsed before the lock is taken. If parsing fails, this
     * map is left unchanged; otherwise the old entries are replaced at once.
     *
     * @param json      a JSON object, or {@code null}
     * @param valueType the type of the field values
     * @throws JsonProcessingException if {@code json} is malformed or its values
     *                                 cannot be read as {@code valueType}
     */
    public void readJson(String json, Class<V> valueType) throws JsonProcessingException {
        readJson(json, JsonSupport.typeOf(valueType));
    }

    public void readJson(String json, TypeReference<V> valueType) throws JsonProcessingException {
        readJson(json, JsonSupport.typeOf(valueType));
    }

    private void readJson(String json, JavaType valueType) throws JsonProcessingException {
        LinkedHashMap<String, V> decoded = JsonSupport.readObject(json, valueType);
        OrderedEntries<String, V> replacement = copyOf(decoded);
        int size = guard.write(() -> {
            entries.clear();
            replacement.forEach(entries::putLast);
            return entries.size();
        });
        logger.debug("Replaced map contents with {} entries from JSON", size);
    }

    /**
     * Renders the entries as a JSON object.
     */
    @Override
    public String toString() {
        LinkedHashMap<String, V> snapshot = toJavaMap();
        try {
            return JsonSupport.write(snapshot);
        } catch (JsonProcessingException e) {
            logger.warn("Cannot render map as JSON, falling back to key=value form", e);
            return snapshot.toString();
        }
    }
}
