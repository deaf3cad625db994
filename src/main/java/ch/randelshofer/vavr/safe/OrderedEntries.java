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

import io.vavr.Function3;
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.Seq;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Mutable store of entries that remembers the order in which keys were first
 * inserted.
 * <p>
 * Every key is kept twice: in a hash map that holds the values, and in an
 * array list that holds the insertion order. Both structures always contain
 * exactly the same keys.
 * <p>
 * Implementation details:
 * <ul>
 *     <li>putLast, get, containsKey: O(1)</li>
 *     <li>removeKey, indexOf: O(N), the order list is scanned linearly</li>
 *     <li>traversals visit the keys in the order list</li>
 * </ul>
 * <p>
 * This class does not lock. The owning container guards every access with its
 * {@link ReadWriteGuard}; the traversal methods below are the lock-free
 * primitives the public, locking methods delegate to.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
final class OrderedEntries<K, V> {
    private final HashMap<K, V> entries;
    /**
     * Keys in insertion order.
     */
    private final ArrayList<K> order;

    OrderedEntries() {
        this.entries = new HashMap<>();
        this.order = new ArrayList<>();
    }

    OrderedEntries(OrderedEntries<K, V> that) {
        this.entries = new HashMap<>(that.entries);
        this.order = new ArrayList<>(that.order);
    }

    /**
     * Inserts or updates the entry. A new key is appended to the order, an
     * existing key keeps its position.
     *
     * @return true if the key was not present before
     */
    boolean putLast(K key, V value) {
        boolean added = !entries.containsKey(key);
        if (added) {
            order.add(key);
        }
        entries.put(key, value);
        return added;
    }

    /**
     * Inserts the entry only if the key is absent.
     *
     * @return true if the entry was inserted
     */
    boolean putIfAbsent(K key, V value) {
        if (entries.containsKey(key)) {
            return false;
        }
        order.add(key);
        entries.put(key, value);
        return true;
    }

    boolean removeKey(K key) {
        if (!entries.containsKey(key)) {
            return false;
        }
        entries.remove(key);
        order.remove(key);
        return true;
    }

    void clear() {
        entries.clear();
        order.clear();
    }

    boolean containsKey(Object key) {
        return entries.containsKey(key);
    }

    V get(Object key) {
        return entries.get(key);
    }

    int indexOf(K key) {
        return entries.containsKey(key) ? order.indexOf(key) : -1;
    }

    K keyAt(int index) {
        return order.get(index);
    }

    V valueAt(int index) {
        return entries.get(order.get(index));
    }

    int size() {
        return order.size();
    }

    boolean isEmpty() {
        return order.isEmpty();
    }

    Seq<K> keys() {
        return Vector.ofAll(order);
    }

    Seq<V> values() {
        return Vector.ofAll(Iterator.ofAll(order).map(entries::get));
    }

    Set<K> keySet() {
        return new HashSet<>(entries.keySet());
    }

    List<Tuple2<K, V>> toTuples() {
        List<Tuple2<K, V>> tuples = new ArrayList<>(order.size());
        for (K key : order) {
            tuples.add(Tuple.of(key, entries.get(key)));
        }
        return tuples;
    }

    LinkedHashMap<K, V> toJavaMap() {
        LinkedHashMap<K, V> map = new LinkedHashMap<>();
        for (K key : order) {
            map.put(key, entries.get(key));
        }
        return map;
    }

    // -- traversals

    boolean allMatch(BiPredicate<? super K, ? super V> predicate) {
        for (K key : order) {
            if (!predicate.test(key, entries.get(key))) {
                return false;
            }
        }
        return true;
    }

    boolean anyMatch(BiPredicate<? super K, ? super V> predicate) {
        for (K key : order) {
            if (predicate.test(key, entries.get(key))) {
                return true;
            }
        }
        return false;
    }

    Option<Tuple2<K, V>> findFirst(BiPredicate<? super K, ? super V> predicate) {
        for (K key : order) {
            V value = entries.get(key);
            if (predicate.test(key, value)) {
                return Option.some(Tuple.of(key, value));
            }
        }
        return Option.none();
    }

    void forEach(BiConsumer<? super K, ? super V> action) {
        for (K key : order) {
            action.accept(key, entries.get(key));
        }
    }

    <U> U foldLeft(U zero, Function3<? super U, ? super K, ? super V, ? extends U> f) {
        U accumulator = zero;
        for (K key : order) {
            accumulator = f.apply(accumulator, key, entries.get(key));
        }
        return accumulator;
    }

    <W> OrderedEntries<K, W> mapValues(BiFunction<? super K, ? super V, ? extends W> mapper) {
        OrderedEntries<K, W> result = new OrderedEntries<>();
        for (K key : order) {
            result.putLast(key, mapper.apply(key, entries.get(key)));
        }
        return result;
    }

    OrderedEntries<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
        OrderedEntries<K, V> result = new OrderedEntries<>();
        for (K key : order) {
            V value = entries.get(key);
            if (predicate.test(key, value)) {
                result.putLast(key, value);
            }
        }
        return result;
    }

    OrderedEntries<K, V> takeWhile(BiPredicate<? super K, ? super V> predicate) {
        OrderedEntries<K, V> result = new OrderedEntries<>();
        for (K key : order) {
            V value = entries.get(key);
            if (!predicate.test(key, value)) {
                break;
            }
            result.putLast(key, value);
        }
        return result;
    }

    OrderedEntries<K, V> dropWhile(BiPredicate<? super K, ? super V> predicate) {
        OrderedEntries<K, V> result = new OrderedEntries<>();
        boolean dropping = true;
        for (K key : order) {
            V value = entries.get(key);
            if (dropping && !predicate.test(key, value)) {
                dropping = false;
            }
            if (!dropping) {
                result.putLast(key, value);
            }
        }
        return result;
    }

    /**
     * Retains the entries whose key is, or is not, in the given key set.
     */
    OrderedEntries<K, V> retainKeys(Set<?> keys, boolean present) {
        return filter((key, value) -> keys.contains(key) == present);
    }

    /**
     * Returns a copy of this store followed by the given entries whose keys are not present yet.
     */
    OrderedEntries<K, V> union(Iterable<? extends Tuple2<? extends K, ? extends V>> others) {
        OrderedEntries<K, V> result = new OrderedEntries<>(this);
        for (Tuple2<? extends K, ? extends V> t : others) {
            result.putIfAbsent(t._1, t._2);
        }
        return result;
    }
}
