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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vavr.Tuple;
import io.vavr.collection.List;
import io.vavr.control.Option;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SafeOrderedMapTest {

    private static SafeOrderedMap<Integer> oneTwoThree() {
        return SafeOrderedMap.<Integer>empty().add("1", 1).add("2", 2).add("3", 3);
    }

    private static SafeOrderedMap<Integer> oneToFour() {
        return oneTwoThree().add("4", 4);
    }

    // -- add

    @Test
    public void shouldKeepInsertionOrder() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        assertThat(map.keys()).containsExactly("1", "2", "3");
        assertThat(map.values()).containsExactly(1, 2, 3);
        assertThat(map.size()).isEqualTo(3);
    }

    @Test
    public void shouldKeepPositionWhenKeyIsAddedAgain() {
        SafeOrderedMap<Integer> map = oneTwoThree().add("1", 10);
        assertThat(map.keys()).containsExactly("1", "2", "3");
        assertThat(map.values()).containsExactly(10, 2, 3);
        assertThat(map.size()).isEqualTo(3);
    }

    @Test
    public void shouldMoveKeyToEndWhenDeletedAndAddedAgain() {
        SafeOrderedMap<Integer> map = oneTwoThree().delete("1").add("1", 1);
        assertThat(map.keys()).containsExactly("2", "3", "1");
    }

    @Test
    public void shouldAcceptNullValues() {
        SafeOrderedMap<Integer> map = SafeOrderedMap.of("a", null);
        assertThat(map.contains("a")).isTrue();
        assertThat(map.get("a")).isEqualTo(Option.some(null));
        assertThat(map.values()).containsExactly((Integer) null);
    }

    @Test
    public void shouldRejectNullKey() {
        assertThatThrownBy(() -> SafeOrderedMap.<Integer>empty().add(null, 1))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("key is null");
    }

    // -- get, delete, contains, index

    @Test
    public void shouldGetPresentAndAbsentKeys() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        assertThat(map.get("2")).isEqualTo(Option.some(2));
        assertThat(map.get("9")).isEqualTo(Option.none());
    }

    @Test
    public void shouldDeleteAllKeys() {
        SafeOrderedMap<Integer> map = oneTwoThree().delete("1").delete("2").delete("3");
        assertThat(map.size()).isZero();
        assertThat(map.isEmpty()).isTrue();
        assertThat(map.contains("1")).isFalse();
        assertThat(map.contains("2")).isFalse();
        assertThat(map.contains("3")).isFalse();
    }

    @Test
    public void shouldPreserveRelativeOrderOnDelete() {
        assertThat(oneTwoThree().delete("2").keys()).containsExactly("1", "3");
    }

    @Test
    public void shouldIgnoreDeleteOfAbsentKey() {
        assertThat(oneTwoThree().delete("9").keys()).containsExactly("1", "2", "3");
    }

    @Test
    public void shouldReturnIndexOfKey() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        assertThat(map.index("1")).isEqualTo(Option.some(Tuple.of(0, 1)));
        assertThat(map.index("3")).isEqualTo(Option.some(Tuple.of(2, 3)));
        assertThat(map.index("9")).isEqualTo(Option.none());
    }

    @Test
    public void shouldUpdateIndexAfterDelete() {
        assertThat(oneTwoThree().delete("1").index("3")).isEqualTo(Option.some(Tuple.of(1, 3)));
    }

    @Test
    public void shouldReturnSnapshotOfKeys() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        io.vavr.collection.Seq<String> keys = map.keys();
        map.add("4", 4);
        assertThat(keys).containsExactly("1", "2", "3");
    }

    // -- empty map

    @Test
    public void shouldReturnNeutralResultsOnEmptyMap() {
        SafeOrderedMap<Integer> empty = SafeOrderedMap.empty();
        assertThat(empty.keys()).isEmpty();
        assertThat(empty.values()).isEmpty();
        assertThat(empty.all((k, v) -> false)).isTrue();
        assertThat(empty.any((k, v) -> true)).isFalse();
        assertThat(empty.reduce((acc, k, v) -> acc + v, 7)).isEqualTo(7);
        assertThat(empty.find((k, v) -> true)).isEqualTo(Option.none());
        assertThat(empty.takeWhile((k, v) -> true).isEmpty()).isTrue();
        assertThat(empty.dropWhile((k, v) -> true).isEmpty()).isTrue();
        assertThat(empty.toString()).isEqualTo("{}");
    }

    // -- clone

    @Test
    public void shouldCloneIndependently() {
        SafeOrderedMap<Integer> source = oneTwoThree();
        SafeOrderedMap<Integer> clone = source.clone();
        assertThat(clone.keys()).containsExactly("1", "2", "3");
        assertThat(clone.values()).containsExactly(1, 2, 3);

        clone.add("4", 4).delete("1").add("2", 20);
        source.add("5", 5);

        assertThat(source.keys()).containsExactly("1", "2", "3", "5");
        assertThat(source.get("2")).isEqualTo(Option.some(2));
        assertThat(clone.keys()).containsExactly("2", "3", "4");
    }

    // -- higher-order functions

    @Test
    public void shouldShortCircuitAll() {
        AtomicInteger calls = new AtomicInteger();
        boolean result = oneToFour().all((k, v) -> {
            calls.incrementAndGet();
            return v < 2;
        });
        assertThat(result).isFalse();
        assertThat(calls.get()).isEqualTo(2);
        assertThat(oneToFour().all((k, v) -> v > 0)).isTrue();
    }

    @Test
    public void shouldShortCircuitAny() {
        AtomicInteger calls = new AtomicInteger();
        boolean result = oneToFour().any((k, v) -> {
            calls.incrementAndGet();
            return v == 2;
        });
        assertThat(result).isTrue();
        assertThat(calls.get()).isEqualTo(2);
        assertThat(oneToFour().any((k, v) -> v > 10)).isFalse();
    }

    @Test
    public void shouldMapValuesWithoutModifyingReceiver() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        SafeOrderedMap<String> mapped = map.map((k, v) -> k + ":" + v * 10);
        assertThat(mapped.keys()).containsExactly("1", "2", "3");
        assertThat(mapped.values()).containsExactly("1:10", "2:20", "3:30");
        assertThat(map.keys()).containsExactly("1", "2", "3");
        assertThat(map.values()).containsExactly(1, 2, 3);
    }

    @Test
    public void shouldFilterWithoutModifyingReceiver() {
        SafeOrderedMap<Integer> map = oneToFour();
        SafeOrderedMap<Integer> even = map.filter((k, v) -> v % 2 == 0);
        assertThat(even.keys()).containsExactly("2", "4");
        assertThat(map.keys()).containsExactly("1", "2", "3", "4");
    }

    @Test
    public void shouldVisitEntriesInOrder() {
        java.util.List<String> visited = new ArrayList<>();
        SafeOrderedMap<Integer> map = oneTwoThree();
        SafeOrderedMap<Integer> returned = map.each((k, v) -> visited.add(k + "=" + v));
        assertThat(visited).containsExactly("1=1", "2=2", "3=3");
        assertThat(returned).isSameAs(map);
    }

    @Test
    public void shouldReduceFromLeft() {
        SafeOrderedMap<Integer> map = SafeOrderedMap.of("a", 2, "b", 3, "c", 4);
        assertThat(map.reduce((acc, k, v) -> acc + v, 1)).isEqualTo(10);
        assertThat(map.reduce((acc, k, v) -> acc + k, "")).isEqualTo("abc");
    }

    @Test
    public void shouldFindFirstMatchInOrder() {
        SafeOrderedMap<Integer> map = oneToFour();
        assertThat(map.find((k, v) -> v > 1)).isEqualTo(Option.some(Tuple.of("2", 2)));
        assertThat(map.find((k, v) -> v > 9)).isEqualTo(Option.none());
    }

    @Test
    public void shouldTakeWhileAndDropWhile() {
        SafeOrderedMap<Integer> map = oneToFour();
        assertThat(map.takeWhile((k, v) -> v < 3).values()).containsExactly(1, 2);
        assertThat(map.dropWhile((k, v) -> v < 3).values()).containsExactly(3, 4);
    }

    @Test
    public void shouldStopTakeWhileAtFirstFailure() {
        SafeOrderedMap<Integer> map = SafeOrderedMap.<Integer>empty()
                .add("a", 1).add("b", 5).add("c", 2);
        assertThat(map.takeWhile((k, v) -> v < 3).keys()).containsExactly("a");
        assertThat(map.dropWhile((k, v) -> v < 3).keys()).containsExactly("b", "c");
    }

    @Test
    public void shouldSplitIntoComplementaryPrefixAndSuffix() {
        SafeOrderedMap<Integer> map = SafeOrderedMap.<Integer>empty();
        for (int i = 0; i < 10; i++) {
            map.add("k" + i, i);
        }
        for (int limit = 0; limit <= 10; limit++) {
            int l = limit;
            List<Integer> joined = List.ofAll(map.takeWhile((k, v) -> v < l).values())
                    .appendAll(map.dropWhile((k, v) -> v < l).values());
            assertThat(joined).isEqualTo(List.ofAll(map.values()));
        }
    }

    // -- set operations

    @Test
    public void shouldCalculateUnion() {
        SafeOrderedMap<Integer> other = SafeOrderedMap.of("4", 4, "5", 5, "6", 6);
        assertThat(oneTwoThree().union(other).values()).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    public void shouldKeepReceiverValuesInUnion() {
        SafeOrderedMap<Integer> other = SafeOrderedMap.of("3", 30, "1", 10, "7", 7);
        SafeOrderedMap<Integer> union = oneTwoThree().union(other);
        assertThat(union.keys()).containsExactly("1", "2", "3", "7");
        assertThat(union.values()).containsExactly(1, 2, 3, 7);
        assertThat(union.size()).isLessThanOrEqualTo(3 + other.size());
    }

    @Test
    public void shouldCalculateDifference() {
        SafeOrderedMap<Integer> other = SafeOrderedMap.of("2", 2, "3", 3, "4", 4);
        assertThat(oneTwoThree().difference(other).values()).containsExactly(1);
        assertThat(oneTwoThree().difference(SafeOrderedMap.empty()).keys()).containsExactly("1", "2", "3");
    }

    @Test
    public void shouldCalculateIntersection() {
        SafeOrderedMap<Integer> other = SafeOrderedMap.of("3", 30, "2", 20, "4", 40);
        SafeOrderedMap<Integer> intersection = oneTwoThree().intersection(other);
        assertThat(intersection.keys()).containsExactly("2", "3");
        assertThat(intersection.values()).containsExactly(2, 3);
    }

    @Test
    public void shouldCompareKeysOnlyForSubsetAndSuperset() {
        SafeOrderedMap<Integer> small = SafeOrderedMap.of("1", 100, "3", 300);
        SafeOrderedMap<Integer> big = oneTwoThree();
        assertThat(small.subset(big)).isTrue();
        assertThat(big.subset(small)).isFalse();
        assertThat(big.superset(small)).isTrue();
        assertThat(small.superset(big)).isFalse();
        assertThat(SafeOrderedMap.empty().subset(big)).isTrue();
    }

    @Test
    public void shouldHaveSameKeysWhenMutualSubsets() {
        SafeOrderedMap<Integer> a = SafeOrderedMap.of("x", 1, "y", 2);
        SafeOrderedMap<String> b = SafeOrderedMap.of("y", "b", "x", "a");
        assertThat(a.subset(b) && b.subset(a)).isTrue();
        assertThat(a.keys()).containsExactlyInAnyOrderElementsOf(b.keys());
    }

    @Test
    public void shouldOperateOnItself() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        assertThat(map.union(map).keys()).containsExactly("1", "2", "3");
        assertThat(map.intersection(map).keys()).containsExactly("1", "2", "3");
        assertThat(map.difference(map).isEmpty()).isTrue();
        assertThat(map.subset(map)).isTrue();
    }

    // -- factories

    @Test
    public void shouldCreateFromJavaMapInIterationOrder() {
        java.util.LinkedHashMap<String, Integer> source = new java.util.LinkedHashMap<>();
        source.put("z", 26);
        source.put("a", 1);
        SafeOrderedMap<Integer> map = SafeOrderedMap.ofAll(source);
        source.put("b", 2);
        assertThat(map.keys()).containsExactly("z", "a");
        assertThat(map.toJavaMap()).containsExactly(
                java.util.Map.entry("z", 26), java.util.Map.entry("a", 1));
    }

    // -- JSON

    @Test
    public void shouldWriteJsonInInsertionOrder() throws JsonProcessingException {
        SafeOrderedMap<Integer> map = SafeOrderedMap.of("b", 2, "a", 1, "c", 3);
        assertThat(map.toJson()).isEqualTo("{\"b\":2,\"a\":1,\"c\":3}");
        assertThat(map.toString()).isEqualTo("{\"b\":2,\"a\":1,\"c\":3}");
    }

    @Test
    public void shouldReadJsonInDocumentOrder() throws JsonProcessingException {
        SafeOrderedMap<Integer> map = SafeOrderedMap.fromJson("{\"z\":1,\"m\":2,\"a\":3}", Integer.class);
        assertThat(map.keys()).containsExactly("z", "m", "a");
        assertThat(map.values()).containsExactly(1, 2, 3);
    }

    @Test
    public void shouldRoundTripThroughJson() throws JsonProcessingException {
        SafeOrderedMap<Integer> map = oneToFour().delete("2").add("0", 0);
        SafeOrderedMap<Integer> copy = SafeOrderedMap.fromJson(map.toJson(), Integer.class);
        assertThat(copy.keys()).isEqualTo(map.keys());
        assertThat(copy.values()).isEqualTo(map.values());
    }

    @Test
    public void shouldReplaceContentsWhenReadingJson() throws JsonProcessingException {
        SafeOrderedMap<Integer> map = oneTwoThree();
        map.readJson("{\"x\":7}", Integer.class);
        assertThat(map.keys()).containsExactly("x");
        assertThat(map.contains("1")).isFalse();
    }

    @Test
    public void shouldReadJsonNullAsEmptyMap() throws JsonProcessingException {
        SafeOrderedMap<Integer> map = oneTwoThree();
        map.readJson("null", Integer.class);
        assertThat(map.isEmpty()).isTrue();
    }

    @Test
    public void shouldReadGenericValueTypes() throws JsonProcessingException {
        SafeOrderedMap<java.util.List<Integer>> map = SafeOrderedMap.empty();
        map.readJson("{\"odd\":[1,3],\"even\":[2,4]}", new TypeReference<java.util.List<Integer>>() {
        });
        assertThat(map.keys()).containsExactly("odd", "even");
        assertThat(map.get("even").get()).containsExactly(2, 4);
    }

    @Test
    public void shouldLeaveMapUnchangedOnMalformedJson() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        assertThatThrownBy(() -> map.readJson("{\"a\":", Integer.class))
                .isInstanceOf(JsonProcessingException.class);
        assertThatThrownBy(() -> map.readJson("[1,2,3]", Integer.class))
                .isInstanceOf(JsonProcessingException.class);
        assertThatThrownBy(() -> map.readJson("{\"a\":\"not a number\"}", Integer.class))
                .isInstanceOf(JsonProcessingException.class);
        assertThat(map.keys()).containsExactly("1", "2", "3");
        assertThat(map.values()).containsExactly(1, 2, 3);
    }

    public static class Inventory {
        public String owner;
        public SafeOrderedMap<String> shelves = SafeOrderedMap.empty();
    }

    @Test
    public void shouldSerializeAsPropertyOfBean() throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper();
        Inventory inventory = new Inventory();
        inventory.owner = "ann";
        inventory.shelves.add("top", "books").add("bottom", "shoes");

        String json = mapper.writeValueAsString(inventory);
        assertThat(json).contains("\"shelves\":{\"top\":\"books\",\"bottom\":\"shoes\"}");

        Inventory read = mapper.readValue(json, Inventory.class);
        assertThat(read.owner).isEqualTo("ann");
        assertThat(read.shelves.keys()).containsExactly("top", "bottom");
        assertThat(read.shelves.values()).containsExactly("books", "shoes");
    }

    // -- toString

    @Test
    public void shouldFallBackAndWarnWhenValueCannotBeRendered() {
        Logger logger = (Logger) LoggerFactory.getLogger(SafeOrderedMap.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            SafeOrderedMap<Object> map = SafeOrderedMap.of("a", new Object());
            assertThat(map.toString()).startsWith("{a=java.lang.Object@");
            assertThat(appender.list)
                    .anyMatch(e -> e.getLevel() == Level.WARN
                            && e.getFormattedMessage().contains("Cannot render map as JSON"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    // -- callbacks

    @Test
    public void shouldRejectMutationFromCallback() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        assertThatThrownBy(() -> map.each((k, v) -> map.add(k + k, v)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> map.all((k, v) -> map.delete(k).isEmpty()))
                .isInstanceOf(IllegalStateException.class);
        map.add("4", 4);
        assertThat(map.keys()).containsExactly("1", "2", "3", "4");
    }

    @Test
    public void shouldAllowReadsFromCallback() {
        SafeOrderedMap<Integer> map = oneTwoThree();
        assertThat(map.all((k, v) -> map.contains(k) && map.get(k).contains(v))).isTrue();
    }

    // -- clone

    @Test
    public void shouldNotAllowSubclassesThatBreakClone() {
        assertThat(Modifier.isFinal(SafeOrderedMap.class.getModifiers())).isTrue();
        assertThat(Modifier.isFinal(SafeSet.class.getModifiers())).isTrue();
        assertThat(Modifier.isFinal(SafeSlice.class.getModifiers())).isTrue();
    }
}
