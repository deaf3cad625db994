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
package ch.randelshofer.vavr.safe.statistics;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.LinkedHashMap;
import io.vavr.collection.Map;
import io.vavr.collection.Vector;

import java.util.Objects;

/**
 * Descriptive statistics over sequences of numbers.
 * <p>
 * All functions accept any {@code Iterable} of {@link Number}s, including the
 * {@code values()} of the safe containers, and never modify their input.
 * Numbers are evaluated as {@code double}.
 * <p>
 * Functions that are undefined for the given input throw an
 * {@link IllegalArgumentException} instead of returning a sentinel value.
 */
public final class Statistics {
    private Statistics() {
    }

    /**
     * Counts how often each item occurs. The returned map iterates in order of
     * first occurrence.
     *
     * @param items the items to count
     * @param <T>   the item type
     * @return a map from item to number of occurrences
     */
    public static <T> Map<T, Integer> frequency(Iterable<? extends T> items) {
        Objects.requireNonNull(items, "items is null");
        java.util.LinkedHashMap<T, Integer> counts = new java.util.LinkedHashMap<>();
        for (T item : items) {
            counts.merge(item, 1, Integer::sum);
        }
        return LinkedHashMap.ofAll(counts);
    }

    /**
     * Returns the median. For an even number of values this is the mean of the
     * two middle values.
     *
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double median(Iterable<? extends Number> values) {
        Vector<Double> sorted = sorted(values);
        int n = sorted.size();
        if (n == 0) {
            throw new IllegalArgumentException("cannot calculate median of empty sequence");
        }
        if (n % 2 == 0) {
            return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2;
        }
        return sorted.get(n / 2);
    }

    /**
     * Returns the smallest and the largest value.
     *
     * @return {@code (min, max)}
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static Tuple2<Double, Double> range(Iterable<? extends Number> values) {
        Vector<Double> sorted = sorted(values);
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("cannot calculate range of empty sequence");
        }
        return Tuple.of(sorted.head(), sorted.last());
    }

    /**
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mean(Iterable<? extends Number> values) {
        Vector<Double> doubles = doubles(values);
        if (doubles.isEmpty()) {
            throw new IllegalArgumentException("cannot calculate mean of empty sequence");
        }
        return mean(doubles);
    }

    private static double mean(Vector<Double> doubles) {
        double sum = 0.0;
        for (double x : doubles) {
            sum += x;
        }
        return sum / doubles.size();
    }

    /**
     * Returns the sample variance, using {@code n - 1} as denominator.
     *
     * @throws IllegalArgumentException if there are fewer than two values
     */
    public static double variance(Iterable<? extends Number> values) {
        Vector<Double> doubles = doubles(values);
        int n = doubles.size();
        if (n < 2) {
            throw new IllegalArgumentException("variance requires at least two elements, got " + n);
        }
        double mean = mean(doubles);
        double sumOfSquares = 0.0;
        for (double x : doubles) {
            sumOfSquares += (x - mean) * (x - mean);
        }
        return sumOfSquares / (n - 1);
    }

    /**
     * Returns the sample standard deviation.
     *
     * @throws IllegalArgumentException if there are fewer than two values
     */
    public static double standardDeviation(Iterable<? extends Number> values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Returns the value below which the fraction {@code p} of the values lie,
     * interpolating linearly between the two closest ranks.
     *
     * @param values the values
     * @param p      a fraction between 0 and 1, e.g. 0.5 for the median
     * @throws IllegalArgumentException if {@code values} is empty or {@code p}
     *                                  is not in {@code [0, 1]}
     */
    public static double percentile(Iterable<? extends Number> values, double p) {
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException("percentile must be between 0 and 1, got " + p);
        }
        Vector<Double> sorted = sorted(values);
        int n = sorted.size();
        if (n == 0) {
            throw new IllegalArgumentException("cannot calculate percentile of empty sequence");
        }
        double rank = (n - 1) * p;
        int index = (int) rank;
        if (index == n - 1) {
            return sorted.get(n - 1);
        }
        double fraction = rank - index;
        return sorted.get(index) * (1 - fraction) + sorted.get(index + 1) * fraction;
    }

    private static Vector<Double> doubles(Iterable<? extends Number> values) {
        Objects.requireNonNull(values, "values is null");
        return Vector.<Number>ofAll(values).map(Number::doubleValue);
    }

    private static Vector<Double> sorted(Iterable<? extends Number> values) {
        return doubles(values).sorted();
    }
}
