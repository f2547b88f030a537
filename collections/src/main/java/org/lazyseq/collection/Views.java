/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * This file is part of Neo4j.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package org.lazyseq.collection;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.apache.commons.lang3.tuple.Pair;
import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.set.ImmutableSet;
import org.lazyseq.collection.adaptor.Distribution;
import org.lazyseq.collection.adaptor.EnumerateCursor;
import org.lazyseq.collection.adaptor.ExceptCursor;
import org.lazyseq.collection.adaptor.GenerateCursor;
import org.lazyseq.collection.adaptor.MapCursor;
import org.lazyseq.collection.adaptor.RandomView;
import org.lazyseq.collection.join.ExecutionPolicy;
import org.lazyseq.collection.join.JoinSelectors;
import org.lazyseq.collection.join.JoinWhereCursor;
import org.lazyseq.collection.product.CartesianProductCursor;
import org.lazyseq.util.Preconditions;

/**
 * Factory methods for {@link View}s. Nothing here copies or materializes the sequences a view is built from.
 */
public final class Views {
    private static final Random DEFAULT_ENGINE = new Random(new SecureRandom().nextLong());

    private Views() {
        throw new AssertionError("no instance");
    }

    /**
     * Wraps a list. The view is {@link Tier#RANDOM_ACCESS} for {@link java.util.RandomAccess} lists.
     */
    public static <T> View<T> of(List<T> list) {
        return new View<>(ListCursor.begin(list), ListCursor.end(list));
    }

    @SafeVarargs
    public static <T> View<T> of(T... elements) {
        return of(Arrays.asList(elements));
    }

    /**
     * Wraps an iterable that can be iterated more than once, yielding the same elements each time.
     */
    public static <T> View<T> of(Iterable<T> iterable) {
        return new View<>(IterableCursor.begin(iterable), IterableCursor.end(iterable));
    }

    public static <S, T> View<T> map(View<S> view, Function<? super S, ? extends T> function) {
        return new View<>(new MapCursor<>(view.begin(), function), new MapCursor<>(view.end(), function));
    }

    public static <T> View<Pair<Integer, T>> enumerate(View<T> view) {
        return enumerate(view, 0);
    }

    /**
     * Pairs every element with its index, counting from {@code start}.
     */
    public static <T> View<Pair<Integer, T>> enumerate(View<T> view, int start) {
        return new View<>(
                new EnumerateCursor<>(view.begin(), start), EnumerateCursor.end(view.begin(), view.end(), start));
    }

    /**
     * Calls {@code generator} for each of {@code amount} positions.
     */
    public static <T> View<T> generate(Supplier<? extends T> generator, long amount) {
        Preconditions.requireNonNegative(amount);
        return new View<>(new GenerateCursor<>(generator, 0, false), new GenerateCursor<>(generator, amount, false));
    }

    /**
     * Calls {@code generator} for every position of a view without end.
     */
    public static <T> View<T> generate(Supplier<? extends T> generator) {
        return new View<>(new GenerateCursor<>(generator, 0, true), new GenerateCursor<>(generator, 0, true));
    }

    public static <T> RandomView<T> random(Distribution<T> distribution, Random engine, long amount) {
        Preconditions.requireNonNegative(amount);
        return new RandomView<>(distribution, engine, amount, false);
    }

    public static <T> RandomView<T> random(Distribution<T> distribution, Random engine) {
        return new RandomView<>(distribution, engine, 0, true);
    }

    /**
     * {@code amount} integers uniformly drawn from {@code [min, max]} by a randomly seeded engine.
     */
    public static RandomView<Integer> random(int min, int max, long amount) {
        return random(Distribution.uniform(min, max), DEFAULT_ENGINE, amount);
    }

    public static RandomView<Double> random(double min, double max, long amount) {
        return random(Distribution.uniform(min, max), DEFAULT_ENGINE, amount);
    }

    /**
     * Skips the elements of {@code view} that are equal to any element of {@code excluded}. The excluded elements are
     * collected once, when the view is created.
     */
    public static <T> View<T> except(View<T> view, Iterable<?> excluded) {
        ImmutableSet<Object> set = Sets.immutable.withAll(excluded);
        Cursor<T> end = view.end();
        return new View<>(ExceptCursor.begin(view.begin(), end, set), ExceptCursor.end(end, set));
    }

    /**
     * The cartesian product of two or more views, as tuples holding one element of each view in the given order. The
     * last view varies fastest.
     *
     * @throws IllegalArgumentException if fewer than two views are given.
     */
    public static View<List<Object>> cartesian(View<?>... views) {
        Preconditions.checkArgument(
                views.length >= 2, "A cartesian product needs at least 2 sequences, got %d", views.length);
        List<Cursor<?>> begins = new ArrayList<>(views.length);
        List<Cursor<?>> ends = new ArrayList<>(views.length);
        for (View<?> view : views) {
            begins.add(view.begin());
            ends.add(view.end());
        }
        return new View<>(CartesianProductCursor.begin(begins, ends), CartesianProductCursor.end(begins, ends));
    }

    /**
     * The cartesian product of two views, combining every pair.
     */
    @SuppressWarnings("unchecked")
    public static <A, B, R> View<R> cartesian(
            View<A> first, View<B> second, BiFunction<? super A, ? super B, ? extends R> combiner) {
        return map(cartesian(first, second), tuple -> combiner.apply((A) tuple.get(0), (B) tuple.get(1)));
    }

    /**
     * Joins every element of {@code outer} with the elements of {@code inner} that have an equal key, see
     * {@link JoinWhereCursor}. {@code inner} must be sorted ascending by {@code innerKey}.
     */
    public static <A, B, K extends Comparable<? super K>, R> View<R> joinWhere(
            View<A> outer,
            View<B> inner,
            Function<? super A, ? extends K> outerKey,
            Function<? super B, ? extends K> innerKey,
            BiFunction<? super A, ? super B, ? extends R> combiner) {
        return Views.<A, B, K, R>joinWhere(outer, inner, outerKey, innerKey, combiner, ExecutionPolicy.SERIAL);
    }

    public static <A, B, K extends Comparable<? super K>, R> View<R> joinWhere(
            View<A> outer,
            View<B> inner,
            Function<? super A, ? extends K> outerKey,
            Function<? super B, ? extends K> innerKey,
            BiFunction<? super A, ? super B, ? extends R> combiner,
            ExecutionPolicy policy) {
        JoinSelectors<A, B, K, R> selectors = JoinSelectors.naturalOrder(outerKey, innerKey, combiner);
        return joinWhere(outer, inner, selectors, policy);
    }

    /**
     * Joins on keys ordered by {@code order}, which {@code inner} must be sorted by.
     */
    public static <A, B, K, R> View<R> joinWhere(
            View<A> outer,
            View<B> inner,
            Function<? super A, ? extends K> outerKey,
            Function<? super B, ? extends K> innerKey,
            Comparator<? super K> order,
            BiFunction<? super A, ? super B, ? extends R> combiner,
            ExecutionPolicy policy) {
        JoinSelectors<A, B, K, R> selectors = JoinSelectors.of(outerKey, innerKey, order, combiner);
        return joinWhere(outer, inner, selectors, policy);
    }

    public static <A, B, K, R> View<R> joinWhere(
            View<A> outer, View<B> inner, JoinSelectors<A, B, K, R> selectors, ExecutionPolicy policy) {
        Cursor<A> beginA = outer.begin();
        Cursor<A> endA = outer.end();
        Cursor<B> beginB = inner.begin();
        Cursor<B> endB = inner.end();
        return new View<>(
                JoinWhereCursor.begin(beginA, endA, beginB, endB, selectors, policy),
                JoinWhereCursor.end(beginA, endA, beginB, endB, selectors, policy));
    }
}
