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
package org.lazyseq.collection.join;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The functions a join is made of: a key selector for each side, the order of the keys and the combiner producing a
 * result from a matching pair. Under a parallel {@link ExecutionPolicy} all of them are called from several threads.
 *
 * @param <A> element type of the outer sequence.
 * @param <B> element type of the sorted inner sequence.
 * @param <K> key type both sides are compared on.
 * @param <R> result type.
 */
public final class JoinSelectors<A, B, K, R> {
    private final Function<? super A, ? extends K> keyA;
    private final Function<? super B, ? extends K> keyB;
    private final Comparator<? super K> order;
    private final BiFunction<? super A, ? super B, ? extends R> combiner;

    private JoinSelectors(
            Function<? super A, ? extends K> keyA,
            Function<? super B, ? extends K> keyB,
            Comparator<? super K> order,
            BiFunction<? super A, ? super B, ? extends R> combiner) {
        this.keyA = Objects.requireNonNull(keyA);
        this.keyB = Objects.requireNonNull(keyB);
        this.order = Objects.requireNonNull(order);
        this.combiner = Objects.requireNonNull(combiner);
    }

    public static <A, B, K, R> JoinSelectors<A, B, K, R> of(
            Function<? super A, ? extends K> keyA,
            Function<? super B, ? extends K> keyB,
            Comparator<? super K> order,
            BiFunction<? super A, ? super B, ? extends R> combiner) {
        return new JoinSelectors<>(keyA, keyB, order, combiner);
    }

    public static <A, B, K extends Comparable<? super K>, R> JoinSelectors<A, B, K, R> naturalOrder(
            Function<? super A, ? extends K> keyA,
            Function<? super B, ? extends K> keyB,
            BiFunction<? super A, ? super B, ? extends R> combiner) {
        return new JoinSelectors<>(keyA, keyB, Comparator.<K>naturalOrder(), combiner);
    }

    K keyOf(A a) {
        return keyA.apply(a);
    }

    /**
     * @return {@code true} if the key of {@code b} orders strictly before {@code key}.
     */
    boolean before(B b, K key) {
        return order.compare(keyB.apply(b), key) < 0;
    }

    /**
     * Only meaningful for an element found by a lower bound search for {@code key}, whose key is never smaller.
     */
    boolean matches(K key, B b) {
        return order.compare(key, keyB.apply(b)) >= 0;
    }

    R combine(A a, B b) {
        return combiner.apply(a, b);
    }
}
