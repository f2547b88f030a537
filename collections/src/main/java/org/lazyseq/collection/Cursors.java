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

import static java.lang.String.format;

import java.util.function.Predicate;

/**
 * Navigation helpers that pick constant time arithmetic for {@link Tier#RANDOM_ACCESS} cursors and fall back to
 * stepping for weaker ones.
 */
public final class Cursors {
    private Cursors() {
        throw new AssertionError("no instance");
    }

    /**
     * @return the number of increments needed to move {@code first} onto {@code last}. {@code last} must be reachable
     * from {@code first}.
     */
    public static long distance(Cursor<?> first, Cursor<?> last) {
        if (first.tier() == Tier.RANDOM_ACCESS) {
            return first.distanceTo(last);
        }
        Cursor<?> walker = first.copy();
        long distance = 0;
        while (walker.notSamePosition(last)) {
            walker.increment();
            distance++;
        }
        return distance;
    }

    /**
     * Moves {@code cursor} by {@code offset} positions. Negative offsets need a {@link Tier#BIDIRECTIONAL} cursor.
     */
    public static void advance(Cursor<?> cursor, long offset) {
        if (cursor.tier() == Tier.RANDOM_ACCESS) {
            cursor.advance(offset);
            return;
        }
        for (long i = 0; i < offset; i++) {
            cursor.increment();
        }
        for (long i = 0; i > offset; i--) {
            cursor.decrement();
        }
    }

    /**
     * Binary search for the first position in {@code [first, last)} whose element is not {@code before} the searched
     * value. The range must be partitioned by {@code before}: every element for which it holds comes first.
     *
     * @param first start of the range, not moved by this call.
     * @param last end of the range.
     * @param before holds for elements that order before the searched value.
     * @return a new cursor at the found position, or at {@code last} if every element is before the searched value.
     */
    public static <T> Cursor<T> lowerBound(Cursor<T> first, Cursor<?> last, Predicate<? super T> before) {
        Cursor<T> low = first.copy();
        long count = distance(low, last);
        while (count > 0) {
            long step = count / 2;
            Cursor<T> probe = low.copy();
            advance(probe, step);
            if (before.test(probe.get())) {
                probe.increment();
                low = probe;
                count -= step + 1;
            } else {
                count = step;
            }
        }
        return low;
    }

    /**
     * Guards operations that relate two positions, such as {@link Cursor#distanceTo(Cursor)}.
     *
     * @throws IllegalArgumentException if {@code other} is not an instance of {@code type}.
     */
    public static void requireSameKind(Cursor<?> self, Cursor<?> other, Class<?> type) {
        if (!type.isInstance(other)) {
            throw new IllegalArgumentException(format(
                    "Cannot relate the position of %s to %s",
                    self.getClass().getSimpleName(), other == null ? "null" : other.getClass().getSimpleName()));
        }
    }
}
