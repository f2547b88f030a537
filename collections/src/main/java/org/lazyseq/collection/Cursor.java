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

/**
 * A position in a sequence. Implementations provide a handful of primitives, {@link #get()}, {@link #increment()},
 * {@link #samePosition(Cursor)}, {@link #copy()} and {@link #tier()}, plus {@link #decrement()} for
 * {@link Tier#BIDIRECTIONAL} cursors and {@link #advance(long)}/{@link #distanceTo(Cursor)} for
 * {@link Tier#RANDOM_ACCESS} ones. Everything else is derived from those.
 * <p>
 * A cursor never owns the sequence it moves over. Copies are independent positions over the same sequence.
 *
 * @param <T> type of the elements at the positions of this cursor.
 */
public interface Cursor<T> {
    /**
     * @return the element at the current position. Undefined when positioned at the end of the sequence.
     */
    T get();

    void increment();

    /**
     * @return {@code true} if {@code other} is positioned at the same element of the same sequence.
     */
    boolean samePosition(Cursor<?> other);

    /**
     * @return an independent cursor at the same position.
     */
    Cursor<T> copy();

    Tier tier();

    default void decrement() {
        Tier.check(this, Tier.BIDIRECTIONAL, "decrement");
        throw new UnsupportedOperationException(getClass().getSimpleName() + " declares " + tier()
                + " but does not implement decrement");
    }

    /**
     * Moves this cursor {@code offset} positions, backwards if negative.
     */
    default void advance(long offset) {
        Tier.check(this, Tier.RANDOM_ACCESS, "advance");
        throw new UnsupportedOperationException(getClass().getSimpleName() + " declares " + tier()
                + " but does not implement advance");
    }

    /**
     * @return the number of increments it takes to move this cursor to {@code other}, negative if {@code other}
     * comes before this cursor.
     */
    default long distanceTo(Cursor<?> other) {
        Tier.check(this, Tier.RANDOM_ACCESS, "distanceTo");
        throw new UnsupportedOperationException(getClass().getSimpleName() + " declares " + tier()
                + " but does not implement distanceTo");
    }

    default boolean notSamePosition(Cursor<?> other) {
        return !samePosition(other);
    }

    default boolean isBefore(Cursor<?> other) {
        return distanceTo(other) > 0;
    }

    default boolean isAfter(Cursor<?> other) {
        return distanceTo(other) < 0;
    }

    default boolean isAtOrBefore(Cursor<?> other) {
        return distanceTo(other) >= 0;
    }

    default boolean isAtOrAfter(Cursor<?> other) {
        return distanceTo(other) <= 0;
    }

    /**
     * Increments this cursor.
     *
     * @return a copy positioned where this cursor was before the increment.
     */
    default Cursor<T> postIncrement() {
        Cursor<T> previous = copy();
        increment();
        return previous;
    }

    default Cursor<T> postDecrement() {
        Cursor<T> previous = copy();
        decrement();
        return previous;
    }

    /**
     * @return a copy of this cursor, moved {@code offset} positions.
     */
    default Cursor<T> plus(long offset) {
        Cursor<T> moved = copy();
        moved.advance(offset);
        return moved;
    }

    default Cursor<T> minus(long offset) {
        return plus(-offset);
    }

    /**
     * @return the element {@code offset} positions away from this cursor, which itself does not move.
     */
    default T get(long offset) {
        return plus(offset).get();
    }
}
