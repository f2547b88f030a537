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
package org.lazyseq.collection.adaptor;

import org.apache.commons.lang3.tuple.Pair;
import org.lazyseq.collection.Cursor;
import org.lazyseq.collection.Cursors;
import org.lazyseq.collection.Tier;

/**
 * Pairs every element of the wrapped cursor with a running index. The index moves together with the wrapped cursor in
 * both directions.
 * <p>
 * A cursor created by {@link #end(Cursor, Cursor, int)} does not know its index up front. It is measured from the
 * begin of the sequence the first time it is needed, so building the end of an enumerated view never walks it.
 */
public final class EnumerateCursor<T> implements Cursor<Pair<Integer, T>> {
    private final Cursor<T> source;
    private int index;
    // begin of the sequence while the index is not yet measured, null afterwards
    private Cursor<T> origin;
    private final int start;

    public EnumerateCursor(Cursor<T> source, int index) {
        this(source, index, null, index);
    }

    private EnumerateCursor(Cursor<T> source, int index, Cursor<T> origin, int start) {
        this.source = source;
        this.index = index;
        this.origin = origin;
        this.start = start;
    }

    /**
     * @param begin first position of the enumerated sequence, the one numbered {@code start}.
     * @param end end of the enumerated sequence.
     * @param start index of the first position.
     * @return a cursor at {@code end} whose index is measured from {@code begin} on first use.
     */
    public static <T> EnumerateCursor<T> end(Cursor<T> begin, Cursor<T> end, int start) {
        return new EnumerateCursor<>(end, start, begin, start);
    }

    public int index() {
        if (origin != null) {
            index = Math.toIntExact(start + Cursors.distance(origin, source));
            origin = null;
        }
        return index;
    }

    @Override
    public Pair<Integer, T> get() {
        return Pair.of(index(), source.get());
    }

    @Override
    public void increment() {
        index = index() + 1;
        source.increment();
    }

    @Override
    public void decrement() {
        index = index() - 1;
        source.decrement();
    }

    @Override
    public void advance(long offset) {
        index = Math.toIntExact(index() + offset);
        source.advance(offset);
    }

    @Override
    public long distanceTo(Cursor<?> other) {
        Cursors.requireSameKind(this, other, EnumerateCursor.class);
        return source.distanceTo(((EnumerateCursor<?>) other).source);
    }

    @Override
    public boolean samePosition(Cursor<?> other) {
        return other instanceof EnumerateCursor<?> that && source.samePosition(that.source);
    }

    @Override
    public EnumerateCursor<T> copy() {
        return new EnumerateCursor<>(source.copy(), index, origin, start);
    }

    @Override
    public Tier tier() {
        return source.tier();
    }
}
