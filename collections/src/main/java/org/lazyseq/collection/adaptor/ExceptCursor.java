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

import org.eclipse.collections.api.set.SetIterable;
import org.lazyseq.collection.Cursor;
import org.lazyseq.collection.Tier;

/**
 * Skips every element of the wrapped cursor that is contained in a set of excluded elements. The set is shared by all
 * copies and is not owned by the cursor. Always {@link Tier#FORWARD}: finding the previous kept element would mean
 * scanning backwards past an unknown number of excluded ones.
 */
public final class ExceptCursor<T> implements Cursor<T> {
    private final Cursor<T> source;
    private final Cursor<T> end;
    private final SetIterable<?> excluded;

    private ExceptCursor(Cursor<T> source, Cursor<T> end, SetIterable<?> excluded) {
        this.source = source;
        this.end = end;
        this.excluded = excluded;
    }

    /**
     * @param source first position of the filtered sequence, moved to the first element that is not excluded.
     * @param end end of the filtered sequence.
     * @param excluded elements to skip.
     */
    public static <T> ExceptCursor<T> begin(Cursor<T> source, Cursor<T> end, SetIterable<?> excluded) {
        ExceptCursor<T> cursor = new ExceptCursor<>(source, end, excluded);
        cursor.skipExcluded();
        return cursor;
    }

    public static <T> ExceptCursor<T> end(Cursor<T> end, SetIterable<?> excluded) {
        return new ExceptCursor<>(end.copy(), end, excluded);
    }

    private void skipExcluded() {
        while (source.notSamePosition(end) && excluded.contains(source.get())) {
            source.increment();
        }
    }

    @Override
    public T get() {
        return source.get();
    }

    @Override
    public void increment() {
        source.increment();
        skipExcluded();
    }

    @Override
    public boolean samePosition(Cursor<?> other) {
        return other instanceof ExceptCursor<?> that && source.samePosition(that.source);
    }

    @Override
    public ExceptCursor<T> copy() {
        return new ExceptCursor<>(source.copy(), end, excluded);
    }

    @Override
    public Tier tier() {
        return Tier.FORWARD;
    }
}
