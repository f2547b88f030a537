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

import java.util.function.Function;
import org.lazyseq.collection.Cursor;
import org.lazyseq.collection.Cursors;
import org.lazyseq.collection.Tier;

/**
 * Applies a function to every element of the wrapped cursor as it is dereferenced. All motion is delegated, so the
 * tier is the one of the wrapped cursor.
 */
public final class MapCursor<S, T> implements Cursor<T> {
    private final Cursor<S> source;
    private final Function<? super S, ? extends T> function;

    public MapCursor(Cursor<S> source, Function<? super S, ? extends T> function) {
        this.source = source;
        this.function = function;
    }

    @Override
    public T get() {
        return function.apply(source.get());
    }

    @Override
    public void increment() {
        source.increment();
    }

    @Override
    public void decrement() {
        source.decrement();
    }

    @Override
    public void advance(long offset) {
        source.advance(offset);
    }

    @Override
    public long distanceTo(Cursor<?> other) {
        Cursors.requireSameKind(this, other, MapCursor.class);
        return source.distanceTo(((MapCursor<?, ?>) other).source);
    }

    @Override
    public boolean samePosition(Cursor<?> other) {
        return other instanceof MapCursor<?, ?> that && source.samePosition(that.source);
    }

    @Override
    public MapCursor<S, T> copy() {
        return new MapCursor<>(source.copy(), function);
    }

    @Override
    public Tier tier() {
        return source.tier();
    }
}
