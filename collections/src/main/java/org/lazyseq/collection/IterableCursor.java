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

import java.util.Iterator;

/**
 * {@link Tier#FORWARD} cursor over an {@link Iterable}. The element under the cursor is fetched ahead, so the cursor
 * knows it has reached the end as soon as the underlying iterator runs dry.
 * <p>
 * A copy opens a new iterator and skips to the same index, so copying is linear in the position and the iterable must
 * produce the same elements every time it is iterated.
 */
public final class IterableCursor<T> implements Cursor<T> {
    private final Iterable<T> source;
    private Iterator<T> iterator;
    private long index;
    private T current;
    private boolean exhausted;

    private IterableCursor(Iterable<T> source, boolean exhausted) {
        this.source = source;
        this.exhausted = exhausted;
        if (!exhausted) {
            iterator = source.iterator();
            fetch();
        }
    }

    public static <T> IterableCursor<T> begin(Iterable<T> source) {
        return new IterableCursor<>(source, false);
    }

    public static <T> IterableCursor<T> end(Iterable<T> source) {
        return new IterableCursor<>(source, true);
    }

    @Override
    public T get() {
        return current;
    }

    @Override
    public void increment() {
        index++;
        fetch();
    }

    private void fetch() {
        if (iterator.hasNext()) {
            current = iterator.next();
        } else {
            current = null;
            iterator = null;
            exhausted = true;
        }
    }

    @Override
    public boolean samePosition(Cursor<?> other) {
        if (!(other instanceof IterableCursor<?> that) || that.source != source) {
            return false;
        }
        return exhausted ? that.exhausted : !that.exhausted && that.index == index;
    }

    @Override
    public IterableCursor<T> copy() {
        if (exhausted) {
            return end(source);
        }
        IterableCursor<T> copy = begin(source);
        while (copy.index < index && !copy.exhausted) {
            copy.increment();
        }
        return copy;
    }

    @Override
    public Tier tier() {
        return Tier.FORWARD;
    }
}
