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
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;

/**
 * A traversable range made of a begin and an end {@link Cursor} over the same sequence. Nothing is computed until
 * the view is traversed, and every traversal starts from a fresh copy of the begin cursor.
 * <p>
 * A view references the sequences it was built from, it must not be used after they were structurally modified.
 *
 * @param <T> type of the elements in this view.
 */
public class View<T> implements Iterable<T> {
    private final Cursor<T> begin;
    private final Cursor<T> end;

    public View(Cursor<T> begin, Cursor<T> end) {
        this.begin = Objects.requireNonNull(begin);
        this.end = Objects.requireNonNull(end);
    }

    /**
     * @return a copy of the begin cursor, free to be moved by the caller.
     */
    public Cursor<T> begin() {
        return begin.copy();
    }

    public Cursor<T> end() {
        return end.copy();
    }

    public Tier tier() {
        return begin.tier();
    }

    public boolean isEmpty() {
        return begin.samePosition(end);
    }

    /**
     * Counts the elements of this view, which walks it unless the view is {@link Tier#RANDOM_ACCESS}. A
     * {@link Tier#FORWARD} view over an unbounded sequence is walked forever.
     *
     * @throws IllegalStateException if the view is an unbounded {@link Tier#RANDOM_ACCESS} one, such as an unbounded
     * generated or random view.
     */
    public long size() {
        return Cursors.distance(begin, end);
    }

    /**
     * Positional access for {@link Tier#RANDOM_ACCESS} views.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not within {@code [0, size())}.
     */
    public T get(long index) {
        Tier.check(begin, Tier.RANDOM_ACCESS, "get");
        Objects.checkIndex(index, size());
        return begin.get(index);
    }

    @Override
    public Iterator<T> iterator() {
        return new CursorIterator<>(begin.copy(), end);
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED);
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Walks the whole view, collecting its elements.
     */
    public MutableList<T> toList() {
        MutableList<T> list = Lists.mutable.empty();
        for (T element : this) {
            list.add(element);
        }
        return list;
    }

    private static final class CursorIterator<T> implements Iterator<T> {
        private final Cursor<T> cursor;
        private final Cursor<T> end;

        CursorIterator(Cursor<T> cursor, Cursor<T> end) {
            this.cursor = cursor;
            this.end = end;
        }

        @Override
        public boolean hasNext() {
            return cursor.notSamePosition(end);
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T element = cursor.get();
            cursor.increment();
            return element;
        }
    }
}
