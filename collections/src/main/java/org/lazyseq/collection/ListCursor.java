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

import java.util.List;
import java.util.RandomAccess;
import org.lazyseq.util.Preconditions;

/**
 * Index based cursor over a {@link List}. {@link Tier#RANDOM_ACCESS} for {@link RandomAccess} lists, otherwise
 * {@link Tier#BIDIRECTIONAL} since positional access would not be constant time.
 */
public final class ListCursor<T> implements Cursor<T> {
    private final List<T> list;
    private final Tier tier;
    private int index;

    public ListCursor(List<T> list, int index) {
        this(list, index, list instanceof RandomAccess ? Tier.RANDOM_ACCESS : Tier.BIDIRECTIONAL);
    }

    private ListCursor(List<T> list, int index, Tier tier) {
        this.list = list;
        this.index = index;
        this.tier = tier;
    }

    public static <T> ListCursor<T> begin(List<T> list) {
        return new ListCursor<>(list, 0);
    }

    public static <T> ListCursor<T> end(List<T> list) {
        return new ListCursor<>(list, list.size());
    }

    public int index() {
        return index;
    }

    @Override
    public T get() {
        return list.get(index);
    }

    @Override
    public void increment() {
        index++;
    }

    @Override
    public void decrement() {
        index--;
    }

    @Override
    public void advance(long offset) {
        Tier.check(this, Tier.RANDOM_ACCESS, "advance");
        index = Math.toIntExact(index + offset);
    }

    @Override
    public long distanceTo(Cursor<?> other) {
        Tier.check(this, Tier.RANDOM_ACCESS, "distanceTo");
        Cursors.requireSameKind(this, other, ListCursor.class);
        ListCursor<?> that = (ListCursor<?>) other;
        Preconditions.checkArgument(that.list == list, "Cannot relate positions in two different lists");
        return that.index - index;
    }

    @Override
    public boolean samePosition(Cursor<?> other) {
        return other instanceof ListCursor<?> that && that.list == list && that.index == index;
    }

    @Override
    public ListCursor<T> copy() {
        return new ListCursor<>(list, index, tier);
    }

    @Override
    public Tier tier() {
        return tier;
    }

    @Override
    public String toString() {
        return "ListCursor[" + index + "/" + list.size() + "]";
    }
}
