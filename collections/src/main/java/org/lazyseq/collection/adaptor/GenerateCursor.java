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

import java.util.function.Supplier;
import org.lazyseq.collection.Cursor;
import org.lazyseq.collection.Cursors;
import org.lazyseq.collection.Tier;
import org.lazyseq.util.Preconditions;

/**
 * Counts positions over values produced by a {@link Supplier}. The supplier is called the first time a position is
 * dereferenced and the value is kept until the cursor moves, so dereferencing is stable. Copies share the supplier but
 * not the kept value.
 * <p>
 * An unbounded cursor never compares equal to any other cursor, so a view made of unbounded cursors never ends.
 */
public final class GenerateCursor<T> implements Cursor<T> {
    private final Supplier<? extends T> generator;
    private final boolean unbounded;
    private long position;
    private T value;
    private boolean generated;

    public GenerateCursor(Supplier<? extends T> generator, long position, boolean unbounded) {
        this.generator = generator;
        this.position = position;
        this.unbounded = unbounded;
    }

    public long position() {
        return position;
    }

    @Override
    public T get() {
        if (!generated) {
            value = generator.get();
            generated = true;
        }
        return value;
    }

    @Override
    public void increment() {
        moveTo(position + 1);
    }

    @Override
    public void decrement() {
        moveTo(position - 1);
    }

    @Override
    public void advance(long offset) {
        if (offset != 0) {
            moveTo(position + offset);
        }
    }

    private void moveTo(long newPosition) {
        position = newPosition;
        value = null;
        generated = false;
    }

    @Override
    public long distanceTo(Cursor<?> other) {
        Cursors.requireSameKind(this, other, GenerateCursor.class);
        GenerateCursor<?> that = (GenerateCursor<?>) other;
        Preconditions.checkState(!unbounded && !that.unbounded, "Unbounded sequences have no distance");
        return that.position - position;
    }

    @Override
    public boolean samePosition(Cursor<?> other) {
        return !unbounded
                && other instanceof GenerateCursor<?> that
                && that.generator == generator
                && that.position == position;
    }

    @Override
    public GenerateCursor<T> copy() {
        return new GenerateCursor<>(generator, position, unbounded);
    }

    @Override
    public Tier tier() {
        return Tier.RANDOM_ACCESS;
    }
}
