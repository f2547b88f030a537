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
package org.lazyseq.collection.product;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.lazyseq.collection.Cursor;
import org.lazyseq.collection.Cursors;
import org.lazyseq.collection.Tier;
import org.lazyseq.util.Preconditions;

/**
 * Walks the cartesian product of N sequences in lexicographic order, like an odometer: dimension {@code N - 1} moves
 * fastest and dimension {@code 0} slowest. Every position is the tuple of the elements under the dimension cursors.
 * <p>
 * Each dimension keeps its own {@code begin}, {@code current} and {@code end} cursor. A dimension other than the first
 * only sits on its end while a carry is being propagated. The product is exhausted when the first dimension is at its
 * end and all others are back at their begin, which is the state of the end cursor of the product. An empty dimension
 * anywhere puts the begin cursor in that same state.
 * <p>
 * The tier is the weakest tier among the dimensions.
 */
public final class CartesianProductCursor implements Cursor<List<Object>> {
    private final Cursor<?>[] begin;
    private final Cursor<?>[] current;
    private final Cursor<?>[] end;
    private final Tier tier;

    private CartesianProductCursor(Cursor<?>[] begin, Cursor<?>[] current, Cursor<?>[] end, Tier tier) {
        this.begin = begin;
        this.current = current;
        this.end = end;
        this.tier = tier;
    }

    /**
     * @param begins first position of every dimension, in order from slowest to fastest.
     * @param ends end of every dimension, in the same order.
     * @return a cursor at the first tuple of the product, or at its end if any dimension is empty.
     * @throws IllegalArgumentException if there are fewer than two dimensions.
     */
    public static CartesianProductCursor begin(List<? extends Cursor<?>> begins, List<? extends Cursor<?>> ends) {
        CartesianProductCursor cursor = create(begins, ends);
        if (cursor.anyDimensionEmpty()) {
            cursor.moveToEnd();
        }
        return cursor;
    }

    public static CartesianProductCursor end(List<? extends Cursor<?>> begins, List<? extends Cursor<?>> ends) {
        CartesianProductCursor cursor = create(begins, ends);
        cursor.moveToEnd();
        return cursor;
    }

    private static CartesianProductCursor create(List<? extends Cursor<?>> begins, List<? extends Cursor<?>> ends) {
        Preconditions.checkArgument(
                begins.size() >= 2, "A cartesian product needs at least 2 sequences, got %d", begins.size());
        Preconditions.checkArgument(
                begins.size() == ends.size(),
                "Got %d begin cursors but %d end cursors",
                begins.size(),
                ends.size());
        int dimensions = begins.size();
        Cursor<?>[] begin = new Cursor<?>[dimensions];
        Cursor<?>[] current = new Cursor<?>[dimensions];
        Cursor<?>[] end = new Cursor<?>[dimensions];
        for (int i = 0; i < dimensions; i++) {
            begin[i] = begins.get(i).copy();
            current[i] = begins.get(i).copy();
            end[i] = ends.get(i).copy();
        }
        return new CartesianProductCursor(begin, current, end, Tier.weakestOf(begin));
    }

    public int dimensions() {
        return current.length;
    }

    private boolean anyDimensionEmpty() {
        for (int i = 0; i < begin.length; i++) {
            if (begin[i].samePosition(end[i])) {
                return true;
            }
        }
        return false;
    }

    private void moveToEnd() {
        current[0] = end[0].copy();
        for (int i = 1; i < current.length; i++) {
            current[i] = begin[i].copy();
        }
    }

    private boolean atEnd() {
        return current[0].samePosition(end[0]);
    }

    @Override
    public List<Object> get() {
        Object[] tuple = new Object[current.length];
        for (int i = 0; i < current.length; i++) {
            tuple[i] = current[i].get();
        }
        return Collections.unmodifiableList(Arrays.asList(tuple));
    }

    @Override
    public void increment() {
        for (int i = current.length - 1; i > 0; i--) {
            current[i].increment();
            if (current[i].notSamePosition(end[i])) {
                return;
            }
            current[i] = begin[i].copy();
        }
        // carried all the way, reaching the end of the first dimension means the product is exhausted
        current[0].increment();
    }

    @Override
    public void decrement() {
        Tier.check(this, Tier.BIDIRECTIONAL, "decrement");
        if (atEnd()) {
            // the end state holds sentinels, not the last tuple, so step every dimension back from its end
            for (int i = 0; i < current.length; i++) {
                current[i] = lastOf(i);
            }
            return;
        }
        for (int i = current.length - 1; i > 0; i--) {
            if (current[i].notSamePosition(begin[i])) {
                current[i].decrement();
                return;
            }
            current[i] = lastOf(i);
        }
        current[0].decrement();
    }

    private Cursor<?> lastOf(int dimension) {
        Cursor<?> last = end[dimension].copy();
        last.decrement();
        return last;
    }

    /**
     * Treats the dimensions as the digits of a mixed radix number, the radix of each being the size of its sequence.
     * The offset is added to the fastest dimension, the floor remainder stays there and the floor quotient is carried
     * into the next slower dimension, and so on. The first dimension takes whatever is carried into it.
     *
     * @throws IndexOutOfBoundsException if the jump would leave the range from the first tuple to the end.
     */
    @Override
    public void advance(long offset) {
        Tier.check(this, Tier.RANDOM_ACCESS, "advance");
        if (offset == 0) {
            return;
        }
        Preconditions.requirePosition(Math.addExact(position(), offset), 0, size());
        long carry = offset;
        for (int i = current.length - 1; i > 0 && carry != 0; i--) {
            long radix = begin[i].distanceTo(end[i]);
            long digit = begin[i].distanceTo(current[i]);
            long moved = digit + carry;
            current[i].advance(Math.floorMod(moved, radix) - digit);
            carry = Math.floorDiv(moved, radix);
        }
        current[0].advance(carry);
        if (atEnd()) {
            moveToEnd();
        }
    }

    /**
     * @return the signed number of tuples between this cursor and {@code other}, i.e. the difference of their positions
     * read as mixed radix numbers. From the first tuple to the end this is the product of the sizes of all dimensions.
     */
    @Override
    public long distanceTo(Cursor<?> other) {
        Tier.check(this, Tier.RANDOM_ACCESS, "distanceTo");
        Cursors.requireSameKind(this, other, CartesianProductCursor.class);
        CartesianProductCursor that = (CartesianProductCursor) other;
        Preconditions.checkArgument(
                that.dimensions() == dimensions(),
                "Cannot relate products of %d and %d dimensions",
                dimensions(),
                that.dimensions());
        return that.position() - position();
    }

    private long position() {
        long position = 0;
        long stride = 1;
        for (int i = current.length - 1; i >= 0; i--) {
            position = Math.addExact(position, Math.multiplyExact(begin[i].distanceTo(current[i]), stride));
            stride = Math.multiplyExact(stride, begin[i].distanceTo(end[i]));
        }
        return position;
    }

    private long size() {
        long size = 1;
        for (int i = 0; i < begin.length; i++) {
            size = Math.multiplyExact(size, begin[i].distanceTo(end[i]));
        }
        return size;
    }

    @Override
    public boolean samePosition(Cursor<?> other) {
        if (!(other instanceof CartesianProductCursor that) || that.dimensions() != dimensions()) {
            return false;
        }
        for (int i = 0; i < current.length; i++) {
            if (current[i].notSamePosition(that.current[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public CartesianProductCursor copy() {
        Cursor<?>[] position = new Cursor<?>[current.length];
        for (int i = 0; i < current.length; i++) {
            position[i] = current[i].copy();
        }
        return new CartesianProductCursor(begin, position, end, tier);
    }

    @Override
    public Tier tier() {
        return tier;
    }
}
