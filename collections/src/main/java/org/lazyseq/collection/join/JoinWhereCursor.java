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
package org.lazyseq.collection.join;

import org.lazyseq.collection.Cursor;
import org.lazyseq.collection.Cursors;
import org.lazyseq.collection.Tier;

/**
 * Equi-join of an outer sequence A with an inner sequence B that is sorted ascending by its key. For every element of
 * A, in order, the elements of B with an equal key are found by binary search and combined with it.
 * <p>
 * The search for the next match resumes right after the previously matched element of B, still using the key of the
 * current element of A, so all elements of B sharing that key are produced before A moves on. When the search comes up
 * empty A moves to its next element and the search restarts from the beginning of B. Reaching the end of A is the only
 * way the cursor ends, and only the position in A takes part in equality.
 * <p>
 * The order of B is never verified; an unsorted B gives incomplete results. Always {@link Tier#FORWARD}.
 */
public final class JoinWhereCursor<A, B, K, R> implements Cursor<R> {
    private Cursor<A> iterA;
    private final Cursor<A> endA;
    private Cursor<B> iterB;
    private final Cursor<B> beginB;
    private final Cursor<B> endB;
    // only valid while iterA is not at endA
    private Cursor<B> iterBFound;
    private final JoinSelectors<A, B, K, R> selectors;
    private final ParallelJoinScan<A, B, K> parallelScan;

    private JoinWhereCursor(
            Cursor<A> iterA,
            Cursor<A> endA,
            Cursor<B> iterB,
            Cursor<B> beginB,
            Cursor<B> endB,
            Cursor<B> iterBFound,
            JoinSelectors<A, B, K, R> selectors,
            ParallelJoinScan<A, B, K> parallelScan) {
        this.iterA = iterA;
        this.endA = endA;
        this.iterB = iterB;
        this.beginB = beginB;
        this.endB = endB;
        this.iterBFound = iterBFound;
        this.selectors = selectors;
        this.parallelScan = parallelScan;
    }

    /**
     * @return a cursor at the first match, or at the end if A or B is empty or nothing matches.
     */
    public static <A, B, K, R> JoinWhereCursor<A, B, K, R> begin(
            Cursor<A> beginA,
            Cursor<A> endA,
            Cursor<B> beginB,
            Cursor<B> endB,
            JoinSelectors<A, B, K, R> selectors,
            ExecutionPolicy policy) {
        JoinWhereCursor<A, B, K, R> cursor = create(beginA, endA, beginB, endB, selectors, policy);
        if (beginB.samePosition(endB)) {
            cursor.iterA = endA.copy();
        } else {
            cursor.findNext();
        }
        return cursor;
    }

    public static <A, B, K, R> JoinWhereCursor<A, B, K, R> end(
            Cursor<A> beginA,
            Cursor<A> endA,
            Cursor<B> beginB,
            Cursor<B> endB,
            JoinSelectors<A, B, K, R> selectors,
            ExecutionPolicy policy) {
        JoinWhereCursor<A, B, K, R> cursor = create(beginA, endA, beginB, endB, selectors, policy);
        cursor.iterA = endA.copy();
        return cursor;
    }

    private static <A, B, K, R> JoinWhereCursor<A, B, K, R> create(
            Cursor<A> beginA,
            Cursor<A> endA,
            Cursor<B> beginB,
            Cursor<B> endB,
            JoinSelectors<A, B, K, R> selectors,
            ExecutionPolicy policy) {
        // splitting needs constant time distance and jumps over A
        ParallelJoinScan<A, B, K> parallelScan = policy.isParallel() && beginA.tier() == Tier.RANDOM_ACCESS
                ? new ParallelJoinScan<>(selectors, beginB.copy(), endB.copy(), policy)
                : null;
        return new JoinWhereCursor<>(
                beginA.copy(),
                endA.copy(),
                beginB.copy(),
                beginB.copy(),
                endB.copy(),
                null,
                selectors,
                parallelScan);
    }

    private void findNext() {
        if (parallelScan != null) {
            findNextInParallel();
            return;
        }
        while (iterA.notSamePosition(endA)) {
            if (matchCurrent()) {
                return;
            }
            nextA();
        }
    }

    private void findNextInParallel() {
        if (iterA.samePosition(endA) || matchCurrent()) {
            return;
        }
        nextA();
        if (iterA.samePosition(endA)) {
            return;
        }
        ParallelJoinScan.Match<A, B> match = parallelScan.findFirst(iterA, endA);
        if (match == null) {
            iterA = endA.copy();
            iterBFound = null;
            return;
        }
        iterA = match.a();
        found(match.b());
    }

    /**
     * Searches the rest of B for the key of the current element of A.
     */
    private boolean matchCurrent() {
        K key = selectors.keyOf(iterA.get());
        iterB = Cursors.lowerBound(iterB, endB, b -> selectors.before(b, key));
        if (iterB.notSamePosition(endB) && selectors.matches(key, iterB.get())) {
            found(iterB);
            return true;
        }
        return false;
    }

    private void found(Cursor<B> match) {
        iterBFound = match.copy();
        iterB = match.copy();
        iterB.increment();
    }

    private void nextA() {
        iterA.increment();
        iterB = beginB.copy();
    }

    @Override
    public R get() {
        return selectors.combine(iterA.get(), iterBFound.get());
    }

    @Override
    public void increment() {
        findNext();
    }

    @Override
    public boolean samePosition(Cursor<?> other) {
        return other instanceof JoinWhereCursor<?, ?, ?, ?> that && iterA.samePosition(that.iterA);
    }

    @Override
    public JoinWhereCursor<A, B, K, R> copy() {
        return new JoinWhereCursor<>(
                iterA.copy(),
                endA,
                iterB.copy(),
                beginB,
                endB,
                iterBFound == null ? null : iterBFound.copy(),
                selectors,
                parallelScan);
    }

    @Override
    public Tier tier() {
        return Tier.FORWARD;
    }
}
