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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.lazyseq.collection.Cursor;
import org.lazyseq.collection.Cursors;
import org.lazyseq.helpers.Exceptions;
import org.neo4j.logging.InternalLog;

/**
 * Finds the first element of a range of the outer sequence that has a match in the inner sequence, scanning
 * partitions of the range on the executor of an {@link ExecutionPolicy}. Every partition searches the inner sequence
 * from its start with cursors of its own. A found match is committed under a lock, keeping the one closest to the start
 * of the range, and partitions stop scanning once a match before them is committed.
 */
final class ParallelJoinScan<A, B, K> {
    private final JoinSelectors<A, B, K, ?> selectors;
    private final Cursor<B> beginB;
    private final Cursor<B> endB;
    private final ExecutionPolicy policy;
    private final InternalLog log;

    ParallelJoinScan(JoinSelectors<A, B, K, ?> selectors, Cursor<B> beginB, Cursor<B> endB, ExecutionPolicy policy) {
        this.selectors = selectors;
        this.beginB = beginB;
        this.endB = endB;
        this.policy = policy;
        this.log = policy.log(ParallelJoinScan.class);
    }

    /**
     * @param from first outer element to look at, not moved by this call.
     * @param endA end of the outer sequence.
     * @return the first matching outer position with its inner match, or {@code null} if nothing in the range matches.
     */
    Match<A, B> findFirst(Cursor<A> from, Cursor<A> endA) {
        long remaining = Cursors.distance(from, endA);
        int partitions = (int) Math.min(policy.parallelism(), remaining / policy.minPartitionSize());
        if (partitions <= 1) {
            return scan(from.copy(), remaining, 0, null);
        }

        long partitionSize = (remaining + partitions - 1) / partitions;
        Committed<A, B> committed = new Committed<>();
        List<Future<Match<A, B>>> futures = new ArrayList<>(partitions);
        Cursor<A> start = from.copy();
        for (long offset = 0; offset < remaining; offset += partitionSize) {
            long length = Math.min(partitionSize, remaining - offset);
            Cursor<A> partitionStart = start.copy();
            long partitionOffset = offset;
            futures.add(policy.executor().submit(() -> scan(partitionStart, length, partitionOffset, committed)));
            Cursors.advance(start, length);
        }
        awaitAll(futures);

        Match<A, B> match = committed.match();
        if (log.isDebugEnabled()) {
            log.debug(
                    "Scanned %d outer elements in %d partitions, first match at offset %s",
                    remaining, futures.size(), match == null ? "none" : match.offset());
        }
        return match;
    }

    private Match<A, B> scan(Cursor<A> a, long length, long offset, Committed<A, B> committed) {
        for (long i = 0; i < length; i++) {
            if (committed != null && committed.settledBefore(offset + i)) {
                return null;
            }
            K key = selectors.keyOf(a.get());
            Cursor<B> found = Cursors.lowerBound(beginB, endB, b -> selectors.before(b, key));
            if (found.notSamePosition(endB) && selectors.matches(key, found.get())) {
                Match<A, B> match = new Match<>(offset + i, a.copy(), found);
                if (committed != null) {
                    committed.offer(match);
                }
                return match;
            }
            a.increment();
        }
        return null;
    }

    private static <T> void awaitAll(List<Future<T>> futures) {
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                cancelFrom(futures, i + 1);
                throw Exceptions.unwrapExecutionFailure(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelFrom(futures, i);
                throw new RuntimeException("Interrupted while scanning for join matches", e);
            }
        }
    }

    private static <T> void cancelFrom(List<Future<T>> futures, int index) {
        for (int i = index; i < futures.size(); i++) {
            futures.get(i).cancel(true);
        }
    }

    record Match<A, B>(long offset, Cursor<A> a, Cursor<B> b) {}

    private static final class Committed<A, B> {
        private Match<A, B> match;

        synchronized void offer(Match<A, B> candidate) {
            if (match == null || candidate.offset() < match.offset()) {
                match = candidate;
            }
        }

        synchronized boolean settledBefore(long offset) {
            return match != null && match.offset() < offset;
        }

        synchronized Match<A, B> match() {
            return match;
        }
    }
}
