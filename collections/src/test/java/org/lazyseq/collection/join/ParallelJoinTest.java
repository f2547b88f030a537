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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lazyseq.collection.View;
import org.lazyseq.collection.Views;
import org.lazyseq.util.FeatureToggles;
import org.neo4j.logging.InternalLog;
import org.neo4j.logging.InternalLogProvider;
import org.neo4j.logging.NullLogProvider;

class ParallelJoinTest {
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        FeatureToggles.clear(ExecutionPolicy.class, "forceSerial");
        FeatureToggles.clear(ExecutionPolicy.class, "parallelism");
        FeatureToggles.clear(ExecutionPolicy.class, "minPartitionSize");
    }

    @Test
    void shouldProduceSameResultsAsSerialJoin() {
        // given
        Random random = new Random(1234);
        List<Integer> outer = new ArrayList<>();
        for (int i = 0; i < 5_000; i++) {
            outer.add(random.nextInt(1_000));
        }
        List<Pair<Integer, String>> inner = new ArrayList<>();
        for (int key = 0; key < 1_000; key += 7) {
            inner.add(Pair.of(key, "first"));
            if (key % 3 == 0) {
                inner.add(Pair.of(key, "second"));
            }
        }
        ExecutionPolicy parallel = ExecutionPolicy.parallel(executor, 4, 8, NullLogProvider.getInstance());

        // when
        List<String> serialResult = join(Views.of(outer), Views.of(inner), ExecutionPolicy.SERIAL);
        List<String> parallelResult = join(Views.of(outer), Views.of(inner), parallel);

        // then
        assertThat(parallelResult).isNotEmpty().isEqualTo(serialResult);
    }

    @Test
    void shouldFindSparseMatches() {
        List<Integer> outer = IntStream.range(0, 2_000).boxed().toList();
        List<Pair<Integer, String>> inner = List.of(Pair.of(3, "a"), Pair.of(1_500, "b"), Pair.of(1_999, "c"));
        ExecutionPolicy parallel = ExecutionPolicy.parallel(executor, 4, 16, NullLogProvider.getInstance());

        assertThat(join(Views.of(outer), Views.of(inner), parallel)).containsExactly("3a", "1500b", "1999c");
    }

    @Test
    void shouldMatchFirstOuterElementBeforeSplitting() {
        List<Integer> outer = IntStream.range(0, 100).boxed().toList();
        List<Pair<Integer, String>> inner = List.of(Pair.of(0, "a"), Pair.of(0, "b"));
        ExecutionPolicy parallel = ExecutionPolicy.parallel(executor, 4, 4, NullLogProvider.getInstance());

        assertThat(join(Views.of(outer), Views.of(inner), parallel)).containsExactly("0a", "0b");
    }

    @Test
    void shouldScanOnCallingThreadWhenRangeIsTooSmallToSplit() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        View<Integer> outer = Views.of(IntStream.range(0, 50).boxed().toList());
        ExecutionPolicy parallel = ExecutionPolicy.parallel(executor, 4, 1_000, NullLogProvider.getInstance());

        View<Integer> joined = Views.joinWhere(
                outer,
                Views.of(10, 20, 49),
                a -> {
                    threads.add(Thread.currentThread().getName());
                    return a;
                },
                b -> b,
                (a, b) -> a,
                parallel);

        assertThat(joined.toList()).containsExactly(10, 20, 49);
        assertThat(threads).containsExactly(Thread.currentThread().getName());
    }

    @Test
    void shouldScanForwardOnlyOuterSequenceOnCallingThread() {
        // given
        Set<String> threads = ConcurrentHashMap.newKeySet();
        View<Integer> outer = Views.of((Iterable<Integer>) IntStream.range(0, 500).boxed().toList());
        View<Integer> inner = Views.of(3, 250, 499);
        ExecutionPolicy parallel = ExecutionPolicy.parallel(executor, 4, 8, NullLogProvider.getInstance());

        // when
        View<Integer> joined = Views.joinWhere(
                outer,
                inner,
                a -> {
                    threads.add(Thread.currentThread().getName());
                    return a;
                },
                b -> b,
                (a, b) -> a,
                parallel);

        // then
        assertThat(joined.toList()).containsExactly(3, 250, 499);
        assertThat(threads).containsExactly(Thread.currentThread().getName());
    }

    @Test
    void sharedPoolShouldUseNamedDaemonThreads() {
        // given
        FeatureToggles.set(ExecutionPolicy.class, "parallelism", 2);
        FeatureToggles.set(ExecutionPolicy.class, "minPartitionSize", 4);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        View<Integer> outer = Views.of(IntStream.range(0, 200).boxed().toList());

        // when
        View<Integer> joined = Views.joinWhere(
                outer,
                Views.of(199),
                a -> {
                    threads.add(Thread.currentThread().getName());
                    return a;
                },
                b -> b,
                (a, b) -> a,
                ExecutionPolicy.parallel());

        // then
        assertThat(joined.toList()).containsExactly(199);
        assertThat(threads).anyMatch(name -> name.startsWith(ExecutionPolicy.THREAD_NAME_PREFIX));
    }

    @Test
    void shouldLogScansAtDebugLevel() {
        // given
        InternalLogProvider logProvider = mock(InternalLogProvider.class);
        InternalLog log = mock(InternalLog.class);
        when(logProvider.getLog(any(Class.class))).thenReturn(log);
        when(log.isDebugEnabled()).thenReturn(true);
        List<Integer> outer = IntStream.range(0, 100).boxed().toList();

        // when
        List<String> result = join(
                Views.of(outer),
                Views.of(List.of(Pair.of(90, "x"))),
                ExecutionPolicy.parallel(executor, 4, 8, logProvider));

        // then
        assertThat(result).containsExactly("90x");
        verify(log, atLeastOnce())
                .debug(eq("Scanned %d outer elements in %d partitions, first match at offset %s"), any(), any(), any());
    }

    @Test
    void shouldPropagateSelectorFailures() {
        View<Integer> outer = Views.of(IntStream.range(0, 1_000).boxed().toList());
        ExecutionPolicy parallel = ExecutionPolicy.parallel(executor, 4, 8, NullLogProvider.getInstance());

        assertThatThrownBy(() -> Views.joinWhere(
                                outer,
                                Views.of(999),
                                a -> {
                                    if (a == 600) {
                                        throw new IllegalStateException("broken key " + a);
                                    }
                                    return a;
                                },
                                b -> b,
                                (a, b) -> a,
                                parallel)
                        .toList())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("broken key 600");
    }

    @Test
    void shouldValidatePolicy() {
        InternalLogProvider logProvider = NullLogProvider.getInstance();

        assertThatThrownBy(() -> ExecutionPolicy.parallel(null, 4, 8, logProvider))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExecutionPolicy.parallel(executor, 0, 8, logProvider))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExecutionPolicy.parallel(executor, 4, 0, logProvider))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ExecutionPolicy.SERIAL.isParallel()).isFalse();
        assertThat(ExecutionPolicy.parallel(executor, 4, 8, logProvider).isParallel())
                .isTrue();
    }

    @Test
    void forceSerialToggleShouldDisableParallelism() {
        FeatureToggles.set(ExecutionPolicy.class, "forceSerial", true);

        assertThat(ExecutionPolicy.parallel(executor, 4, 8, NullLogProvider.getInstance()))
                .isSameAs(ExecutionPolicy.SERIAL);
        assertThat(ExecutionPolicy.parallel()).isSameAs(ExecutionPolicy.SERIAL);

        FeatureToggles.clear(ExecutionPolicy.class, "forceSerial");

        assertThat(ExecutionPolicy.parallel(executor, 4, 8, NullLogProvider.getInstance())
                        .isParallel())
                .isTrue();
    }

    private static List<String> join(
            View<Integer> outer, View<Pair<Integer, String>> inner, ExecutionPolicy policy) {
        return Views.joinWhere(outer, inner, a -> a, Pair::getLeft, (a, b) -> a + b.getRight(), policy)
                .toList();
    }
}
