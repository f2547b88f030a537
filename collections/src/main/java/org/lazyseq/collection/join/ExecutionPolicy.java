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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.lazyseq.helpers.NamedThreadFactory;
import org.lazyseq.util.FeatureToggles;
import org.lazyseq.util.Preconditions;
import org.neo4j.logging.InternalLog;
import org.neo4j.logging.InternalLogProvider;
import org.neo4j.logging.NullLogProvider;

/**
 * Decides how a {@link JoinWhereCursor} scans the outer sequence for the next match: {@link #SERIAL}ly on the calling
 * thread, or split into partitions scanned concurrently. Results of a parallel scan are only safe to rely on when the
 * caller does not depend on their order, and the sequences and selectors must tolerate concurrent reads. An outer
 * sequence that is not {@link org.lazyseq.collection.Tier#RANDOM_ACCESS} is always scanned serially.
 * <p>
 * Defaults of {@link #parallel()} come from feature toggles on this class: {@code parallelism} (available processors),
 * {@code minPartitionSize} (64) and {@code forceSerial} (false) which turns every parallel policy into a serial one.
 */
public final class ExecutionPolicy {
    static final String THREAD_NAME_PREFIX = "lazyseq-join";
    private static final int DEFAULT_MIN_PARTITION_SIZE = 64;

    public static final ExecutionPolicy SERIAL =
            new ExecutionPolicy(null, 1, Integer.MAX_VALUE, NullLogProvider.getInstance());

    private static volatile ExecutorService sharedPool;

    private final ExecutorService executor;
    private final int parallelism;
    private final int minPartitionSize;
    private final InternalLogProvider logProvider;

    private ExecutionPolicy(
            ExecutorService executor, int parallelism, int minPartitionSize, InternalLogProvider logProvider) {
        this.executor = executor;
        this.parallelism = parallelism;
        this.minPartitionSize = minPartitionSize;
        this.logProvider = logProvider;
    }

    /**
     * Parallel scanning on a shared pool of daemon threads, created on first use.
     */
    public static ExecutionPolicy parallel() {
        return parallel(NullLogProvider.getInstance());
    }

    public static ExecutionPolicy parallel(InternalLogProvider logProvider) {
        if (FeatureToggles.flag(ExecutionPolicy.class, "forceSerial", false)) {
            return SERIAL;
        }
        int parallelism = defaultParallelism();
        return parallel(sharedPool(parallelism, logProvider), parallelism, defaultMinPartitionSize(), logProvider);
    }

    /**
     * Parallel scanning on a caller owned executor, which is never shut down by this library.
     *
     * @param executor runs the partition scans.
     * @param parallelism the maximum number of partitions a scan is split into.
     * @param minPartitionSize the smallest number of outer elements worth a partition of their own.
     * @param logProvider receives debug output about the scans.
     */
    public static ExecutionPolicy parallel(
            ExecutorService executor, int parallelism, int minPartitionSize, InternalLogProvider logProvider) {
        Preconditions.requireNonNull(executor, "A parallel execution policy needs an executor");
        Preconditions.requirePositive(parallelism);
        Preconditions.requirePositive(minPartitionSize);
        if (FeatureToggles.flag(ExecutionPolicy.class, "forceSerial", false)) {
            return SERIAL;
        }
        return new ExecutionPolicy(executor, parallelism, minPartitionSize, logProvider);
    }

    private static int defaultParallelism() {
        return Preconditions.requirePositive(FeatureToggles.getInteger(
                ExecutionPolicy.class, "parallelism", Runtime.getRuntime().availableProcessors()));
    }

    private static int defaultMinPartitionSize() {
        return Preconditions.requirePositive(
                FeatureToggles.getInteger(ExecutionPolicy.class, "minPartitionSize", DEFAULT_MIN_PARTITION_SIZE));
    }

    private static ExecutorService sharedPool(int parallelism, InternalLogProvider logProvider) {
        ExecutorService pool = sharedPool;
        if (pool == null) {
            synchronized (ExecutionPolicy.class) {
                pool = sharedPool;
                if (pool == null) {
                    pool = Executors.newFixedThreadPool(parallelism, NamedThreadFactory.daemon(THREAD_NAME_PREFIX));
                    sharedPool = pool;
                    logProvider
                            .getLog(ExecutionPolicy.class)
                            .debug("Started shared join pool with %d threads", parallelism);
                }
            }
        }
        return pool;
    }

    public boolean isParallel() {
        return executor != null;
    }

    ExecutorService executor() {
        return executor;
    }

    int parallelism() {
        return parallelism;
    }

    int minPartitionSize() {
        return minPartitionSize;
    }

    InternalLog log(Class<?> loggingClass) {
        return logProvider.getLog(loggingClass);
    }

    @Override
    public String toString() {
        return isParallel()
                ? "ExecutionPolicy[parallel, parallelism=" + parallelism + ", minPartitionSize=" + minPartitionSize
                        + "]"
                : "ExecutionPolicy[serial]";
    }
}
