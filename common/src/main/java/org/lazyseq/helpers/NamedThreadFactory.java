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
package org.lazyseq.helpers;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates threads named {@code <prefix>-<n>}, counting from 1.
 */
public class NamedThreadFactory implements ThreadFactory {
    private static final int DEFAULT_THREAD_PRIORITY = Thread.NORM_PRIORITY;

    private final AtomicInteger threadCounter = new AtomicInteger(1);
    private final String threadNamePrefix;
    private final int priority;
    private final boolean daemon;

    public NamedThreadFactory(String threadNamePrefix) {
        this(threadNamePrefix, DEFAULT_THREAD_PRIORITY, false);
    }

    public NamedThreadFactory(String threadNamePrefix, int priority, boolean daemon) {
        this.threadNamePrefix = threadNamePrefix;
        this.priority = priority;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread result = new Thread(runnable, threadNamePrefix + "-" + threadCounter.getAndIncrement());
        result.setDaemon(daemon);
        result.setPriority(priority);
        return result;
    }

    public static NamedThreadFactory named(String threadNamePrefix) {
        return new NamedThreadFactory(threadNamePrefix);
    }

    public static NamedThreadFactory daemon(String threadNamePrefix) {
        return new NamedThreadFactory(threadNamePrefix, DEFAULT_THREAD_PRIORITY, true);
    }
}
