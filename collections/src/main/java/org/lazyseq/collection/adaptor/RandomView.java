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

import java.util.Random;
import java.util.function.Supplier;
import org.lazyseq.collection.View;

/**
 * A view of values drawn from a {@link Distribution} by a random engine, bounded or unbounded.
 */
public final class RandomView<T> extends View<T> {
    private final Distribution<T> distribution;
    private final Random engine;

    public RandomView(Distribution<T> distribution, Random engine, long amount, boolean unbounded) {
        this(distribution, engine, () -> distribution.sample(engine), amount, unbounded);
    }

    private RandomView(
            Distribution<T> distribution, Random engine, Supplier<T> sampler, long amount, boolean unbounded) {
        super(new GenerateCursor<>(sampler, 0, unbounded), new GenerateCursor<>(sampler, amount, unbounded));
        this.distribution = distribution;
        this.engine = engine;
    }

    /**
     * Draws a single value, regardless of the size of this view.
     */
    public T nextRandom() {
        return distribution.sample(engine);
    }

    public T minRandom() {
        return distribution.min();
    }

    public T maxRandom() {
        return distribution.max();
    }
}
