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
import org.lazyseq.util.Preconditions;

/**
 * Turns the output of a random engine into values of some range.
 *
 * @param <T> type of the sampled values.
 */
public interface Distribution<T> {
    T sample(Random engine);

    /**
     * @return the smallest value this distribution can produce.
     */
    T min();

    /**
     * @return the largest value this distribution can produce.
     */
    T max();

    /**
     * Integers uniformly distributed over {@code [min, max]}, both inclusive.
     */
    static Distribution<Integer> uniform(int min, int max) {
        Preconditions.checkArgument(min <= max, "min (%d) must not be greater than max (%d)", min, max);
        long range = (long) max - min + 1;
        return new Distribution<>() {
            @Override
            public Integer sample(Random engine) {
                return (int) (min + engine.nextLong(range));
            }

            @Override
            public Integer min() {
                return min;
            }

            @Override
            public Integer max() {
                return max;
            }
        };
    }

    /**
     * Doubles uniformly distributed over {@code [min, max]}.
     */
    static Distribution<Double> uniform(double min, double max) {
        Preconditions.checkArgument(min <= max, "min (%s) must not be greater than max (%s)", min, max);
        return new Distribution<>() {
            @Override
            public Double sample(Random engine) {
                return min + engine.nextDouble() * (max - min);
            }

            @Override
            public Double min() {
                return min;
            }

            @Override
            public Double max() {
                return max;
            }
        };
    }
}
