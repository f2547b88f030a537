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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;
import org.lazyseq.collection.Views;

class RandomViewTest {

    @Test
    void shouldDrawValuesWithinBounds() {
        RandomView<Integer> view = Views.random(Distribution.uniform(1, 6), new Random(42), 1000);

        MutableList<Integer> values = view.toList();

        assertThat(values).hasSize(1000).allMatch(value -> value >= 1 && value <= 6);
        assertThat(values.toSet()).hasSize(6);
        assertThat(view.minRandom()).isEqualTo(1);
        assertThat(view.maxRandom()).isEqualTo(6);
        assertThat(view.nextRandom()).isBetween(1, 6);
    }

    @Test
    void sameSeedShouldGiveSameValues() {
        assertThat(Views.random(Distribution.uniform(0.0, 1.0), new Random(7), 20).toList())
                .isEqualTo(Views.random(Distribution.uniform(0.0, 1.0), new Random(7), 20).toList());
    }

    @Test
    void dereferenceShouldBeStable() {
        RandomView<Integer> view = Views.random(Integer.MIN_VALUE, Integer.MAX_VALUE, 3);

        var cursor = view.begin();

        assertThat(cursor.get()).isEqualTo(cursor.get());
        assertThat(view.size()).isEqualTo(3);
    }

    @Test
    void unboundedViewShouldKeepDrawing() {
        RandomView<Double> view = Views.random(Distribution.uniform(-1.0, 1.0), new Random(1));

        assertThat(view.stream().limit(100).toList()).hasSize(100).allMatch(value -> value >= -1.0 && value <= 1.0);
        assertThat(view.isEmpty()).isFalse();
    }

    @Test
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> Distribution.uniform(2, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Views.random(0.0, 1.0, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
