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
package org.lazyseq.collection;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class IterableCursorTest {

    @Test
    void shouldWalkIterableForward() {
        List<Integer> source = List.of(1, 2, 3);
        IterableCursor<Integer> cursor = IterableCursor.begin(source);
        IterableCursor<Integer> end = IterableCursor.end(source);

        assertThat(cursor.tier()).isEqualTo(Tier.FORWARD);
        assertThat(cursor.get()).isEqualTo(1);
        cursor.increment();
        assertThat(cursor.get()).isEqualTo(2);
        cursor.increment();
        assertThat(cursor.get()).isEqualTo(3);
        assertThat(cursor.samePosition(end)).isFalse();
        cursor.increment();
        assertThat(cursor.samePosition(end)).isTrue();
        assertThat(end.samePosition(cursor)).isTrue();
    }

    @Test
    void emptyIterableShouldStartAtEnd() {
        Set<String> empty = Set.of();

        assertThat(IterableCursor.begin(empty).samePosition(IterableCursor.end(empty)))
                .isTrue();
    }

    @Test
    void copyShouldResumeAtSamePosition() {
        List<String> source = List.of("a", "b", "c");
        IterableCursor<String> cursor = IterableCursor.begin(source);
        cursor.increment();

        IterableCursor<String> copy = cursor.copy();
        copy.increment();

        assertThat(cursor.get()).isEqualTo("b");
        assertThat(copy.get()).isEqualTo("c");
        assertThat(cursor.copy().samePosition(cursor)).isTrue();
        assertThat(copy.samePosition(cursor)).isFalse();
    }

    @Test
    void shouldNotEqualCursorOverOtherIterable() {
        assertThat(IterableCursor.end(List.of(1)).samePosition(IterableCursor.end(List.of(2))))
                .isFalse();
    }
}
