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
package org.lazyseq.util;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.lazyseq.util.Preconditions.requireNonNull;
import static org.lazyseq.util.Preconditions.requirePositive;

import org.junit.jupiter.api.Test;

class PreconditionsTest {

    @Test
    void requirePositiveOk() {
        assertEquals(1, requirePositive(1));
    }

    @Test
    void requirePositiveFailsOnZero() {
        assertThrows(IllegalArgumentException.class, () -> requirePositive(0));
    }

    @Test
    void requirePositiveFailsOnNegative() {
        assertThrows(IllegalArgumentException.class, () -> requirePositive(-1));
    }

    @Test
    void requireNonNegativeOk() {
        Preconditions.requireNonNegative(0);
        Preconditions.requireNonNegative(1);
    }

    @Test
    void requireNonNegativeFailsOnNegative() {
        assertThrows(IllegalArgumentException.class, () -> Preconditions.requireNonNegative(-1));
    }

    @Test
    void checkStateOk() {
        Preconditions.checkState(true, "must not fail");
    }

    @Test
    void checkStateFormatsMessage() {
        var throwable =
                assertThrows(IllegalStateException.class, () -> Preconditions.checkState(false, "got %d", 42));
        assertEquals("got 42", throwable.getMessage());
    }

    @Test
    void checkArgumentKeepsMessageWithoutArguments() {
        var throwable = assertThrows(
                IllegalArgumentException.class, () -> Preconditions.checkArgument(false, "100% wrong"));
        assertEquals("100% wrong", throwable.getMessage());
    }

    @Test
    void requireNonNullObject() {
        var throwable = assertThrows(IllegalArgumentException.class, () -> requireNonNull(null, "error message"));
        assertTrue(throwable.getMessage().startsWith("error message"));
        final String nonNullArg = "not null";
        assertDoesNotThrow(() -> requireNonNull(nonNullArg, "error message"));
    }

    @Test
    void requirePositionAcceptsBothEnds() {
        assertEquals(0, Preconditions.requirePosition(0, 0, 6));
        assertEquals(6, Preconditions.requirePosition(6, 0, 6));
        assertThrows(IndexOutOfBoundsException.class, () -> Preconditions.requirePosition(-1, 0, 6));
        assertThrows(IndexOutOfBoundsException.class, () -> Preconditions.requirePosition(7, 0, 6));
    }
}
