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

import static java.lang.String.format;

/**
 * Capability level of a {@link Cursor}. Tiers are ordered from weakest to strongest, a cursor of some tier supports
 * every operation of the weaker tiers.
 */
public enum Tier {
    /**
     * Dereference, advance, equality and copy.
     */
    FORWARD,
    /**
     * Adds {@link Cursor#decrement()}.
     */
    BIDIRECTIONAL,
    /**
     * Adds constant time {@link Cursor#advance(long)} and {@link Cursor#distanceTo(Cursor)}.
     */
    RANDOM_ACCESS;

    public boolean supports(Tier required) {
        return compareTo(required) >= 0;
    }

    /**
     * @return the weakest of the given tiers, which is the most a cursor composed of cursors with these tiers offers.
     */
    public static Tier weakest(Tier first, Tier... others) {
        Tier weakest = first;
        for (Tier tier : others) {
            if (tier.compareTo(weakest) < 0) {
                weakest = tier;
            }
        }
        return weakest;
    }

    public static Tier weakestOf(Cursor<?>... cursors) {
        Tier weakest = RANDOM_ACCESS;
        for (Cursor<?> cursor : cursors) {
            weakest = weakest(weakest, cursor.tier());
        }
        return weakest;
    }

    /**
     * Fails fast when {@code cursor} is used for an operation its tier does not offer. Such a call is a programming
     * error, not a condition to recover from.
     *
     * @throws UnsupportedOperationException if the tier of {@code cursor} is weaker than {@code required}.
     */
    public static void check(Cursor<?> cursor, Tier required, String operation) {
        if (!cursor.tier().supports(required)) {
            throw new UnsupportedOperationException(format(
                    "%s requires a %s cursor, but %s is %s",
                    operation, required, cursor.getClass().getSimpleName(), cursor.tier()));
        }
    }
}
