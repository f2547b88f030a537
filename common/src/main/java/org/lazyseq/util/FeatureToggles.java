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

import java.util.Objects;

/**
 * Tuning knobs read from system properties. The property name is the canonical name of the owning class
 * followed by a dot and the local name, e.g. {@code org.lazyseq.collection.join.ExecutionPolicy.parallelism}.
 */
public final class FeatureToggles {
    private FeatureToggles() {}

    /**
     * Get the value of a {@code boolean} system property.
     *
     * @param location the class that owns the flag.
     * @param name the local name of the flag.
     * @param defaultValue the default value of the flag if the system property is not assigned.
     * @return the parsed value of the system property, or the default value.
     */
    public static boolean flag(Class<?> location, String name, boolean defaultValue) {
        String value = System.getProperty(name(location, name));
        return defaultValue ? !"false".equalsIgnoreCase(value) : "true".equalsIgnoreCase(value);
    }

    /**
     * Get the value of a {@code int} system property.
     *
     * @param location the class that owns the flag.
     * @param name the local name of the flag.
     * @param defaultValue the default value of the flag if the system property is not assigned.
     * @return the parsed value of the system property, or the default value.
     */
    public static int getInteger(Class<?> location, String name, int defaultValue) {
        return Integer.getInteger(name(location, name), defaultValue);
    }

    /**
     * Set the value of a system property, named after the provided class and local name.
     */
    public static void set(Class<?> location, String name, Object value) {
        System.setProperty(name(location, name), Objects.toString(value));
    }

    public static void clear(Class<?> location, String name) {
        System.clearProperty(name(location, name));
    }

    private static String name(Class<?> location, String name) {
        return location.getCanonicalName() + "." + name;
    }
}
