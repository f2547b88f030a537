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

import java.util.Objects;
import java.util.concurrent.ExecutionException;

public final class Exceptions {
    private Exceptions() {
        throw new AssertionError("No instances");
    }

    /**
     * Rethrows {@code exception} if it is an instance of {@link RuntimeException} or {@link Error}. Typical usage is:
     *
     * <pre>
     * catch (Throwable e) {
     *   ......common code......
     *   throwIfUnchecked(e);
     *   throw new RuntimeException(e);
     * }
     * </pre>
     *
     * @param exception to rethrow.
     */
    public static void throwIfUnchecked(Throwable exception) {
        Objects.requireNonNull(exception);
        if (exception instanceof RuntimeException) {
            throw (RuntimeException) exception;
        }
        if (exception instanceof Error) {
            throw (Error) exception;
        }
    }

    /**
     * Turns the failure of a task run on another thread into an exception for the waiting thread. The cause of an
     * {@link ExecutionException} is rethrown as-is when unchecked, anything else is wrapped.
     *
     * @param exception failure reported by a {@link java.util.concurrent.Future}.
     * @return a {@link RuntimeException} to throw if the cause was checked.
     */
    public static RuntimeException unwrapExecutionFailure(ExecutionException exception) {
        Throwable cause = exception.getCause() != null ? exception.getCause() : exception;
        throwIfUnchecked(cause);
        return new RuntimeException(cause);
    }
}
