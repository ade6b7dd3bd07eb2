/*
 * This file is part of JSDD.
 * Copyright (c) 2024 Tobias Meggendorfer.
 *
 * JSDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JSDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JSDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jsdd;

/**
 * Per-node callbacks of a {@link CircuitTraversal}. Each distinct node reachable from the root is
 * entered and exited exactly once.
 */
public interface CircuitVisitor {
    /**
     * Called when the {@code node} is encountered for the first time, before any of its children.
     */
    default void enter(CircuitNode node) {}

    /**
     * Called after all children of the {@code node} have been exited.
     */
    default void exit(CircuitNode node) {}
}
