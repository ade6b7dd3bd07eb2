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

import java.util.Collection;
import java.util.Map;
import java.util.NoSuchElementException;
import javax.annotation.Nullable;

/**
 * An immutable collection of circuit nodes indexed by their id, together with a designated root.
 * Circuits are obtained from a {@link CircuitBuilder}.
 */
public final class Circuit {
    private final Map<Integer, CircuitNode> nodes;
    private final CircuitNode root;
    @Nullable
    private final Vtree vtree;

    Circuit(Map<Integer, CircuitNode> nodes, CircuitNode root, @Nullable Vtree vtree) {
        this.nodes = Map.copyOf(nodes);
        this.root = root;
        this.vtree = vtree;
    }

    public CircuitNode root() {
        return root;
    }

    public CircuitNode node(int id) {
        CircuitNode node = nodes.get(id);
        if (node == null) {
            throw new NoSuchElementException("No node with id " + id);
        }
        return node;
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    /**
     * Returns all nodes of this circuit, including the ones not reachable from the root.
     */
    public Collection<CircuitNode> nodes() {
        return nodes.values();
    }

    public int nodeCount() {
        return nodes.size();
    }

    @Nullable
    public Vtree vtree() {
        return vtree;
    }

    @Override
    public String toString() {
        return String.format("Circuit{%d nodes, root %s}", nodes.size(), root);
    }
}
