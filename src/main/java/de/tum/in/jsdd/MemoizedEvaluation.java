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

import java.util.Arrays;
import java.util.BitSet;

/**
 * Skeleton of a bottom-up evaluation: every node is evaluated once, after all of its children,
 * and the value is stored by the node's index. Subclasses define the arithmetic.
 */
abstract class MemoizedEvaluation implements CircuitVisitor {
    private static final int INITIAL_SIZE = 64;

    private double[] values = new double[INITIAL_SIZE];
    private final BitSet evaluated = new BitSet();

    @Override
    public final void exit(CircuitNode node) {
        int index = node.index();
        double value = evaluate(node);
        if (index >= values.length) {
            values = Arrays.copyOf(values, Math.max(index + 1, 2 * values.length));
        }
        values[index] = value;
        evaluated.set(index);
    }

    /**
     * Computes the value of {@code node}. Values of its children are available through {@link
     * #valueOf(CircuitNode)}.
     */
    protected abstract double evaluate(CircuitNode node);

    protected final double valueOf(CircuitNode node) {
        assert evaluated.get(node.index()) : "Node " + node + " not evaluated yet";
        return values[node.index()];
    }

    final double evaluateFrom(CircuitNode root) {
        CircuitTraversal.traverse(root, this);
        return valueOf(root);
    }
}
