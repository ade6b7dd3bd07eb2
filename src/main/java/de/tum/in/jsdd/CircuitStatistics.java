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

import java.util.BitSet;
import javax.annotation.Nullable;

/**
 * Structural measures of the sub-DAG below a node. The size of a circuit is the total number of
 * elements of its decision nodes.
 */
public final class CircuitStatistics {
    private final int nodeCount;
    private final int decisionCount;
    private final int size;
    private final BitSet support;

    private CircuitStatistics(int nodeCount, int decisionCount, int size, BitSet support) {
        this.nodeCount = nodeCount;
        this.decisionCount = decisionCount;
        this.size = size;
        this.support = support;
    }

    public static CircuitStatistics of(@Nullable CircuitNode root) {
        Collector collector = new Collector();
        int nodeCount = CircuitTraversal.traverse(root, collector);
        return new CircuitStatistics(nodeCount, collector.decisionCount, collector.size, collector.support);
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int decisionCount() {
        return decisionCount;
    }

    public int size() {
        return size;
    }

    /**
     * Returns the set of variables occurring in literals below the root.
     */
    public BitSet support() {
        return (BitSet) support.clone();
    }

    @Override
    public String toString() {
        return String.format(
                "%d nodes (%d decisions), size %d, %d variables",
                nodeCount, decisionCount, size, support.cardinality());
    }

    private static final class Collector implements CircuitVisitor {
        int decisionCount = 0;
        int size = 0;
        final BitSet support = new BitSet();

        @Override
        public void enter(CircuitNode node) {
            if (node.isLiteral()) {
                support.set(Math.abs(node.literal()));
            } else if (node.isDecision()) {
                decisionCount += 1;
                size += node.elements().size();
            }
        }
    }
}
