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

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Depth-first traversal of the sub-DAG below a node, visiting every node exactly once regardless
 * of how many parents refer to it. Nodes are recognized by their dense index within the circuit
 * rather than their id. The visited set only lives for the duration of a single call, so a
 * circuit may be traversed by several threads at once.
 *
 * <p>The traversal uses an explicit stack, so the depth of a circuit is not bounded by the call
 * stack. Children are processed in element order, the prime before the sub.</p>
 */
public final class CircuitTraversal {
    private static final Logger logger = Logger.getLogger(CircuitTraversal.class.getName());

    private CircuitTraversal() {}

    /**
     * Traverses all nodes reachable from {@code root}.
     *
     * @param root    The node to start from.
     * @param visitor The callbacks invoked for each node.
     * @return The number of distinct nodes visited.
     * @throws NoRootException           If {@code root} is {@code null}.
     * @throws MalformedCircuitException If a node is reachable from itself.
     */
    public static int traverse(@Nullable CircuitNode root, CircuitVisitor visitor) {
        if (root == null) {
            throw new NoRootException();
        }

        BitSet visited = new BitSet();
        BitSet onPath = new BitSet();
        Deque<Frame> stack = new ArrayDeque<>();

        visited.set(root.index());
        onPath.set(root.index());
        visitor.enter(root);
        stack.push(new Frame(root));
        int count = 1;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            CircuitNode child = frame.nextChild();
            if (child == null) {
                stack.pop();
                onPath.clear(frame.node.index());
                visitor.exit(frame.node);
                continue;
            }
            int index = child.index();
            if (onPath.get(index)) {
                throw new MalformedCircuitException(
                        String.format("Cycle through node %d below node %d", child.id(), frame.node.id()));
            }
            if (visited.get(index)) {
                continue;
            }
            visited.set(index);
            onPath.set(index);
            visitor.enter(child);
            stack.push(new Frame(child));
            count += 1;
        }

        logger.log(Level.FINER, "Visited {0} nodes below {1}", new Object[] {count, root});
        return count;
    }

    private static final class Frame {
        final CircuitNode node;
        private final List<CircuitNode.Element> elements;
        private int next = 0;

        Frame(CircuitNode node) {
            this.node = node;
            this.elements = node.elements();
        }

        @Nullable
        CircuitNode nextChild() {
            if (next == 2 * elements.size()) {
                return null;
            }
            CircuitNode.Element element = elements.get(next / 2);
            CircuitNode child = next % 2 == 0 ? element.prime() : element.sub();
            next += 1;
            return child;
        }
    }
}
