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

import static de.tum.in.jsdd.Util.checkArgument;
import static de.tum.in.jsdd.Util.checkState;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import javax.annotation.Nullable;

/**
 * A node of a variable tree, i.e. a full binary tree whose leaves are labelled with variables.
 * Every node carries a position, which is unique within its tree. The trees created by the
 * factory methods number their nodes in-order, so leaves obtain even and internal nodes odd
 * positions.
 *
 * <p>Every node can be the child of at most one internal node, {@link #internal(int, Vtree, Vtree)}
 * rejects a node which already has a parent.</p>
 */
public final class Vtree {
    private final int position;
    private final int variable;
    @Nullable
    private final Vtree left;
    @Nullable
    private final Vtree right;
    private boolean adopted = false;

    private Vtree(int position, int variable, @Nullable Vtree left, @Nullable Vtree right) {
        this.position = position;
        this.variable = variable;
        this.left = left;
        this.right = right;
    }

    public static Vtree leaf(int position, int variable) {
        checkArgument(variable > 0, "Variables are positive, got %d", variable);
        return new Vtree(position, variable, null, null);
    }

    public static Vtree internal(int position, Vtree left, Vtree right) {
        checkArgument(left != right, "Children of %d are identical", position);
        synchronized (Vtree.class) {
            checkArgument(!left.adopted, "Node %d already has a parent", left.position);
            checkArgument(!right.adopted, "Node %d already has a parent", right.position);
            left.adopted = true;
            right.adopted = true;
        }
        return new Vtree(position, 0, left, right);
    }

    /**
     * Builds the right-linear tree over the given variables, i.e. every left child is a leaf.
     */
    public static Vtree rightLinear(int... variables) {
        checkArgument(variables.length > 0, "No variables given");
        return rightLinear(variables, 0, new int[] {0});
    }

    private static Vtree rightLinear(int[] variables, int from, int[] counter) {
        if (from == variables.length - 1) {
            return leaf(counter[0]++, variables[from]);
        }
        Vtree left = leaf(counter[0]++, variables[from]);
        int position = counter[0]++;
        return internal(position, left, rightLinear(variables, from + 1, counter));
    }

    /**
     * Builds a balanced tree over the given variables, keeping their order from left to right.
     */
    public static Vtree balanced(int... variables) {
        checkArgument(variables.length > 0, "No variables given");
        return balanced(variables, 0, variables.length, new int[] {0});
    }

    private static Vtree balanced(int[] variables, int from, int to, int[] counter) {
        if (to - from == 1) {
            return leaf(counter[0]++, variables[from]);
        }
        int middle = from + (to - from) / 2;
        Vtree left = balanced(variables, from, middle, counter);
        int position = counter[0]++;
        return internal(position, left, balanced(variables, middle, to, counter));
    }

    public int position() {
        return position;
    }

    public boolean isLeaf() {
        return left == null;
    }

    /**
     * Returns the variable of this leaf.
     */
    public int variable() {
        checkState(isLeaf(), "Node %d is not a leaf", position);
        return variable;
    }

    @Nullable
    public Vtree left() {
        return left;
    }

    @Nullable
    public Vtree right() {
        return right;
    }

    /**
     * Returns the variables of all leaves below (and including) this node.
     */
    public BitSet variables() {
        BitSet variables = new BitSet();
        Deque<Vtree> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Vtree current = stack.pop();
            if (current.isLeaf()) {
                variables.set(current.variable);
            } else {
                stack.push(current.right);
                stack.push(current.left);
            }
        }
        return variables;
    }

    /**
     * Finds the node with the given {@code position} in this subtree.
     *
     * @return The node or {@code null} if no such node exists.
     */
    @Nullable
    public Vtree find(int position) {
        Deque<Vtree> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Vtree current = stack.pop();
            if (current.position == position) {
                return current;
            }
            if (!current.isLeaf()) {
                stack.push(current.right);
                stack.push(current.left);
            }
        }
        return null;
    }

    public int size() {
        return isLeaf() ? 1 : 1 + left.size() + right.size();
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return String.format("%d:%d", position, variable);
        }
        return String.format("(%s %d %s)", left, position, right);
    }
}
