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

import static de.tum.in.jsdd.Util.checkState;

import java.util.List;
import javax.annotation.Nullable;

/**
 * A node of a circuit. Nodes are compared by identity, two nodes representing the same function
 * are still distinct. The id of a node is unique within its {@link Circuit}. Ids may be arbitrary
 * non-negative integers, so the builder additionally numbers the nodes of a circuit densely from
 * zero; traversals use this index to recognize shared nodes.
 *
 * <p>A decision node represents the disjunction of {@code prime AND sub} over its elements. The
 * primes of a well-formed decision node are mutually exclusive and exhaustive, which is assumed
 * and not checked.</p>
 */
public final class CircuitNode {
    public enum Kind {
        FALSE,
        TRUE,
        LITERAL,
        DECISION
    }

    private final int id;
    private final int index;
    private final Kind kind;
    private final int literal;
    @Nullable
    private final Vtree vtree;
    private List<Element> elements = List.of();

    CircuitNode(int id, int index, Kind kind, int literal, @Nullable Vtree vtree) {
        assert (kind == Kind.LITERAL) == (literal != 0);
        assert index >= 0;
        this.id = id;
        this.index = index;
        this.kind = kind;
        this.literal = literal;
        this.vtree = vtree;
    }

    // Only called while the owning circuit is built, nodes are immutable afterwards
    void connect(List<Element> elements) {
        assert kind == Kind.DECISION;
        this.elements = List.copyOf(elements);
    }

    public int id() {
        return id;
    }

    // Position of this node in its circuit, between zero and the node count
    int index() {
        return index;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFalse() {
        return kind == Kind.FALSE;
    }

    public boolean isTrue() {
        return kind == Kind.TRUE;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public boolean isDecision() {
        return kind == Kind.DECISION;
    }

    /**
     * Returns the literal of this node, i.e. the variable, negated if the literal is negative.
     */
    public int literal() {
        checkState(kind == Kind.LITERAL, "Node %d is not a literal", id);
        return literal;
    }

    /**
     * Returns the elements of this node in their defined order. Empty for all but decision nodes.
     */
    public List<Element> elements() {
        return elements;
    }

    /**
     * Returns the vtree node this node is normalized for, if known.
     */
    @Nullable
    public Vtree vtree() {
        return vtree;
    }

    @Override
    public String toString() {
        switch (kind) {
            case FALSE:
                return id + ":F";
            case TRUE:
                return id + ":T";
            case LITERAL:
                return id + ":L" + literal;
            case DECISION:
                return id + ":D" + elements.size();
            default:
                throw new AssertionError(kind);
        }
    }

    /**
     * A {@code (prime, sub)} pair of a decision node. For probabilistic circuits, each element
     * additionally carries the logarithm of its parameter; it is {@code 0} (i.e. parameter 1)
     * for plain circuits.
     */
    public static final class Element {
        private final CircuitNode prime;
        private final CircuitNode sub;
        private final double logParameter;

        Element(CircuitNode prime, CircuitNode sub, double logParameter) {
            this.prime = prime;
            this.sub = sub;
            this.logParameter = logParameter;
        }

        public CircuitNode prime() {
            return prime;
        }

        public CircuitNode sub() {
            return sub;
        }

        public double logParameter() {
            return logParameter;
        }

        public double parameter() {
            return Math.exp(logParameter);
        }

        @Override
        public String toString() {
            return String.format("(%d,%d)", prime.id, sub.id);
        }
    }
}
