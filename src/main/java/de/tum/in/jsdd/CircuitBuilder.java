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
import static de.tum.in.jsdd.Util.checkWellFormed;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Collects node definitions and assembles them into a {@link Circuit}. Nodes are identified by
 * explicit ids and may be defined in any order, elements may refer to nodes which are only
 * defined later. This mirrors the line-based NNF, SDD and PSDD file formats, whose readers are
 * the intended users of this class.
 *
 * <p>References are resolved by {@link #build()}. Cycles are not checked there, traversals
 * report them when they encounter one.</p>
 */
public final class CircuitBuilder {
    private static final Logger logger = Logger.getLogger(CircuitBuilder.class.getName());
    private static final int NO_NODE = -1;
    private static final double[] EMPTY_DOUBLE_ARRAY = new double[0];
    private static final int[] EMPTY_INT_ARRAY = new int[0];

    @Nullable
    private final Vtree vtree;
    private final Map<Integer, Definition> definitions = new LinkedHashMap<>();
    private final Map<Integer, Integer> vtreePositions = new HashMap<>();
    private int root = NO_NODE;
    private int lastDefined = NO_NODE;

    public CircuitBuilder() {
        this(null);
    }

    /**
     * Creates a builder whose nodes may be associated with nodes of the given {@code vtree}.
     */
    public CircuitBuilder(@Nullable Vtree vtree) {
        this.vtree = vtree;
    }

    public CircuitBuilder falseNode(int id) {
        return define(id, new Definition(CircuitNode.Kind.FALSE, 0, EMPTY_INT_ARRAY, EMPTY_DOUBLE_ARRAY));
    }

    public CircuitBuilder trueNode(int id) {
        return define(id, new Definition(CircuitNode.Kind.TRUE, 0, EMPTY_INT_ARRAY, EMPTY_DOUBLE_ARRAY));
    }

    public CircuitBuilder literal(int id, int literal) {
        checkArgument(literal != 0, "Literal of node %d is zero", id);
        checkArgument(literal != Integer.MIN_VALUE, "Literal of node %d has no negation", id);
        return define(id, new Definition(CircuitNode.Kind.LITERAL, literal, EMPTY_INT_ARRAY, EMPTY_DOUBLE_ARRAY));
    }

    /**
     * Defines a decision node.
     *
     * @param id            The id of the node.
     * @param primeSubPairs The ids of the elements, alternating prime and sub.
     * @return This builder.
     */
    public CircuitBuilder decision(int id, int... primeSubPairs) {
        return decision(id, new double[primeSubPairs.length / 2], primeSubPairs);
    }

    /**
     * Defines a decision node of a probabilistic circuit.
     *
     * @param id            The id of the node.
     * @param logParameters The logarithm of each element's parameter.
     * @param primeSubPairs The ids of the elements, alternating prime and sub.
     * @return This builder.
     */
    public CircuitBuilder decision(int id, double[] logParameters, int... primeSubPairs) {
        checkArgument(primeSubPairs.length % 2 == 0, "Odd number of children for node %d", id);
        checkArgument(
                logParameters.length == primeSubPairs.length / 2,
                "Node %d has %d elements but %d parameters",
                id,
                primeSubPairs.length / 2,
                logParameters.length);
        for (double logParameter : logParameters) {
            checkArgument(!Double.isNaN(logParameter) && logParameter <= 0.0, "Invalid parameter of node %d", id);
        }
        return define(
                id, new Definition(CircuitNode.Kind.DECISION, 0, primeSubPairs.clone(), logParameters.clone()));
    }

    /**
     * Associates the node {@code id} with the node of the vtree at {@code vtreePosition}.
     */
    public CircuitBuilder associate(int id, int vtreePosition) {
        checkState(vtree != null, "Builder has no vtree");
        vtreePositions.put(id, vtreePosition);
        return this;
    }

    /**
     * Explicitly sets the root. By default, the node defined last is the root.
     */
    public CircuitBuilder root(int id) {
        checkArgument(id >= 0, "Negative id %d", id);
        this.root = id;
        return this;
    }

    private CircuitBuilder define(int id, Definition definition) {
        checkArgument(id >= 0, "Negative id %d", id);
        checkWellFormed(!definitions.containsKey(id), "Node %d is defined twice", id);
        definitions.put(id, definition);
        lastDefined = id;
        return this;
    }

    public Circuit build() {
        checkState(!definitions.isEmpty(), "No nodes defined");

        for (Integer id : vtreePositions.keySet()) {
            checkWellFormed(definitions.containsKey(id), "Vtree associated with undefined node %d", id);
        }

        Map<Integer, CircuitNode> nodes = new HashMap<>(definitions.size() * 2);
        int index = 0;
        for (Map.Entry<Integer, Definition> entry : definitions.entrySet()) {
            int id = entry.getKey();
            Definition definition = entry.getValue();
            nodes.put(id, new CircuitNode(id, index, definition.kind, definition.literal, findVtree(id)));
            index += 1;
        }

        for (Map.Entry<Integer, Definition> entry : definitions.entrySet()) {
            Definition definition = entry.getValue();
            if (definition.kind != CircuitNode.Kind.DECISION) {
                continue;
            }
            int id = entry.getKey();
            int[] children = definition.children;
            List<CircuitNode.Element> elements = new ArrayList<>(children.length / 2);
            for (int i = 0; i < children.length; i += 2) {
                elements.add(new CircuitNode.Element(
                        resolve(nodes, id, children[i]),
                        resolve(nodes, id, children[i + 1]),
                        definition.logParameters[i / 2]));
            }
            nodes.get(id).connect(elements);
        }

        int rootId = root == NO_NODE ? lastDefined : root;
        checkWellFormed(nodes.containsKey(rootId), "Root %d is not defined", rootId);
        Circuit circuit = new Circuit(nodes, nodes.get(rootId), vtree);
        logger.log(Level.FINE, "Built {0}", circuit);
        return circuit;
    }

    @Nullable
    private Vtree findVtree(int id) {
        Integer position = vtreePositions.get(id);
        if (position == null) {
            return null;
        }
        assert vtree != null;
        Vtree node = vtree.find(position);
        checkWellFormed(node != null, "Node %d refers to unknown vtree position %d", id, position);
        return node;
    }

    private static CircuitNode resolve(Map<Integer, CircuitNode> nodes, int parent, int child) {
        CircuitNode node = nodes.get(child);
        checkWellFormed(node != null, "Node %d refers to undefined node %d", parent, child);
        return node;
    }

    private static final class Definition {
        final CircuitNode.Kind kind;
        final int literal;
        final int[] children;
        final double[] logParameters;

        Definition(CircuitNode.Kind kind, int literal, int[] children, double[] logParameters) {
            this.kind = kind;
            this.literal = literal;
            this.children = children;
            this.logParameters = logParameters;
        }
    }
}
