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
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Writes circuits and vtrees in the Graphviz DOT format.
 *
 * <p>A circuit node shared by several parents is declared once and referenced by its id from each
 * incoming edge. Each element of a decision node is drawn as a separate product node {@code
 * ps_<node>_<index>}, connected to the decision node and to its prime and sub.</p>
 */
public final class DotExporter {
    private static final Logger logger = Logger.getLogger(DotExporter.class.getName());

    private static final String FALSE_LABEL = "⟘";
    private static final String TRUE_LABEL = "⟙";
    private static final String DECISION_LABEL = "+";
    private static final String PRODUCT_LABEL = "×";

    private DotExporter() {}

    public static String exportCircuit(@Nullable CircuitNode root) {
        return exportCircuit(root, DotConfiguration.defaults());
    }

    /**
     * Renders the sub-DAG below {@code root}.
     *
     * @throws NoRootException           If {@code root} is {@code null}.
     * @throws MalformedCircuitException If the circuit contains a cycle.
     */
    public static String exportCircuit(@Nullable CircuitNode root, DotConfiguration configuration) {
        StringBuilder builder = new StringBuilder(256);
        builder.append("digraph sdd {\n");
        int count = CircuitTraversal.traverse(root, new CircuitWriter(builder, configuration));
        builder.append("}\n");
        logger.log(Level.FINE, "Exported {0} circuit nodes", count);
        return builder.toString();
    }

    public static String exportVtree(@Nullable Vtree root) {
        return exportVtree(root, DotConfiguration.defaults());
    }

    /**
     * Renders the vtree below {@code root}. Leaves are boxes labelled with their variable,
     * internal nodes are points.
     *
     * @throws NoRootException If {@code root} is {@code null}.
     */
    public static String exportVtree(@Nullable Vtree root, DotConfiguration configuration) {
        if (root == null) {
            throw new NoRootException();
        }
        boolean showIdentity = configuration.showIdentity();

        StringBuilder builder = new StringBuilder(256);
        builder.append("digraph vtree {\n");
        if (showIdentity) {
            builder.append("start [shape=plaintext,style=invis];\n");
            builder.append(String.format(
                    "start -> %d [penwidth=0,arrowhead=none,headlabel=\"%d\"];\n",
                    root.position(), root.position()));
        }

        Deque<Vtree> stack = new ArrayDeque<>();
        stack.push(root);
        int count = 0;
        while (!stack.isEmpty()) {
            Vtree vtree = stack.pop();
            count += 1;
            if (vtree.isLeaf()) {
                builder.append(String.format(
                        "%d [label=\"%s\",shape=\"box\"];\n",
                        vtree.position(), literalLabel(vtree.variable(), configuration)));
                continue;
            }
            if (showIdentity) {
                builder.append(String.format(
                        "%d [label=\"%d\",shape=\"point\"];\n", vtree.position(), vtree.position()));
            } else {
                builder.append(String.format("%d [shape=\"point\"];\n", vtree.position()));
            }
            Vtree left = vtree.left();
            Vtree right = vtree.right();
            assert left != null && right != null;
            appendVtreeEdge(builder, vtree, left, showIdentity);
            appendVtreeEdge(builder, vtree, right, showIdentity);
            stack.push(right);
            stack.push(left);
        }
        builder.append("}\n");
        logger.log(Level.FINE, "Exported {0} vtree nodes", count);
        return builder.toString();
    }

    private static void appendVtreeEdge(StringBuilder builder, Vtree parent, Vtree child, boolean showIdentity) {
        builder.append(parent.position()).append(" -> ").append(child.position()).append(" [arrowhead=none");
        if (showIdentity) {
            builder.append(",headclip=true,headlabel=\"").append(child.position()).append('"');
        }
        builder.append("];\n");
    }

    private static String literalLabel(int literal, DotConfiguration configuration) {
        String name = configuration.literalNames().get(literal);
        return name == null ? Integer.toString(literal) : escape(name);
    }

    static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static final class CircuitWriter implements CircuitVisitor {
        private final StringBuilder builder;
        private final DotConfiguration configuration;

        CircuitWriter(StringBuilder builder, DotConfiguration configuration) {
            this.builder = builder;
            this.configuration = configuration;
        }

        @Override
        public void enter(CircuitNode node) {
            int id = node.id();
            if (!node.isDecision()) {
                builder.append(id).append(" [shape=rectangle,label=\"").append(label(node)).append('"');
                appendIdentity(node);
                builder.append("];\n");
                return;
            }

            builder.append(id).append(" [shape=circle,label=\"").append(DECISION_LABEL).append('"');
            appendIdentity(node);
            builder.append("];\n");
            List<CircuitNode.Element> elements = node.elements();
            for (int i = 0; i < elements.size(); i++) {
                CircuitNode.Element element = elements.get(i);
                String product = "ps_" + id + '_' + i;
                builder.append(product)
                        .append(" [shape=circle,label=\"")
                        .append(PRODUCT_LABEL)
                        .append("\"];\n");
                builder.append(id).append(" -> ").append(product).append(" [arrowhead=none];\n");
                builder.append(product).append(" -> ").append(element.prime().id()).append(";\n");
                builder.append(product).append(" -> ").append(element.sub().id()).append(";\n");
            }
        }

        private String label(CircuitNode node) {
            switch (node.kind()) {
                case FALSE:
                    return FALSE_LABEL;
                case TRUE:
                    return TRUE_LABEL;
                case LITERAL:
                    return literalLabel(node.literal(), configuration);
                default:
                    throw new AssertionError(node.kind());
            }
        }

        private void appendIdentity(CircuitNode node) {
            if (!configuration.showIdentity()) {
                return;
            }
            Vtree vtree = node.vtree();
            String position = vtree == null ? "n" : Integer.toString(vtree.position());
            builder.append(",xlabel=\"Id:").append(node.id()).append("\\nVp:").append(position).append('"');
        }
    }
}
