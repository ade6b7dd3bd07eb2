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

import javax.annotation.Nullable;

/**
 * Computes the weighted model count of a circuit: constants evaluate to 0 and 1, literals to their
 * weight and decision nodes to the sum over their elements of {@code prime * sub}. Each node is
 * evaluated once, so the effort is linear in the size of the circuit.
 *
 * <p>The result is the weighted model count in the usual sense if the circuit is smooth, i.e. the
 * disjuncts of each decision node mention the same variables. Vtrees are not used to smooth the
 * computation.</p>
 */
public final class WeightedModelCounter extends MemoizedEvaluation {
    private final LiteralWeights weights;

    private WeightedModelCounter(LiteralWeights weights) {
        this.weights = weights;
    }

    /**
     * Computes the weighted model count of the function represented by {@code root}.
     *
     * @throws NoRootException           If {@code root} is {@code null}.
     * @throws MissingWeightException    If a reachable literal has no weight.
     * @throws MalformedCircuitException If the circuit contains a cycle.
     */
    public static double count(@Nullable CircuitNode root, LiteralWeights weights) {
        return new WeightedModelCounter(weights).evaluateFrom(root);
    }

    /**
     * Counts the models of the function represented by {@code root} over the variables occurring
     * below it.
     */
    public static double modelCount(@Nullable CircuitNode root) {
        return count(root, LiteralWeights.uniform(CircuitStatistics.of(root).support()));
    }

    @Override
    protected double evaluate(CircuitNode node) {
        switch (node.kind()) {
            case FALSE:
                return 0.0d;
            case TRUE:
                return 1.0d;
            case LITERAL:
                return weights.weight(node.literal());
            case DECISION:
                double sum = 0.0d;
                for (CircuitNode.Element element : node.elements()) {
                    sum += valueOf(element.prime()) * valueOf(element.sub());
                }
                return sum;
            default:
                throw new AssertionError(node.kind());
        }
    }
}
