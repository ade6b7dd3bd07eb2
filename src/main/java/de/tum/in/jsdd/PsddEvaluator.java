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
 * Evaluates a probabilistic SDD in the log domain. Literals and true nodes have probability 1,
 * false has probability 0, and a decision node sums {@code theta * prime * sub} over its elements,
 * computed as a log-sum-exp to avoid underflow. The element parameters are used as stored in the
 * circuit, they are expected to be normalized already.
 */
public final class PsddEvaluator extends MemoizedEvaluation {
    private PsddEvaluator() {}

    /**
     * Computes the natural logarithm of the probability of the distribution below {@code root}.
     *
     * @throws NoRootException           If {@code root} is {@code null}.
     * @throws MalformedCircuitException If the circuit contains a cycle.
     */
    public static double logProbability(@Nullable CircuitNode root) {
        return new PsddEvaluator().evaluateFrom(root);
    }

    public static double probability(@Nullable CircuitNode root) {
        return Math.exp(logProbability(root));
    }

    @Override
    protected double evaluate(CircuitNode node) {
        switch (node.kind()) {
            case FALSE:
                return Double.NEGATIVE_INFINITY;
            case TRUE:
            case LITERAL:
                return 0.0d;
            case DECISION:
                return logSumExp(node);
            default:
                throw new AssertionError(node.kind());
        }
    }

    private double logSumExp(CircuitNode node) {
        int size = node.elements().size();
        double[] terms = new double[size];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < size; i++) {
            CircuitNode.Element element = node.elements().get(i);
            terms[i] = element.logParameter() + valueOf(element.prime()) + valueOf(element.sub());
            max = Math.max(max, terms[i]);
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return max;
        }
        double sum = 0.0d;
        for (double term : terms) {
            sum += Math.exp(term - max);
        }
        return max + Math.log(sum);
    }
}
