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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Hand-built and generated circuits used by tests and benchmarks.
 */
public final class ExampleCircuits {
    public static final int FALSE = 1;
    public static final int TRUE = 2;

    private ExampleCircuits() {}

    /* Common leaves: constants and both literals of x1 to x3, with ids 3 to 8 */
    private static CircuitBuilder leaves(Vtree vtree) {
        CircuitBuilder builder = new CircuitBuilder(vtree).falseNode(FALSE).trueNode(TRUE);
        for (int variable = 1; variable <= 3; variable++) {
            int positive = 2 * variable + 1;
            int position = 2 * (variable - 1);
            builder.literal(positive, variable)
                    .literal(positive + 1, -variable)
                    .associate(positive, position)
                    .associate(positive + 1, position);
        }
        return builder;
    }

    public static int literalId(int literal) {
        return literal > 0 ? 2 * literal + 1 : 2 * -literal + 2;
    }

    /**
     * The majority of {@code x1, x2, x3} over the right-linear vtree {@code (x1 (x2 x3))}, smooth.
     * The node {@code x3} is shared by three decision nodes.
     */
    public static Circuit majority() {
        return leaves(Vtree.rightLinear(1, 2, 3))
                // x3 or not x3
                .decision(9, literalId(3), TRUE, literalId(-3), TRUE)
                .associate(9, 4)
                // x2 or x3
                .decision(10, literalId(2), 9, literalId(-2), literalId(3))
                .associate(10, 3)
                // x2 and x3
                .decision(11, literalId(2), literalId(3), literalId(-2), FALSE)
                .associate(11, 3)
                .decision(12, literalId(1), 10, literalId(-1), 11)
                .associate(12, 1)
                .build();
    }

    /**
     * The function {@code (x1 and x2) or (not x1 and x3)}, smooth.
     */
    public static Circuit selection() {
        return leaves(Vtree.rightLinear(1, 2, 3))
                .decision(9, literalId(3), TRUE, literalId(-3), TRUE)
                // x2 and (x3 or not x3)
                .decision(10, literalId(2), 9, literalId(-2), FALSE)
                // (x2 or not x2) and x3
                .decision(11, literalId(2), literalId(3), literalId(-2), literalId(3))
                .decision(12, literalId(1), 10, literalId(-1), 11)
                .build();
    }

    /**
     * Weights where each variable other than {@code x1} has probability one half.
     */
    public static LiteralWeights halfWeights(double negativeFirst) {
        return LiteralWeights.of(ImmutableMap.of(1, 1.0, -1, negativeFirst, 2, 0.5, -2, 0.5, 3, 0.5, -3, 0.5));
    }

    /**
     * Builds a chain of {@code length} decision nodes, each referring to its successor through
     * both of its elements. Without sharing, the chain has {@code 2^length} paths.
     */
    public static Circuit ladder(int length) {
        CircuitBuilder builder = new CircuitBuilder().trueNode(0);
        int next = 0;
        for (int variable = length; variable >= 1; variable--) {
            int positive = 3 * variable;
            builder.literal(positive, variable).literal(positive + 1, -variable);
            builder.decision(positive + 2, positive, next, positive + 1, next);
            next = positive + 2;
        }
        return builder.build();
    }

    /**
     * Builds the complete (and thus smooth) decision diagram of the function given by its truth
     * table over the variables {@code 1, ..., variables}, where bit {@code v - 1} of the index
     * is the value of variable {@code v}. Equal sub-functions are shared.
     */
    public static Circuit fromTruthTable(boolean[] table, int variables) {
        assert table.length == 1 << variables;
        CircuitBuilder builder = new CircuitBuilder().falseNode(FALSE).trueNode(TRUE);
        int nextId = TRUE + 1;

        int[] level = new int[table.length];
        for (int i = 0; i < table.length; i++) {
            level[i] = table[i] ? TRUE : FALSE;
        }

        for (int k = variables - 1; k >= 0; k--) {
            int variable = k + 1;
            int positive = nextId++;
            int negative = nextId++;
            builder.literal(positive, variable).literal(negative, -variable);

            Map<Long, Integer> unique = new HashMap<>();
            int[] above = new int[1 << k];
            for (int assignment = 0; assignment < above.length; assignment++) {
                int low = level[assignment];
                int high = level[assignment | (1 << k)];
                long key = ((long) low << 32) | high;
                Integer existing = unique.get(key);
                if (existing == null) {
                    existing = nextId++;
                    builder.decision(existing, positive, high, negative, low);
                    unique.put(key, existing);
                }
                above[assignment] = existing;
            }
            level = above;
        }
        return builder.root(level[0]).build();
    }

    public static boolean[] randomTable(Random random, int variables) {
        boolean[] table = new boolean[1 << variables];
        for (int i = 0; i < table.length; i++) {
            table[i] = random.nextBoolean();
        }
        return table;
    }

    public static LiteralWeights randomWeights(Random random, int variables) {
        ImmutableLiteralWeights.Builder builder = LiteralWeights.builder();
        for (int variable = 1; variable <= variables; variable++) {
            builder.putWeights(variable, random.nextDouble());
            builder.putWeights(-variable, random.nextDouble());
        }
        return builder.build();
    }

    /**
     * Computes the weighted model count by enumerating all assignments of the truth table.
     */
    public static double bruteForceCount(boolean[] table, int variables, LiteralWeights weights) {
        double sum = 0.0;
        for (int assignment = 0; assignment < table.length; assignment++) {
            if (!table[assignment]) {
                continue;
            }
            double product = 1.0;
            for (int variable = 1; variable <= variables; variable++) {
                boolean value = (assignment & (1 << (variable - 1))) != 0;
                product *= weights.weight(value ? variable : -variable);
            }
            sum += product;
        }
        return sum;
    }
}
