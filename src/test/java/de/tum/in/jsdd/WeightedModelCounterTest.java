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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class WeightedModelCounterTest {
    private static final double EPSILON = 1.0e-9;

    static Stream<Integer> seeds() {
        return IntStream.range(0, 20).boxed();
    }

    @Test
    public void testMajority() {
        CircuitNode root = ExampleCircuits.majority().root();
        assertThat(WeightedModelCounter.count(root, ExampleCircuits.halfWeights(1.0)), is(1.0));
        assertThat(WeightedModelCounter.count(root, ExampleCircuits.halfWeights(0.0)), is(0.75));
    }

    @Test
    public void testSelection() {
        CircuitNode root = ExampleCircuits.selection().root();
        assertThat(WeightedModelCounter.count(root, ExampleCircuits.halfWeights(1.0)), is(1.0));
        assertThat(WeightedModelCounter.count(root, ExampleCircuits.halfWeights(0.0)), is(0.5));
    }

    @Test
    public void testModelCount() {
        assertThat(WeightedModelCounter.modelCount(ExampleCircuits.majority().root()), is(4.0));
        assertThat(WeightedModelCounter.modelCount(ExampleCircuits.selection().root()), is(4.0));
        assertThat(WeightedModelCounter.count(ExampleCircuits.majority().root(), LiteralWeights.uniform(3)), is(4.0));
    }

    @Test
    public void testConstants() {
        LiteralWeights weights = LiteralWeights.uniform(1);
        Circuit circuit = new CircuitBuilder().falseNode(0).trueNode(1).literal(2, -1).build();
        assertThat(WeightedModelCounter.count(circuit.node(0), weights), is(0.0));
        assertThat(WeightedModelCounter.count(circuit.node(1), weights), is(1.0));
        assertThat(WeightedModelCounter.count(circuit.node(2), LiteralWeights.of(ImmutableMap.of(-1, 0.25))), is(0.25));
    }

    @Test
    public void testMissingWeight() {
        LiteralWeights weights = LiteralWeights.of(ImmutableMap.of(1, 1.0, -1, 1.0, 2, 0.5, -2, 0.5, 3, 0.5));
        CircuitNode root = ExampleCircuits.majority().root();
        MissingWeightException exception =
                assertThrows(MissingWeightException.class, () -> WeightedModelCounter.count(root, weights));
        assertThat(exception.literal(), is(-3));
    }

    @Test
    public void testElementOrderIrrelevant() {
        Circuit circuit = new CircuitBuilder()
                .literal(1, 1)
                .literal(2, -1)
                .literal(3, 2)
                .literal(4, -2)
                .decision(5, 3, 1, 4, 2)
                .decision(6, 4, 2, 3, 1)
                .decision(7, 1, 5, 2, 6)
                .decision(8, 2, 6, 1, 5)
                .root(7)
                .build();
        Random random = new Random(0);
        for (int i = 0; i < 10; i++) {
            LiteralWeights weights = ExampleCircuits.randomWeights(random, 2);
            double count = WeightedModelCounter.count(circuit.node(7), weights);
            assertThat(WeightedModelCounter.count(circuit.node(8), weights), closeTo(count, EPSILON));
            assertThat(WeightedModelCounter.count(circuit.node(6), weights), closeTo(
                    WeightedModelCounter.count(circuit.node(5), weights), EPSILON));
        }
    }

    @Test
    public void testUnreachableNodesIrrelevant() {
        Circuit circuit = new CircuitBuilder()
                .literal(1, 1)
                .literal(2, -1)
                .literal(3, 7)
                .decision(4, 1, 3)
                .decision(5, 1, 1, 2, 2)
                .root(5)
                .build();
        // No weight for variable 7 is needed, as it is not reachable
        LiteralWeights weights = LiteralWeights.of(ImmutableMap.of(1, 0.3, -1, 0.6));
        assertThat(WeightedModelCounter.count(circuit.root(), weights), closeTo(0.3 * 0.3 + 0.6 * 0.6, EPSILON));
    }

    @Test
    public void testIdempotent() {
        CircuitNode root = ExampleCircuits.majority().root();
        LiteralWeights weights = ExampleCircuits.randomWeights(new Random(1), 3);
        double first = WeightedModelCounter.count(root, weights);
        assertThat(WeightedModelCounter.count(root, weights), is(first));
    }

    @Test
    public void testSharingIsExploited() {
        CircuitNode root = ExampleCircuits.ladder(1000).root();
        assertThat(WeightedModelCounter.count(root, LiteralWeights.uniform(1000)), is(Math.pow(2, 1000)));

        ImmutableLiteralWeights.Builder builder = LiteralWeights.builder();
        for (int variable = 1; variable <= 1000; variable++) {
            builder.putWeights(variable, 0.5).putWeights(-variable, 0.5);
        }
        assertThat(WeightedModelCounter.count(root, builder.build()), is(1.0));
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testAgainstEnumeration(int seed) {
        Random random = new Random(seed);
        int variables = 1 + random.nextInt(8);
        boolean[] table = ExampleCircuits.randomTable(random, variables);
        CircuitNode root = ExampleCircuits.fromTruthTable(table, variables).root();

        LiteralWeights weights = ExampleCircuits.randomWeights(random, variables);
        assertThat(
                WeightedModelCounter.count(root, weights),
                closeTo(ExampleCircuits.bruteForceCount(table, variables, weights), EPSILON));

        int models = 0;
        for (boolean value : table) {
            if (value) {
                models += 1;
            }
        }
        assertThat(WeightedModelCounter.count(root, LiteralWeights.uniform(variables)), is((double) models));
    }

    @Test
    public void testConcurrentCounting() throws Exception {
        CircuitNode root = ExampleCircuits.fromTruthTable(ExampleCircuits.randomTable(new Random(2), 10), 10)
                .root();
        List<LiteralWeights> weights = new ArrayList<>();
        Random random = new Random(3);
        for (int i = 0; i < 16; i++) {
            weights.add(ExampleCircuits.randomWeights(random, 10));
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Double>> results = new ArrayList<>();
            for (LiteralWeights weight : weights) {
                results.add(executor.submit(() -> WeightedModelCounter.count(root, weight)));
            }
            for (int i = 0; i < weights.size(); i++) {
                assertThat(results.get(i).get(), is(WeightedModelCounter.count(root, weights.get(i))));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testLargeIds() {
        int large = Integer.MAX_VALUE;
        int far = 1_500_000_000;
        Circuit circuit = new CircuitBuilder()
                .trueNode(0)
                .literal(large, 1)
                .literal(far, -1)
                .decision(1, large, 0, far, 0)
                .build();
        LiteralWeights weights = LiteralWeights.of(ImmutableMap.of(1, 0.25, -1, 0.5));
        assertThat(WeightedModelCounter.count(circuit.root(), weights), is(0.75));
        assertThat(WeightedModelCounter.count(circuit.node(large), weights), is(0.25));
        assertThat(WeightedModelCounter.modelCount(circuit.root()), is(2.0));
    }

    @Test
    public void testMalformed() {
        assertThrows(NoRootException.class, () -> WeightedModelCounter.count(null, LiteralWeights.uniform(1)));
        Circuit cycle = new CircuitBuilder().literal(1, 1).decision(2, 1, 3).decision(3, 1, 2).build();
        assertThrows(
                MalformedCircuitException.class,
                () -> WeightedModelCounter.count(cycle.root(), LiteralWeights.uniform(1)));
    }
}
