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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class CircuitBenchmark extends BaseCircuitBenchmark {
    @Benchmark
    public static void weightedModelCount(CircuitState state, Blackhole bh) {
        bh.consume(WeightedModelCounter.count(state.circuit().root(), state.weights()));
    }

    @Benchmark
    public static void logProbability(CircuitState state, Blackhole bh) {
        bh.consume(PsddEvaluator.logProbability(state.circuit().root()));
    }

    @Benchmark
    public static void exportCircuit(CircuitState state, Blackhole bh) {
        bh.consume(DotExporter.exportCircuit(state.circuit().root()));
    }

    @Benchmark
    public static void ladder(Blackhole bh) {
        bh.consume(CircuitStatistics.of(ExampleCircuits.ladder(10_000).root()).size());
    }
}
