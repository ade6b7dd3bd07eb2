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

import java.util.Random;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class CircuitState {
    @Param({"12", "16"})
    private int variables;

    @SuppressWarnings("NotNullFieldNotInitialized")
    private Circuit circuit;

    @SuppressWarnings("NotNullFieldNotInitialized")
    private LiteralWeights weights;

    @Setup(Level.Trial)
    public void setUpCircuit() {
        Random random = new Random(0L);
        circuit = ExampleCircuits.fromTruthTable(ExampleCircuits.randomTable(random, variables), variables);
        weights = ExampleCircuits.randomWeights(random, variables);
    }

    public Circuit circuit() {
        return circuit;
    }

    public LiteralWeights weights() {
        return weights;
    }
}
