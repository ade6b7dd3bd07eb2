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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Assigns a non-negative weight to literals. Both polarities of a variable are independent
 * entries, a literal without entry has no weight (as opposed to weight zero).
 */
@Value.Immutable
public abstract class LiteralWeights {
    public abstract Map<Integer, Double> weights();

    public static ImmutableLiteralWeights.Builder builder() {
        return ImmutableLiteralWeights.builder();
    }

    public static LiteralWeights of(Map<Integer, Double> weights) {
        return builder().putAllWeights(weights).build();
    }

    /**
     * Assigns weight 1 to both literals of each variable in {@code 1, ..., variables}.
     */
    public static LiteralWeights uniform(int variables) {
        BitSet set = new BitSet();
        set.set(1, variables + 1);
        return uniform(set);
    }

    /**
     * Assigns weight 1 to both literals of each variable in the given set.
     */
    public static LiteralWeights uniform(BitSet variables) {
        ImmutableLiteralWeights.Builder builder = builder();
        for (int variable = variables.nextSetBit(1); variable >= 0; variable = variables.nextSetBit(variable + 1)) {
            builder.putWeights(variable, 1.0d);
            builder.putWeights(-variable, 1.0d);
        }
        return builder.build();
    }

    /**
     * Returns the weight of the given {@code literal}.
     *
     * @throws MissingWeightException If no weight is assigned to the literal.
     */
    public double weight(int literal) {
        Double weight = weights().get(literal);
        if (weight == null) {
            throw new MissingWeightException(literal);
        }
        return weight;
    }

    public boolean hasWeight(int literal) {
        return weights().containsKey(literal);
    }

    /**
     * Lists all literals over the given {@code variables} which have no weight, positive literals
     * first for each variable.
     */
    public List<Integer> missingLiterals(BitSet variables) {
        List<Integer> missing = new ArrayList<>();
        for (int variable = variables.nextSetBit(1); variable >= 0; variable = variables.nextSetBit(variable + 1)) {
            if (!hasWeight(variable)) {
                missing.add(variable);
            }
            if (!hasWeight(-variable)) {
                missing.add(-variable);
            }
        }
        return missing;
    }

    @Value.Check
    protected void check() {
        for (Map.Entry<Integer, Double> entry : weights().entrySet()) {
            double weight = entry.getValue();
            checkArgument(entry.getKey() != 0, "Weight given for literal 0");
            checkArgument(
                    !Double.isNaN(weight) && weight >= 0.0d,
                    "Invalid weight %s for literal %d",
                    weight,
                    entry.getKey());
        }
    }
}
