/*
 * This file is part of BddSynth.
 * Copyright (c) 2026 The BddSynth Authors.
 *
 * BddSynth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * BddSynth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with BddSynth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.bddsynth;

import static de.tum.in.bddsynth.Util.checkArgument;

import java.util.Collection;
import java.util.Set;
import org.immutables.value.Value;

/**
 * A single-output Boolean function given by its ON-set and don't-care set over minterm indices. Every
 * index in neither set is an OFF minterm. Minterm {@code i} assigns variable {@code v} the bit
 * {@code numberOfVariables - 1 - v} of {@code i}.
 */
@Value.Immutable
public abstract class MintermSpecification {
    public static final int MAXIMAL_VARIABLES = 30;

    public static MintermSpecification of(int numberOfVariables, Collection<Integer> onSet, Collection<Integer> dcSet) {
        return ImmutableMintermSpecification.builder()
                .numberOfVariables(numberOfVariables)
                .addAllOnSet(onSet)
                .addAllDcSet(dcSet)
                .build();
    }

    public abstract int numberOfVariables();

    public abstract Set<Integer> onSet();

    public abstract Set<Integer> dcSet();

    public int mintermCount() {
        return 1 << numberOfVariables();
    }

    /**
     * Returns the fully specified truth table, resolving don't-cares with {@code policy}. ON-set
     * membership takes precedence over don't-care membership.
     */
    public boolean[] truthTable(DontCarePolicy policy) {
        boolean[] values = new boolean[mintermCount()];
        if (policy.value()) {
            for (int minterm : dcSet()) {
                values[minterm] = true;
            }
        }
        for (int minterm : onSet()) {
            values[minterm] = true;
        }
        return values;
    }

    @Value.Check
    protected void check() {
        checkArgument(0 <= numberOfVariables() && numberOfVariables() <= MAXIMAL_VARIABLES,
                "Unsupported number of variables %d", numberOfVariables());
        int mintermCount = mintermCount();
        for (int minterm : onSet()) {
            checkArgument(0 <= minterm && minterm < mintermCount, "ON minterm %d out of range", minterm);
        }
        for (int minterm : dcSet()) {
            checkArgument(0 <= minterm && minterm < mintermCount, "Don't-care minterm %d out of range", minterm);
        }
    }
}
