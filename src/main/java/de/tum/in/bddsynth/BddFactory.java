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

public final class BddFactory {
    private BddFactory() {}

    public static Bdd buildBdd(int numberOfVariables) {
        return buildBdd(numberOfVariables, ImmutableBddConfiguration.builder().build());
    }

    public static Bdd buildBdd(int numberOfVariables, BddConfiguration configuration) {
        return new BddImpl(numberOfVariables, configuration);
    }

    public static Bdd buildBddRecursive(int numberOfVariables) {
        return buildBdd(numberOfVariables, ImmutableBddConfiguration.builder().iterative(false).build());
    }

    public static Bdd buildBddIterative(int numberOfVariables) {
        return buildBdd(numberOfVariables, ImmutableBddConfiguration.builder().iterative(true).build());
    }
}
