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

import java.util.Random;
import java.util.function.IntPredicate;

public final class TruthTables {
    private TruthTables() {}

    public static boolean[] random(Random random, int numberOfVariables, double density) {
        boolean[] values = new boolean[1 << numberOfVariables];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextDouble() < density;
        }
        return values;
    }

    public static boolean[] of(int... values) {
        boolean[] table = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            table[i] = values[i] != 0;
        }
        return table;
    }

    public static boolean[] tabulate(int numberOfVariables, IntPredicate function) {
        boolean[] values = new boolean[1 << numberOfVariables];
        for (int i = 0; i < values.length; i++) {
            values[i] = function.test(i);
        }
        return values;
    }

    public static boolean[] parity(int numberOfVariables) {
        return tabulate(numberOfVariables, minterm -> Integer.bitCount(minterm) % 2 == 1);
    }

    /* Variable 0 is the most significant bit of the minterm. */
    public static boolean[] assignment(int numberOfVariables, int minterm) {
        boolean[] assignment = new boolean[numberOfVariables];
        for (int variable = 0; variable < numberOfVariables; variable++) {
            assignment[variable] = ((minterm >>> (numberOfVariables - 1 - variable)) & 1) != 0;
        }
        return assignment;
    }
}
