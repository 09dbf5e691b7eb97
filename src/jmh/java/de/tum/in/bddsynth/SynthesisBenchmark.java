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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

public class SynthesisBenchmark {
    @State(Scope.Benchmark)
    public static class TableState extends BddState {
        private static final int SEED = 1234;
        private static final int TABLE_COUNT = 16;

        @Param({"12", "16"})
        private int variables;

        public List<boolean[]> tables;
        public List<String> names;

        @Setup(Level.Trial)
        public void setUpTables() {
            Random random = new Random(SEED);
            tables = new ArrayList<>(TABLE_COUNT);
            for (int i = 0; i < TABLE_COUNT; i++) {
                boolean[] table = new boolean[1 << variables];
                for (int j = 0; j < table.length; j++) {
                    table[j] = random.nextBoolean();
                }
                tables.add(table);
            }
            names = NetlistBuilder.defaultVariableNames(variables);
        }
    }

    @Benchmark
    public static void benchmarkTruthTable(TableState state, Blackhole bh) {
        Bdd bdd = BddFactory.buildBdd(state.variables, state.configuration());
        for (boolean[] table : state.tables) {
            bh.consume(bdd.buildFromTruthTable(table));
        }
        bh.consume(bdd.nodeCount());
    }

    @Benchmark
    public static void benchmarkNetlist(TableState state, Blackhole bh) {
        Bdd bdd = BddFactory.buildBdd(state.variables, state.configuration());
        for (boolean[] table : state.tables) {
            int root = bdd.buildFromTruthTable(table);
            bh.consume(NetlistBuilder.build(bdd, root, state.names, "f").gates().size());
        }
    }

    @Benchmark
    public static void benchmarkParityChain(TableState state, Blackhole bh) {
        Bdd bdd = BddFactory.buildBdd(state.variables, state.configuration());
        int node = bdd.falseNode();
        for (int variable = state.variables - 1; variable >= 0; variable--) {
            node = bdd.xor(bdd.variableNode(variable), node);
        }
        bh.consume(node);
    }
}
