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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class BddImplTest {
    private static final BddConfiguration recursive =
            ImmutableBddConfiguration.builder().build();
    private static final BddConfiguration iterative =
            ImmutableBddConfiguration.builder().iterative(true).build();

    @Test
    public void testTerminals() {
        BddImpl bdd = new BddImpl(3, recursive);
        assertThat(bdd.falseNode(), is(0));
        assertThat(bdd.trueNode(), is(1));
        assertThat(bdd.isLeaf(bdd.falseNode()), is(true));
        assertThat(bdd.variableOf(bdd.trueNode()), is(-1));
        assertThat(bdd.nodeCount(), is(2));
        assertThat(bdd.nonTerminalNodeCount(), is(0));
    }

    @Test
    public void testMakeNodeReduction() {
        BddImpl bdd = new BddImpl(3, recursive);
        int node = bdd.makeNode(2, bdd.falseNode(), bdd.trueNode());
        int count = bdd.nodeCount();

        for (int variable = 0; variable < 2; variable++) {
            assertThat(bdd.makeNode(variable, node, node), is(node));
            assertThat(bdd.makeNode(variable, bdd.trueNode(), bdd.trueNode()), is(bdd.trueNode()));
        }
        assertThat(bdd.nodeCount(), is(count));
    }

    @Test
    public void testMakeNodeSharing() {
        BddImpl bdd = new BddImpl(2, recursive);
        int first = bdd.makeNode(1, bdd.falseNode(), bdd.trueNode());
        int second = bdd.makeNode(1, bdd.falseNode(), bdd.trueNode());
        int negated = bdd.makeNode(1, bdd.trueNode(), bdd.falseNode());

        assertThat(first, is(2));
        assertThat(second, is(first));
        assertThat(negated, is(3));
        assertThat(bdd.nodeCount(), is(4));
        assertThat(bdd.low(first), is(bdd.falseNode()));
        assertThat(bdd.high(first), is(bdd.trueNode()));
    }

    @Test
    public void testMakeNodeInvalidVariable() {
        BddImpl bdd = new BddImpl(2, recursive);
        assertThrows(IllegalArgumentException.class, () -> bdd.makeNode(2, bdd.falseNode(), bdd.trueNode()));
        assertThrows(IllegalArgumentException.class, () -> bdd.makeNode(-1, bdd.falseNode(), bdd.trueNode()));
        assertThrows(IllegalArgumentException.class, () -> bdd.makeNode(0, bdd.falseNode(), 17));
    }

    @Test
    public void testMakeNodeRejectsOrderViolation() {
        BddImpl bdd = new BddImpl(3, recursive);
        int x0 = bdd.makeNode(0, bdd.falseNode(), bdd.trueNode());
        int x2 = bdd.makeNode(2, bdd.falseNode(), bdd.trueNode());
        int count = bdd.nodeCount();

        assertThrows(IllegalArgumentException.class, () -> bdd.makeNode(1, bdd.falseNode(), x0));
        assertThrows(IllegalArgumentException.class, () -> bdd.makeNode(1, x0, bdd.trueNode()));
        assertThrows(IllegalArgumentException.class, () -> bdd.makeNode(2, x2, bdd.falseNode()));
        assertThat(bdd.nodeCount(), is(count));

        int viaMakeNode = bdd.makeNode(0, bdd.falseNode(), bdd.makeNode(1, bdd.falseNode(), bdd.trueNode()));
        assertThat(viaMakeNode, is(bdd.and(x0, bdd.variableNode(1))));
        bdd.check();
    }

    @Test
    public void testLookupNodeDoesNotAllocate() {
        BddImpl bdd = new BddImpl(2, recursive);
        assertThat(bdd.lookupNode(1, bdd.falseNode(), bdd.trueNode()), is(-1));
        assertThat(bdd.nodeCount(), is(2));

        int node = bdd.makeNode(1, bdd.falseNode(), bdd.trueNode());
        assertThat(bdd.lookupNode(1, bdd.falseNode(), bdd.trueNode()), is(node));
        assertThat(bdd.lookupNode(0, bdd.falseNode(), bdd.trueNode()), is(-1));
        assertThat(bdd.lookupNode(1, bdd.trueNode(), bdd.falseNode()), is(-1));

        bdd.check();
        assertThat(bdd.nodeCount(), is(3));
    }

    @Test
    public void testTruthTableSizeMismatch() {
        BddImpl bdd = new BddImpl(3, recursive);
        assertThrows(IllegalArgumentException.class, () -> bdd.buildFromTruthTable(new boolean[7]));
        assertThrows(IllegalArgumentException.class, () -> bdd.buildFromTruthTable(new boolean[16]));
        assertThat(bdd.nodeCount(), is(2));
    }

    @Test
    public void testTruthTableAnd() {
        BddImpl bdd = new BddImpl(2, recursive);
        int root = bdd.buildFromTruthTable(TruthTables.of(0, 0, 0, 1));

        assertThat(bdd.nonTerminalNodeCount(), is(2));
        assertThat(bdd.variableOf(root), is(0));
        assertThat(bdd.low(root), is(bdd.falseNode()));
        int high = bdd.high(root);
        assertThat(bdd.variableOf(high), is(1));
        assertThat(bdd.low(high), is(bdd.falseNode()));
        assertThat(bdd.high(high), is(bdd.trueNode()));
        assertThat(bdd.and(bdd.variableNode(0), bdd.variableNode(1)), is(root));
    }

    @Test
    public void testTruthTableConstants() {
        BddImpl bdd = new BddImpl(2, recursive);
        assertThat(bdd.buildFromTruthTable(TruthTables.of(0, 0, 0, 0)), is(bdd.falseNode()));
        assertThat(bdd.buildFromTruthTable(TruthTables.of(1, 1, 1, 1)), is(bdd.trueNode()));
        assertThat(bdd.nodeCount(), is(2));
    }

    @Test
    public void testZeroVariables() {
        BddImpl bdd = new BddImpl(0, recursive);
        assertThat(bdd.buildFromTruthTable(TruthTables.of(1)), is(bdd.trueNode()));
        assertThat(bdd.buildFromTruthTable(TruthTables.of(0)), is(bdd.falseNode()));
        assertThat(bdd.evaluateMinterm(bdd.trueNode(), 0), is(true));
    }

    @Test
    public void testTruthTableCanonicity() {
        Random random = new Random(0L);
        for (int variables = 1; variables <= 8; variables++) {
            BddImpl bdd = new BddImpl(variables, recursive);
            boolean[] table = TruthTables.random(random, variables, 0.4);

            int first = bdd.buildFromTruthTable(table);
            int count = bdd.nodeCount();
            int second = bdd.buildFromTruthTable(table.clone());
            assertThat(second, is(first));
            assertThat(bdd.nodeCount(), is(count));
            bdd.check();
        }
    }

    @Test
    public void testTruthTableEvaluation() {
        Random random = new Random(1L);
        for (int variables = 0; variables <= 9; variables++) {
            BddImpl bdd = new BddImpl(variables, recursive);
            for (int round = 0; round < 5; round++) {
                boolean[] table = TruthTables.random(random, variables, random.nextDouble());
                int root = bdd.buildFromTruthTable(table);
                for (int minterm = 0; minterm < table.length; minterm++) {
                    assertThat(bdd.evaluateMinterm(root, minterm), is(table[minterm]));
                    assertThat(bdd.evaluate(root, TruthTables.assignment(variables, minterm)), is(table[minterm]));
                }
            }
            bdd.check();
        }
    }

    @Test
    public void testDistinctTablesDistinctNodes() {
        BddImpl bdd = new BddImpl(3, recursive);
        int majority = bdd.buildFromTruthTable(TruthTables.tabulate(3, m -> Integer.bitCount(m) >= 2));
        int parity = bdd.buildFromTruthTable(TruthTables.parity(3));
        assertThat(majority, not(parity));
    }

    @Test
    public void testParityAcrossConstructionPaths() {
        int variables = 16;
        for (BddConfiguration configuration : List.of(recursive, iterative)) {
            BddImpl bdd = new BddImpl(variables, configuration);
            int fromTable = bdd.buildFromTruthTable(TruthTables.parity(variables));
            assertThat(bdd.reachableNodeCount(fromTable), is(2 * variables - 1));

            int fromOperations = bdd.falseNode();
            for (int variable = variables - 1; variable >= 0; variable--) {
                fromOperations = bdd.xor(bdd.variableNode(variable), fromOperations);
            }
            assertThat(fromOperations, is(fromTable));
            bdd.check();
        }
    }

    @Test
    public void testTableGrowth() {
        BddConfiguration small = ImmutableBddConfiguration.builder().initialSize(4).initialCacheSize(1).build();
        Random random = new Random(2L);
        boolean[] table = TruthTables.random(random, 12, 0.5);

        BddImpl grown = new BddImpl(12, small);
        BddImpl reference = new BddImpl(12, recursive);
        int root = grown.buildFromTruthTable(table);
        int referenceRoot = reference.buildFromTruthTable(table);

        assertThat(grown.tableSize() > 4, is(true));
        assertThat(root, is(referenceRoot));
        assertThat(grown.nodeCount(), is(reference.nodeCount()));
        grown.check();
    }

    @Test
    public void testMintermSpecification() {
        MintermSpecification specification = MintermSpecification.of(2, List.of(3), List.of(1));
        BddImpl bdd = new BddImpl(2, recursive);

        int zero = bdd.buildFromMinterms(specification);
        assertThat(zero, is(bdd.buildFromTruthTable(TruthTables.of(0, 0, 0, 1))));
        assertThat(bdd.buildFromMinterms(specification, DontCarePolicy.ZERO), is(zero));

        int one = bdd.buildFromMinterms(specification, DontCarePolicy.ONE);
        assertThat(one, is(bdd.variableNode(1)));
    }

    @Test
    public void testMintermSpecificationVariableMismatch() {
        BddImpl bdd = new BddImpl(3, recursive);
        MintermSpecification specification = MintermSpecification.of(2, List.of(0), List.of());
        assertThrows(IllegalArgumentException.class, () -> bdd.buildFromMinterms(specification));
    }

    @Test
    public void testTreeToString() {
        BddImpl bdd = new BddImpl(2, recursive);
        int root = bdd.buildFromTruthTable(TruthTables.of(0, 1, 1, 0));
        String tree = bdd.treeToString(root);
        assertThat(tree.startsWith("Node " + root), is(true));
        assertThat(tree.lines().count(), is(5L));
        assertThat(bdd.statistics().contains("Ite cache"), is(true));
    }
}
