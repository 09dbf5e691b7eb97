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

/**
 * Read-only view on a binary decision diagram. Nodes are referred to by their integer id, which is
 * assigned once at creation and never changes.
 */
public interface DecisionDiagram {
    /**
     * Returns the node representing the constant {@code false}.
     */
    int falseNode();

    /**
     * Returns the node representing the constant {@code true}.
     */
    int trueNode();

    /**
     * Determines whether the given {@code node} represents a constant.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Gets the variable of the given {@code node} or {@code -1} for a leaf.
     */
    int variableOf(int node);

    /**
     * Returns the node which is reached when the variable of {@code node} is {@code false}.
     */
    int low(int node);

    /**
     * Returns the node which is reached when the variable of {@code node} is {@code true}.
     */
    int high(int node);

    /**
     * Returns the number of variables in this decision diagram.
     *
     * @return The number of variables.
     */
    int numberOfVariables();

    /**
     * Returns the number of nodes allocated so far, including both terminals.
     */
    int nodeCount();

    /**
     * Returns the number of allocated internal nodes.
     */
    default int nonTerminalNodeCount() {
        return nodeCount() - 2;
    }

    /**
     * Counts the distinct internal nodes reachable from {@code node}.
     */
    int reachableNodeCount(int node);

    /**
     * Evaluates the function represented by {@code node} under the given assignment, where entry
     * {@code i} is the value of variable {@code i}.
     */
    boolean evaluate(int node, boolean[] assignment);

    /**
     * Evaluates the function represented by {@code node} on the given minterm index. Variable
     * {@code 0} is the most significant bit of the index.
     */
    default boolean evaluateMinterm(int node, int minterm) {
        int variables = numberOfVariables();
        boolean[] assignment = new boolean[variables];
        for (int variable = 0; variable < variables; variable++) {
            assignment[variable] = ((minterm >>> (variables - 1 - variable)) & 1) != 0;
        }
        return evaluate(node, assignment);
    }
}
