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
 * A diagram manager over a fixed number of variables. The manager owns all nodes it creates; two
 * nodes of the same manager represent the same function if and only if their ids are equal.
 *
 * <p>Variables are ordered by their index, variable {@code 0} being the topmost.</p>
 */
public interface Bdd extends DecisionDiagram {
    /**
     * Returns the canonical node {@code variable ? high : low}. If {@code low} and {@code high} are
     * equal, {@code low} is returned and no node is allocated.
     *
     * @param variable The branching variable, smaller than the variables of both children.
     * @param low The node selected when {@code variable} is false.
     * @param high The node selected when {@code variable} is true.
     * @return The canonical node.
     */
    int makeNode(int variable, int low, int high);

    /**
     * Returns the node representing the given variable.
     */
    int variableNode(int variable);

    /**
     * Computes the node representing "if {@code ifNode} then {@code thenNode} else {@code elseNode}".
     */
    int ifThenElse(int ifNode, int thenNode, int elseNode);

    default int not(int node) {
        return ifThenElse(node, falseNode(), trueNode());
    }

    default int and(int node1, int node2) {
        return ifThenElse(node1, node2, falseNode());
    }

    default int or(int node1, int node2) {
        return ifThenElse(node1, trueNode(), node2);
    }

    default int xor(int node1, int node2) {
        return ifThenElse(node1, not(node2), node2);
    }

    default int equivalence(int node1, int node2) {
        return ifThenElse(node1, node2, not(node2));
    }

    default int implication(int node1, int node2) {
        return ifThenElse(node1, node2, trueNode());
    }

    /**
     * Builds the diagram of a fully specified truth table by Shannon decomposition. Entry {@code i}
     * of {@code values} is the function value on minterm {@code i}, where variable {@code 0} is the
     * most significant bit of {@code i}.
     *
     * @throws IllegalArgumentException if the table does not have exactly
     *     {@code 2^numberOfVariables()} entries.
     */
    int buildFromTruthTable(boolean[] values);

    /**
     * Builds the diagram of the given specification, resolving every don't-care according to
     * {@code policy}.
     *
     * @throws IllegalArgumentException if the specification has a different number of variables.
     */
    int buildFromMinterms(MintermSpecification specification, DontCarePolicy policy);

    /**
     * Builds the diagram of the given specification with all don't-cares resolved to {@code 0}.
     */
    default int buildFromMinterms(MintermSpecification specification) {
        return buildFromMinterms(specification, DontCarePolicy.ZERO);
    }

    String nodeToString(int node);

    String treeToString(int node);

    /**
     * Returns a human-readable summary of the node table and cache usage.
     */
    String statistics();
}
