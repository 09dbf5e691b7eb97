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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lowers a decision diagram into a {@link Netlist}, one gate per internal node.
 */
public final class NetlistBuilder {
    private static final Logger logger = Logger.getLogger(NetlistBuilder.class.getName());

    private NetlistBuilder() {}

    /**
     * Returns the names {@code x0, x1, ...} for the given number of variables.
     */
    public static List<String> defaultVariableNames(int numberOfVariables) {
        List<String> names = new ArrayList<>(numberOfVariables);
        for (int i = 0; i < numberOfVariables; i++) {
            names.add("x" + i);
        }
        return names;
    }

    /**
     * Builds the netlist of the function represented by {@code root}.
     *
     * <p>Nodes are processed in post-order, the low child before the high child, and every node
     * reachable from {@code root} yields exactly one gate driving a fresh wire {@code n0, n1, ...}.
     * Wire numbers already taken by a variable name or the output label are skipped.
     * If {@code root} is not a constant, a final buffer drives {@code outputLabel}, otherwise the
     * output is bound to the constant and no gate is emitted.</p>
     *
     * @param diagram The diagram owning {@code root}.
     * @param root The function to lower.
     * @param variableNames Name of each diagram variable.
     * @param outputLabel Name of the output signal.
     * @return The populated netlist.
     */
    public static Netlist build(DecisionDiagram diagram, int root, List<String> variableNames, String outputLabel) {
        checkNames(diagram, variableNames, outputLabel);

        List<String> reservedNames = new ArrayList<>(variableNames);
        reservedNames.add(outputLabel);
        Netlist netlist = new Netlist(variableNames, reservedNames);
        netlist.bind(diagram.falseNode(), Signal.FALSE);
        netlist.bind(diagram.trueNode(), Signal.TRUE);

        List<Signal> variableSignals = new ArrayList<>(variableNames.size());
        for (String name : variableNames) {
            variableSignals.add(Signal.named(name));
        }

        // Explicit stack; a node is expanded on its first visit and emitted once both children are bound
        BitSet expanded = new BitSet(diagram.nodeCount());
        int[] stack = new int[64];
        int stackIndex = 0;
        stack[stackIndex++] = root;
        while (stackIndex > 0) {
            int node = stack[stackIndex - 1];
            if (netlist.isBound(node)) {
                stackIndex -= 1;
                continue;
            }
            int low = diagram.low(node);
            int high = diagram.high(node);
            if (!expanded.get(node)) {
                expanded.set(node);
                if (stackIndex + 2 > stack.length) {
                    stack = Arrays.copyOf(stack, stack.length * 2);
                }
                stack[stackIndex++] = high;
                stack[stackIndex++] = low;
                continue;
            }
            stackIndex -= 1;

            String wire = netlist.newWireName();
            Signal variable = variableSignals.get(diagram.variableOf(node));
            Gate gate = GatePatternMatcher.toGate(
                    variable, netlist.signalOf(high), netlist.signalOf(low), wire, netlist.newGateId());
            netlist.addGate(gate);
            netlist.bind(node, Signal.named(wire));
        }

        Signal rootSignal = netlist.signalOf(root);
        if (rootSignal.isConstant()) {
            netlist.connectOutput(outputLabel, rootSignal);
        } else {
            netlist.addGate(new Gate(GateType.BUFFER, outputLabel, List.of(rootSignal), netlist.newGateId()));
            netlist.connectOutput(outputLabel, Signal.named(outputLabel));
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Built netlist for {0} with {1} gates from root {2}",
                    new Object[] {outputLabel, netlist.gates().size(), root});
        }
        return netlist;
    }

    private static void checkNames(DecisionDiagram diagram, List<String> variableNames, String outputLabel) {
        checkArgument(variableNames.size() == diagram.numberOfVariables(),
                "Got %d names for %d variables", variableNames.size(), diagram.numberOfVariables());
        checkArgument(outputLabel != null && !outputLabel.isEmpty(), "Empty output label");

        Set<String> seen = new HashSet<>();
        for (String name : variableNames) {
            checkArgument(name != null && !name.isEmpty(), "Empty variable name");
            checkArgument(!name.equals(outputLabel), "Variable %s clashes with the output", name);
            checkArgument(seen.add(name), "Duplicate variable name %s", name);
        }
    }
}
