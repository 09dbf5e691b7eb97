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
import static de.tum.in.bddsynth.Util.checkState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * An ordered list of gates over a fixed list of input variables, driving a single output. Each gate
 * only reads inputs, constants and outputs of earlier gates.
 *
 * <p>Instances are populated by {@link NetlistBuilder}; wire and gate numbering is local to each
 * instance.</p>
 */
public final class Netlist {
    private final List<String> variableNames;
    private final Set<String> reservedNames;
    private final List<Gate> gates = new ArrayList<>();
    private final Map<Integer, Signal> signalMap = new LinkedHashMap<>();

    private int nextWireId = 0;
    private int wireCount = 0;
    private int nextGateId = 0;

    @Nullable
    private String outputLabel = null;
    @Nullable
    private Signal outputSignal = null;

    Netlist(List<String> variableNames, Collection<String> reservedNames) {
        this.variableNames = List.copyOf(variableNames);
        this.reservedNames = Set.copyOf(reservedNames);
    }

    /* Skips names taken by a variable or the output label. */
    String newWireName() {
        String name;
        do {
            name = "n" + nextWireId;
            nextWireId += 1;
        } while (reservedNames.contains(name));
        wireCount += 1;
        return name;
    }

    int newGateId() {
        int id = nextGateId;
        nextGateId += 1;
        return id;
    }

    void addGate(Gate gate) {
        gates.add(gate);
    }

    void bind(int node, Signal signal) {
        Signal previous = signalMap.putIfAbsent(node, signal);
        assert previous == null : "Node " + node + " bound twice";
    }

    boolean isBound(int node) {
        return signalMap.containsKey(node);
    }

    Signal signalOf(int node) {
        Signal signal = signalMap.get(node);
        checkState(signal != null, "Node %d has no signal", node);
        return signal;
    }

    void connectOutput(String label, Signal signal) {
        checkState(outputLabel == null, "Output already connected to %s", outputLabel);
        this.outputLabel = label;
        this.outputSignal = signal;
    }

    public List<String> variableNames() {
        return variableNames;
    }

    public List<Gate> gates() {
        return Collections.unmodifiableList(gates);
    }

    /**
     * Returns the signal bound to each visited diagram node, in visiting order.
     */
    public Map<Integer, Signal> signalMap() {
        return Collections.unmodifiableMap(signalMap);
    }

    public String outputLabel() {
        checkState(outputLabel != null, "Output not connected");
        return outputLabel;
    }

    /**
     * Returns the signal seen at the output: the output label itself if a gate drives it, or a
     * constant.
     */
    public Signal outputSignal() {
        checkState(outputSignal != null, "Output not connected");
        return outputSignal;
    }

    public int wireCount() {
        return wireCount;
    }

    /**
     * Counts gates per type; every type is present, unused ones with count {@code 0}.
     */
    public Map<GateType, Integer> gateCounts() {
        Map<GateType, Integer> counts = new EnumMap<>(GateType.class);
        for (GateType type : GateType.values()) {
            counts.put(type, 0);
        }
        for (Gate gate : gates) {
            counts.merge(gate.type(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Simulates the netlist gate by gate.
     *
     * @param inputs Value of each variable, in the order of {@link #variableNames()}.
     * @return The value at the output.
     */
    public boolean evaluate(boolean[] inputs) {
        checkArgument(inputs.length == variableNames.size(),
                "Expected %d inputs, got %d", variableNames.size(), inputs.length);
        Signal output = outputSignal();
        if (output.isConstant()) {
            return output.constantValue();
        }

        Map<String, Boolean> values = new HashMap<>();
        for (int i = 0; i < inputs.length; i++) {
            values.put(variableNames.get(i), inputs[i]);
        }
        for (Gate gate : gates) {
            List<Signal> gateInputs = gate.inputs();
            boolean[] operands = new boolean[gateInputs.size()];
            for (int i = 0; i < operands.length; i++) {
                operands[i] = valueOf(gateInputs.get(i), values);
            }
            values.put(gate.output(), gate.type().apply(operands));
        }
        return valueOf(output, values);
    }

    private static boolean valueOf(Signal signal, Map<String, Boolean> values) {
        if (signal.isConstant()) {
            return signal.constantValue();
        }
        Boolean value = values.get(signal.name());
        checkState(value != null, "Signal %s read before it is driven", signal);
        return value;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(64 + 32 * gates.size());
        builder.append("Inputs: ").append(String.join(", ", variableNames)).append('\n')
                .append("Gates: ").append(gates.size()).append('\n');
        for (Gate gate : gates) {
            builder.append("  ").append(gate).append('\n');
        }
        if (outputSignal != null && outputSignal.isConstant()) {
            builder.append("  ").append(outputLabel).append(" = ").append(outputSignal).append('\n');
        }
        return builder.toString();
    }
}
