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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class Gate {
    private final GateType type;
    private final String output;
    private final List<Signal> inputs;
    private final int id;

    public Gate(GateType type, String output, List<Signal> inputs, int id) {
        checkArgument(inputs.size() == type.arity(),
                "%s expects %d inputs, got %d", type, type.arity(), inputs.size());
        checkArgument(!output.isEmpty(), "Empty output name");
        this.type = type;
        this.output = output;
        this.inputs = List.copyOf(inputs);
        this.id = id;
    }

    public GateType type() {
        return type;
    }

    public String output() {
        return output;
    }

    public List<Signal> inputs() {
        return inputs;
    }

    public int id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Gate)) {
            return false;
        }
        Gate gate = (Gate) o;
        return id == gate.id && type == gate.type && output.equals(gate.output) && inputs.equals(gate.inputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, output, inputs, id);
    }

    @Override
    public String toString() {
        List<String> operands = inputs.stream().map(Signal::toString).collect(Collectors.toList());
        return type + " " + output + " = " + type.expression(operands);
    }
}
