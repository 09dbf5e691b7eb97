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

import java.util.List;

/**
 * The closed set of gates a netlist is made of.
 */
public enum GateType {
    BUFFER(1),
    NOT(1),
    AND(2),
    OR(2),
    NAND(2),
    NOR(2),
    XOR(2),
    XNOR(2),
    /** Inputs {@code [select, then, else]}. */
    MUX(3);

    private final int arity;

    GateType(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    public boolean apply(boolean[] inputs) {
        assert inputs.length == arity;
        switch (this) {
            case BUFFER:
                return inputs[0];
            case NOT:
                return !inputs[0];
            case AND:
                return inputs[0] && inputs[1];
            case OR:
                return inputs[0] || inputs[1];
            case NAND:
                return !(inputs[0] && inputs[1]);
            case NOR:
                return !(inputs[0] || inputs[1]);
            case XOR:
                return inputs[0] ^ inputs[1];
            case XNOR:
                return inputs[0] == inputs[1];
            case MUX:
                return inputs[0] ? inputs[1] : inputs[2];
            default:
                throw new AssertionError(this);
        }
    }

    /**
     * Renders the expression computed by a gate of this type over the given operands.
     */
    public String expression(List<String> operands) {
        assert operands.size() == arity;
        switch (this) {
            case BUFFER:
                return operands.get(0);
            case NOT:
                return "~" + operands.get(0);
            case AND:
                return operands.get(0) + " & " + operands.get(1);
            case OR:
                return operands.get(0) + " | " + operands.get(1);
            case NAND:
                return "~(" + operands.get(0) + " & " + operands.get(1) + ")";
            case NOR:
                return "~(" + operands.get(0) + " | " + operands.get(1) + ")";
            case XOR:
                return operands.get(0) + " ^ " + operands.get(1);
            case XNOR:
                return "~(" + operands.get(0) + " ^ " + operands.get(1) + ")";
            case MUX:
                return operands.get(0) + " ? " + operands.get(1) + " : " + operands.get(2);
            default:
                throw new AssertionError(this);
        }
    }
}
