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

import java.util.Map;
import org.immutables.value.Value;

/**
 * Outcome of synthesizing one output function.
 */
@Value.Immutable
public abstract class SynthesisResult {
    public abstract String outputLabel();

    /**
     * The root node in the manager the result was built with.
     */
    public abstract int root();

    /**
     * All nodes allocated by the manager, including both terminals.
     */
    public abstract int totalNodeCount();

    public abstract int nonTerminalNodeCount();

    @Value.Auxiliary
    public abstract Netlist netlist();

    public Map<GateType, Integer> gateCounts() {
        return netlist().gateCounts();
    }
}
