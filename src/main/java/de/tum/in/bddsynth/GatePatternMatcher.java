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
 * Maps an if-then-else triple {@code f ? g : h} of signals to the narrowest gate computing it.
 *
 * <p>Rules are tried in order, the first match wins:</p>
 * <ol>
 *   <li>{@code f ? 1 : 0} is {@code BUFFER(f)},</li>
 *   <li>{@code f ? 0 : 1} is {@code NOT(f)},</li>
 *   <li>{@code f ? g : 0} is {@code AND(f, g)},</li>
 *   <li>{@code f ? 1 : h} is {@code OR(f, h)},</li>
 *   <li>{@code f ? g : g} is {@code BUFFER(g)},</li>
 *   <li>anything else is {@code MUX(f, g, h)}.</li>
 * </ol>
 * Rules 1 to 4 require {@code f}, and {@code g} or {@code h} where they are not constants, to be
 * named signals. Complemented operands are not recognized, so e.g. an exclusive or becomes a MUX.
 */
public final class GatePatternMatcher {
    private GatePatternMatcher() {}

    public static Match classify(Signal f, Signal g, Signal h) {
        if (f.isNamed()) {
            if (g.isTrue() && h.isFalse()) {
                return new Match(GateType.BUFFER, List.of(f));
            }
            if (g.isFalse() && h.isTrue()) {
                return new Match(GateType.NOT, List.of(f));
            }
            if (g.isNamed() && h.isFalse()) {
                return new Match(GateType.AND, List.of(f, g));
            }
            if (g.isTrue() && h.isNamed()) {
                return new Match(GateType.OR, List.of(f, h));
            }
        }
        if (g.isNamed() && g.equals(h)) {
            return new Match(GateType.BUFFER, List.of(g));
        }
        return new Match(GateType.MUX, List.of(f, g, h));
    }

    public static Gate toGate(Signal f, Signal g, Signal h, String output, int id) {
        Match match = classify(f, g, h);
        return new Gate(match.type(), output, match.inputs(), id);
    }

    /**
     * Result of a classification: the gate type and its ordered inputs.
     */
    public static final class Match {
        private final GateType type;
        private final List<Signal> inputs;

        Match(GateType type, List<Signal> inputs) {
            assert inputs.size() == type.arity();
            this.type = type;
            this.inputs = inputs;
        }

        public GateType type() {
            return type;
        }

        public List<Signal> inputs() {
            return inputs;
        }

        @Override
        public String toString() {
            return type + inputs.toString();
        }
    }
}
