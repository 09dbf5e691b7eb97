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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class GatePatternMatcherTest {
    private static final Signal x = Signal.named("x");
    private static final Signal a = Signal.named("a");
    private static final Signal b = Signal.named("b");

    private static Stream<Arguments> patterns() {
        return Stream.of(
                Arguments.of(x, Signal.TRUE, Signal.FALSE, GateType.BUFFER, List.of(x)),
                Arguments.of(x, Signal.FALSE, Signal.TRUE, GateType.NOT, List.of(x)),
                Arguments.of(x, a, Signal.FALSE, GateType.AND, List.of(x, a)),
                Arguments.of(x, Signal.TRUE, b, GateType.OR, List.of(x, b)),
                Arguments.of(x, a, a, GateType.BUFFER, List.of(a)),
                Arguments.of(x, a, b, GateType.MUX, List.of(x, a, b)),
                Arguments.of(x, Signal.FALSE, b, GateType.MUX, List.of(x, Signal.FALSE, b)),
                Arguments.of(x, a, Signal.TRUE, GateType.MUX, List.of(x, a, Signal.TRUE)),
                Arguments.of(x, Signal.TRUE, Signal.TRUE, GateType.MUX, List.of(x, Signal.TRUE, Signal.TRUE)),
                Arguments.of(x, Signal.FALSE, Signal.FALSE, GateType.MUX, List.of(x, Signal.FALSE, Signal.FALSE)),
                Arguments.of(Signal.TRUE, Signal.TRUE, Signal.FALSE, GateType.MUX,
                        List.of(Signal.TRUE, Signal.TRUE, Signal.FALSE)),
                Arguments.of(Signal.TRUE, a, a, GateType.BUFFER, List.of(a)),
                Arguments.of(Signal.FALSE, a, Signal.FALSE, GateType.MUX, List.of(Signal.FALSE, a, Signal.FALSE)));
    }

    @ParameterizedTest
    @MethodSource("patterns")
    public void testClassify(Signal f, Signal g, Signal h, GateType type, List<Signal> inputs) {
        GatePatternMatcher.Match match = GatePatternMatcher.classify(f, g, h);
        assertThat(match.type(), is(type));
        assertThat(match.inputs(), is(inputs));
    }

    @ParameterizedTest
    @MethodSource("patterns")
    public void testGateComputesIfThenElse(Signal f, Signal g, Signal h, GateType type, List<Signal> inputs) {
        Gate gate = GatePatternMatcher.toGate(f, g, h, "y", 0);
        // Every assignment of the named operands
        for (int bits = 0; bits < 8; bits++) {
            boolean xValue = (bits & 1) != 0;
            boolean aValue = (bits & 2) != 0;
            boolean bValue = (bits & 4) != 0;
            boolean fValue = value(f, xValue, aValue, bValue);
            boolean expected = fValue ? value(g, xValue, aValue, bValue) : value(h, xValue, aValue, bValue);

            boolean[] operands = new boolean[gate.inputs().size()];
            for (int i = 0; i < operands.length; i++) {
                operands[i] = value(gate.inputs().get(i), xValue, aValue, bValue);
            }
            assertThat(gate.type().apply(operands), is(expected));
        }
    }

    @Test
    public void testSameNamedOperandsTakePrecedenceOverSelect() {
        // g == h named yields a buffer of the shared operand even though f is named as well
        assertThat(GatePatternMatcher.classify(x, b, b).type(), is(GateType.BUFFER));
        assertThat(GatePatternMatcher.classify(x, b, b).inputs(), contains(b));
    }

    @Test
    public void testNoComplementDetection() {
        Signal complement = Signal.named("n7");
        assertThat(GatePatternMatcher.classify(x, complement, a).type(), is(GateType.MUX));
    }

    @Test
    public void testToGate() {
        Gate gate = GatePatternMatcher.toGate(x, a, Signal.FALSE, "n3", 5);
        assertThat(gate.type(), is(GateType.AND));
        assertThat(gate.output(), is("n3"));
        assertThat(gate.id(), is(5));
        assertThat(gate.toString(), is("AND n3 = x & a"));
        assertThat(GatePatternMatcher.toGate(x, a, b, "n4", 6).toString(), is("MUX n4 = x ? a : b"));
        assertThat(GatePatternMatcher.toGate(x, Signal.FALSE, b, "n5", 7).toString(), is("MUX n5 = x ? 1'b0 : b"));
    }

    @Test
    public void testGateArity() {
        assertThrows(IllegalArgumentException.class, () -> new Gate(GateType.AND, "y", List.of(x), 0));
        assertThrows(IllegalArgumentException.class, () -> new Gate(GateType.MUX, "y", List.of(x, a), 0));
    }

    private static boolean value(Signal signal, boolean xValue, boolean aValue, boolean bValue) {
        if (signal.isConstant()) {
            return signal.constantValue();
        }
        switch (signal.name()) {
            case "x":
                return xValue;
            case "a":
                return aValue;
            case "b":
                return bValue;
            default:
                throw new AssertionError(signal);
        }
    }
}
