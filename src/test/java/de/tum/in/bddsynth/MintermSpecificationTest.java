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
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class MintermSpecificationTest {
    @Test
    public void testTruthTableZeroPolicy() {
        MintermSpecification specification = MintermSpecification.of(3, List.of(1, 6), List.of(2, 5));
        assertThat(specification.mintermCount(), is(8));
        assertArrayEquals(TruthTables.of(0, 1, 0, 0, 0, 0, 1, 0), specification.truthTable(DontCarePolicy.ZERO));
    }

    @Test
    public void testTruthTableOnePolicy() {
        MintermSpecification specification = MintermSpecification.of(3, List.of(1, 6), List.of(2, 5));
        assertArrayEquals(TruthTables.of(0, 1, 1, 0, 0, 1, 1, 0), specification.truthTable(DontCarePolicy.ONE));
    }

    @Test
    public void testOnSetWinsOverDontCare() {
        MintermSpecification specification = MintermSpecification.of(2, List.of(0, 3), List.of(3));
        assertArrayEquals(TruthTables.of(1, 0, 0, 1), specification.truthTable(DontCarePolicy.ZERO));
        assertArrayEquals(TruthTables.of(1, 0, 0, 1), specification.truthTable(DontCarePolicy.ONE));
    }

    @Test
    public void testDuplicatesCollapse() {
        MintermSpecification specification = MintermSpecification.of(2, List.of(1, 1, 2), List.of());
        assertThat(specification.onSet(), is(Set.of(1, 2)));
    }

    @Test
    public void testZeroVariables() {
        MintermSpecification specification = MintermSpecification.of(0, List.of(0), List.of());
        assertArrayEquals(TruthTables.of(1), specification.truthTable(DontCarePolicy.ZERO));
        assertArrayEquals(TruthTables.of(0),
                MintermSpecification.of(0, List.of(), List.of(0)).truthTable(DontCarePolicy.ZERO));
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> MintermSpecification.of(2, List.of(4), List.of()));
        assertThrows(IllegalArgumentException.class, () -> MintermSpecification.of(2, List.of(), List.of(-1)));
        assertThrows(IllegalArgumentException.class, () -> MintermSpecification.of(-1, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> MintermSpecification.of(MintermSpecification.MAXIMAL_VARIABLES + 1, List.of(), List.of()));
    }

    @Test
    public void testEquality() {
        assertThat(MintermSpecification.of(2, List.of(1, 2), List.of(0)),
                is(MintermSpecification.of(2, List.of(2, 1), List.of(0))));
    }
}
