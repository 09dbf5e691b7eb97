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
 * Constant a don't-care minterm is resolved to before a diagram is built. Diagrams never keep
 * don't-cares symbolically.
 */
public enum DontCarePolicy {
    /** Every don't-care becomes {@code 0}. */
    ZERO(false),
    /** Every don't-care becomes {@code 1}. */
    ONE(true);

    private final boolean value;

    DontCarePolicy(boolean value) {
        this.value = value;
    }

    public boolean value() {
        return value;
    }
}
