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

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A gate operand: either a named signal (input variable, internal wire or output) or one of the two
 * Boolean constants.
 */
public final class Signal {
    public static final Signal FALSE = new Signal(null, false);
    public static final Signal TRUE = new Signal(null, true);

    @Nullable
    private final String name;
    private final boolean value;

    private Signal(@Nullable String name, boolean value) {
        this.name = name;
        this.value = value;
    }

    public static Signal named(String name) {
        checkArgument(name != null && !name.isEmpty(), "Empty signal name");
        return new Signal(name, false);
    }

    public static Signal constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isConstant() {
        return name == null;
    }

    public boolean isNamed() {
        return name != null;
    }

    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isFalse() {
        return this == FALSE;
    }

    /**
     * Returns the name of a named signal.
     *
     * @throws IllegalStateException if this signal is a constant.
     */
    public String name() {
        Util.checkState(name != null, "Constant %s has no name", this);
        return name;
    }

    /**
     * Returns the value of a constant.
     *
     * @throws IllegalStateException if this signal is named.
     */
    public boolean constantValue() {
        Util.checkState(name == null, "Signal %s is not constant", name);
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Signal)) {
            return false;
        }
        Signal other = (Signal) o;
        return value == other.value && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        if (name != null) {
            return name;
        }
        return value ? "1'b1" : "1'b0";
    }
}
