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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class BddConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final int DEFAULT_INITIAL_CACHE_SIZE = 1024;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;

    /**
     * Initial capacity of the node table, including the two terminals.
     */
    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public int initialCacheSize() {
        return DEFAULT_INITIAL_CACHE_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    /**
     * Whether if-then-else is evaluated with explicit stacks instead of recursion.
     */
    @Value.Default
    public boolean iterative() {
        return false;
    }

    @Value.Default
    public boolean logStatistics() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 0, "Initial size %d not positive", initialSize());
        Util.checkArgument(initialCacheSize() > 0, "Initial cache size %d not positive", initialCacheSize());
        Util.checkArgument(growthFactor() > 1.0d, "Growth factor %f must be larger than 1", growthFactor());
    }
}
