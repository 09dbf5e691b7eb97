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

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class BddState {
    @Param({"true", "false"})
    private boolean iterative;

    @Param({"1024"})
    private int initialCacheSize;

    private BddConfiguration configuration;

    @Setup(Level.Trial)
    public void setUpConfiguration() {
        configuration = ImmutableBddConfiguration.builder()
                .iterative(iterative)
                .initialCacheSize(initialCacheSize)
                .build();
    }

    public BddConfiguration configuration() {
        return configuration;
    }
}
