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

final class HashUtil {
    // Tables are sized in powers of two and indexed by masking, so the low bits have to be mixed well.

    static final int FNV_OFFSET = 0x811C9DC5;
    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int firstKey, int secondKey, int thirdKey) {
        int hash = FNV_OFFSET;
        hash = (hash ^ firstKey) * PRIME;
        hash = (hash ^ secondKey) * PRIME;
        hash = (hash ^ thirdKey) * PRIME;
        return hash ^ (hash >>> 16);
    }

    static int index(int hash, int tableSize) {
        assert Integer.bitCount(tableSize) == 1;
        return hash & (tableSize - 1);
    }
}
