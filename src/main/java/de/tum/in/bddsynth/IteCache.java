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

import java.util.logging.Level;
import java.util.logging.Logger;

/*
 * Memo table of the general if-then-else case. Entries are never evicted or overwritten.
 *
 * Layout: open addressing with linear probing, four ints per slot (if, then, else, result).
 */
final class IteCache {
    private static final Logger logger = Logger.getLogger(IteCache.class.getName());

    private static final int EMPTY = NodeTable.NOT_A_NODE;
    private static final int SLOT_SIZE = 4;

    private final CacheStatistics statistics = new CacheStatistics();

    private int[] table;
    private int slotCount;
    private int entryCount = 0;

    private int lookupHash;
    private int lookupResult;

    IteCache(int initialSize) {
        slotCount = Util.nextPowerOfTwo(Math.max(initialSize, 16));
        table = new int[slotCount * SLOT_SIZE];
        clearSlots(table);
        lookupHash = 0;
        lookupResult = EMPTY;
    }

    private static void clearSlots(int[] table) {
        for (int i = 0; i < table.length; i += SLOT_SIZE) {
            table[i] = EMPTY;
        }
    }

    boolean lookupIfThenElse(int ifNode, int thenNode, int elseNode) {
        int hash = HashUtil.hash(ifNode, thenNode, elseNode);
        lookupHash = hash;
        statistics.lookup();

        int[] table = this.table;
        int mask = slotCount - 1;
        int slot = HashUtil.index(hash, slotCount);
        while (true) {
            int offset = slot * SLOT_SIZE;
            int storedIf = table[offset];
            if (storedIf == EMPTY) {
                return false;
            }
            if (storedIf == ifNode && table[offset + 1] == thenNode && table[offset + 2] == elseNode) {
                lookupResult = table[offset + 3];
                statistics.hit();
                return true;
            }
            slot = (slot + 1) & mask;
        }
    }

    /**
     * Hash of the key passed to the last {@link #lookupIfThenElse(int, int, int)} call.
     */
    int lookupHash() {
        return lookupHash;
    }

    int lookupResult() {
        assert lookupResult != EMPTY;
        return lookupResult;
    }

    void putIfThenElse(int hash, int ifNode, int thenNode, int elseNode, int resultNode) {
        assert hash == HashUtil.hash(ifNode, thenNode, elseNode);
        if (2 * (entryCount + 1) > slotCount) {
            resize(slotCount * 2);
        }
        if (insert(table, slotCount, hash, ifNode, thenNode, elseNode, resultNode)) {
            entryCount += 1;
            statistics.put();
        }
    }

    private static boolean insert(
            int[] table, int slotCount, int hash, int ifNode, int thenNode, int elseNode, int resultNode) {
        int mask = slotCount - 1;
        int slot = HashUtil.index(hash, slotCount);
        while (true) {
            int offset = slot * SLOT_SIZE;
            int storedIf = table[offset];
            if (storedIf == EMPTY) {
                table[offset] = ifNode;
                table[offset + 1] = thenNode;
                table[offset + 2] = elseNode;
                table[offset + 3] = resultNode;
                return true;
            }
            if (storedIf == ifNode && table[offset + 1] == thenNode && table[offset + 2] == elseNode) {
                assert table[offset + 3] == resultNode : "Inconsistent result for cached key";
                return false;
            }
            slot = (slot + 1) & mask;
        }
    }

    private void resize(int newSlotCount) {
        logger.log(Level.FINER, "Growing ite cache from {0} to {1} slots", new Object[] {slotCount, newSlotCount});
        int[] oldTable = this.table;
        int[] newTable = new int[newSlotCount * SLOT_SIZE];
        clearSlots(newTable);
        for (int offset = 0; offset < oldTable.length; offset += SLOT_SIZE) {
            int ifNode = oldTable[offset];
            if (ifNode == EMPTY) {
                continue;
            }
            int thenNode = oldTable[offset + 1];
            int elseNode = oldTable[offset + 2];
            insert(newTable, newSlotCount, HashUtil.hash(ifNode, thenNode, elseNode), ifNode, thenNode, elseNode,
                    oldTable[offset + 3]);
        }
        this.table = newTable;
        this.slotCount = newSlotCount;
        statistics.resize();
    }

    int size() {
        return entryCount;
    }

    String getStatistics() {
        return String.format("Ite cache: %d entries in %d slots%n%s", entryCount, slotCount, statistics);
    }

    @Override
    public String toString() {
        return String.format("IteCache[%d/%d]", entryCount, slotCount);
    }

    private static final class CacheStatistics {
        private long lookupCount = 0;
        private long hitCount = 0;
        private long putCount = 0;
        private int resizeCount = 0;

        void lookup() {
            lookupCount++;
        }

        void hit() {
            hitCount++;
        }

        void put() {
            putCount++;
        }

        void resize() {
            resizeCount++;
        }

        @Override
        public String toString() {
            float hitToLookupRatio = (float) hitCount / (float) Math.max(lookupCount, 1);
            return String.format(
                    "Cache access: lookup=%d, hit=%d, put=%d, hit-ratio=%3.3f, resized %d times",
                    lookupCount, hitCount, putCount, hitToLookupRatio, resizeCount);
        }
    }
}
