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

import static de.tum.in.bddsynth.Util.checkState;

import java.util.Arrays;
import java.util.BitSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only node arena together with the unique table. Nodes are never freed, hence ids are
 * handed out sequentially and the arena only ever grows.
 */
public abstract class NodeTable implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    protected static final int NOT_A_NODE = -1;
    protected static final int FALSE_NODE = 0;
    protected static final int TRUE_NODE = 1;
    protected static final int FIRST_NODE = 2;

    private static final int LEAF_VARIABLE = -1;
    private static final int MAXIMAL_NODE_COUNT = (1 << 30) - 8;

    private final double growthFactor;

    /* Variable of each node, LEAF_VARIABLE for the two terminals. */
    private int[] variables;

    /* Hash map for existing nodes. hashToChainStart maps a bucket to the most recently created node
     * with that bucket, hashChain links each node to the next older node of the same bucket. */
    private int[] hashToChainStart;
    private int[] hashChain;

    /* Id of the next node to be created, equals the number of allocated nodes. */
    private int nextNode;

    // Statistics
    private long lookups = 0;
    private long lookupHits = 0;
    private long chainLookupLength = 0;
    private long growCount = 0;

    protected NodeTable(int initialSize, double growthFactor) {
        this.growthFactor = growthFactor;
        int tableSize = Math.min(Math.max(initialSize, FIRST_NODE + 1), MAXIMAL_NODE_COUNT);

        variables = new int[tableSize];
        hashChain = new int[tableSize];
        hashToChainStart = new int[Util.nextPowerOfTwo(tableSize)];
        Arrays.fill(hashToChainStart, NOT_A_NODE);

        // Just to ensure a fail-fast
        Arrays.fill(hashChain, 0, FIRST_NODE, Integer.MIN_VALUE);
        variables[FALSE_NODE] = LEAF_VARIABLE;
        variables[TRUE_NODE] = LEAF_VARIABLE;
        nextNode = FIRST_NODE;
    }

    @Override
    public final int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public final int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public boolean isLeaf(int node) {
        assert isNodeValidOrLeaf(node);
        return node < FIRST_NODE;
    }

    @Override
    public int variableOf(int node) {
        assert isNodeValidOrLeaf(node);
        return variables[node];
    }

    @Override
    public int nodeCount() {
        return nextNode;
    }

    public boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextNode;
    }

    /**
     * Determines if the given {@code node} is either a leaf or valid.
     */
    public boolean isNodeValidOrLeaf(int node) {
        return 0 <= node && node < nextNode;
    }

    public int tableSize() {
        return variables.length;
    }

    // Unique table

    protected abstract boolean checkLookupChildrenMatch(int lookup);

    protected abstract int hashCode(int node, int variable);

    protected abstract void onTableResize(int newSize);

    /**
     * Returns the node with the given variable whose children match the pending lookup (see
     * {@link #checkLookupChildrenMatch(int)}), allocating a fresh one if none exists. The caller is
     * responsible for writing the children of a fresh node.
     */
    protected int findOrCreateNode(int variable, int hashCode) {
        int[] variables = this.variables;
        int[] hashChain = this.hashChain;

        int currentLookupNode = hashToChainStart[HashUtil.index(hashCode, hashToChainStart.length)];
        int chainLookups = 1;
        lookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (variables[currentLookupNode] == variable && checkLookupChildrenMatch(currentLookupNode)) {
                chainLookupLength += chainLookups;
                lookupHits += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        chainLookupLength += chainLookups;

        if (nextNode == this.variables.length) {
            grow();
        }

        int freeNode = nextNode;
        nextNode += 1;
        this.variables[freeNode] = variable;
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    /**
     * Read-only variant of {@link #findOrCreateNode(int, int)}: returns the matching node or
     * {@link #NOT_A_NODE}, never allocates and does not touch the statistics.
     */
    protected int findNode(int variable, int hashCode) {
        int currentLookupNode = hashToChainStart[HashUtil.index(hashCode, hashToChainStart.length)];
        while (currentLookupNode != NOT_A_NODE) {
            if (variables[currentLookupNode] == variable && checkLookupChildrenMatch(currentLookupNode)) {
                return currentLookupNode;
            }
            currentLookupNode = hashChain[currentLookupNode];
        }
        return NOT_A_NODE;
    }

    private void connectHashList(int node, int hashCode) {
        int position = HashUtil.index(hashCode, hashToChainStart.length);
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private void grow() {
        int oldSize = variables.length;
        checkState(oldSize < MAXIMAL_NODE_COUNT, "Node table exhausted at %d nodes", oldSize);
        long grownSize = Math.max(oldSize + 1L, (long) Math.ceil(oldSize * growthFactor));
        int newSize = (int) Math.min(grownSize, MAXIMAL_NODE_COUNT);
        logger.log(Level.FINE, "Growing node table from {0} to {1}", new Object[] {oldSize, newSize});

        growCount += 1;
        variables = Arrays.copyOf(variables, newSize);
        hashChain = Arrays.copyOf(hashChain, newSize);
        onTableResize(newSize);

        int bucketCount = Util.nextPowerOfTwo(newSize);
        if (bucketCount != hashToChainStart.length) {
            rehash(bucketCount);
        }
    }

    private void rehash(int bucketCount) {
        logger.log(Level.FINER, "Rehashing unique table into {0} buckets", bucketCount);
        hashToChainStart = new int[bucketCount];
        Arrays.fill(hashToChainStart, NOT_A_NODE);
        for (int node = FIRST_NODE; node < nextNode; node++) {
            connectHashList(node, hashCode(node, variables[node]));
        }
    }

    // Traversal

    @Override
    public int reachableNodeCount(int node) {
        int[] count = {0};
        forEachNodeBelowOnce(node, (child, variable) -> count[0] += 1);
        return count[0];
    }

    /**
     * Calls {@code action} once for every internal node reachable from {@code node} (including
     * itself), in depth-first pre-order with low children first.
     */
    protected void forEachNodeBelowOnce(int node, NodeVisitor action) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return;
        }
        BitSet seen = new BitSet(nextNode);
        int[] stack = new int[64];
        int stackIndex = 0;
        stack[stackIndex++] = node;
        while (stackIndex > 0) {
            int current = stack[--stackIndex];
            if (isLeaf(current) || seen.get(current)) {
                continue;
            }
            seen.set(current);
            action.visit(current, variables[current]);

            if (stackIndex + 2 > stack.length) {
                stack = Arrays.copyOf(stack, stack.length * 2);
            }
            stack[stackIndex++] = high(current);
            stack[stackIndex++] = low(current);
        }
    }

    // Printing

    public String nodeToString(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return String.format("%5d|LEAF %s", node, node == TRUE_NODE ? "1" : "0");
        }
        return String.format("%5d|%3d|%5d|%5d", node, variables[node], low(node), high(node));
    }

    /**
     * Generates a string representation of the given {@code node}.
     *
     * @param node The node to be printed.
     * @return A string representing the given node.
     */
    public String treeToString(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return String.format("Node %d%n", node);
        }
        StringBuilder builder =
                new StringBuilder(50).append("Node ").append(node).append('\n').append("  NODE|VAR| LOW| HIGH\n");
        forEachNodeBelowOnce(
                node,
                (child, variable) -> builder.append(' ').append(nodeToString(child)).append('\n'));
        return builder.toString();
    }

    public String getStatistics() {
        return String.format(
                "Node table statistics:%n"
                        + "Table size: %1$d, %2$d nodes (%3$d internal), %4$d grows%n"
                        + "Unique table: %5$d buckets, %6$d lookups, %7$d hits, %8$.2f avg. chain length",
                tableSize(),
                nodeCount(),
                nodeCount() - FIRST_NODE,
                growCount,
                hashToChainStart.length,
                lookups,
                lookupHits,
                lookups == 0 ? 0.0d : chainLookupLength * 1.0 / lookups);
    }

    @FunctionalInterface
    protected interface NodeVisitor {
        void visit(int node, int variable);
    }
}
