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
import static de.tum.in.bddsynth.Util.checkState;
import static de.tum.in.bddsynth.Util.min;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/* Implementation notes:
 * - Variable numbers strictly increase while descending from a node, so every general ite step
 *   consumes one variable and the recursion depth is bounded by the number of variables.
 * - The recursive and the iterative ite create nodes in the same order (low before high), hence both
 *   yield identical node ids.
 */
@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "PMD.AssignmentInOperand",
    "ReassignedVariable",
    "ValueOfIncrementOrDecrementUsed"
})
final class BddImpl extends NodeTable implements Bdd {
    private static final Logger logger = Logger.getLogger(BddImpl.class.getName());

    private static final int MAXIMAL_TABLE_VARIABLES = 30;

    private final int numberOfVariables;
    private final IteCache cache;
    private final boolean iterative;

    /* Low and high successors of each node */
    private int[] tree;

    // Iterative stack, one frame per pending general ite step
    private final int[] cacheStackHash;
    private final int[] cacheStackIf;
    private final int[] cacheStackThen;
    private final int[] cacheStackElse;
    private final int[] branchStackVariable;
    private final int[] branchStackLowResult;
    private final int[] branchStackIf;
    private final int[] branchStackThen;
    private final int[] branchStackElse;

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    BddImpl(int numberOfVariables, BddConfiguration configuration) {
        super(configuration.initialSize(), configuration.growthFactor());
        checkArgument(numberOfVariables >= 0, "Negative number of variables %d", numberOfVariables);
        this.numberOfVariables = numberOfVariables;
        this.iterative = configuration.iterative();
        this.cache = new IteCache(configuration.initialCacheSize());

        tree = new int[2 * tableSize()];
        tree[2 * FALSE_NODE] = FALSE_NODE;
        tree[2 * FALSE_NODE + 1] = FALSE_NODE;
        tree[2 * TRUE_NODE] = TRUE_NODE;
        tree[2 * TRUE_NODE + 1] = TRUE_NODE;

        int stackSize = iterative ? numberOfVariables + 1 : 0;
        cacheStackHash = new int[stackSize];
        cacheStackIf = new int[stackSize];
        cacheStackThen = new int[stackSize];
        cacheStackElse = new int[stackSize];
        branchStackVariable = new int[stackSize];
        branchStackLowResult = new int[stackSize];
        branchStackIf = new int[stackSize];
        branchStackThen = new int[stackSize];
        branchStackElse = new int[stackSize];

        logger.log(Level.FINER, "Created {0} manager with {1} variables",
                new Object[] {iterative ? "iterative" : "recursive", numberOfVariables});
    }

    // Nodes

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[lookup * 2] == hashLookupLow && tree[lookup * 2 + 1] == hashLookupHigh;
    }

    @Override
    protected int hashCode(int node, int variable) {
        return HashUtil.hash(variable, tree[2 * node], tree[2 * node + 1]);
    }

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, 2 * newSize);
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        checkArgument(0 <= variable && variable < numberOfVariables, "Invalid variable %d", variable);
        checkArgument(isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high), "Invalid children %d, %d", low, high);
        checkArgument(isLeaf(low) || variable < variableOf(low),
                "Variable %d not above low child %d with variable %d", variable, low, variableOf(low));
        checkArgument(isLeaf(high) || variable < variableOf(high),
                "Variable %d not above high child %d with variable %d", variable, high, variableOf(high));
        return createNode(variable, low, high);
    }

    private int createNode(int variable, int low, int high) {
        assert isLeaf(low) || variable < variableOf(low);
        assert isLeaf(high) || variable < variableOf(high);

        if (low == high) {
            return low;
        }

        hashLookupLow = low;
        hashLookupHigh = high;
        int node = findOrCreateNode(variable, HashUtil.hash(variable, low, high));

        this.tree[2 * node] = low;
        this.tree[2 * node + 1] = high;
        assert hashCode(node, variable) == HashUtil.hash(variable, low, high);
        return node;
    }

    /**
     * Returns the existing node for the triple or {@link #NOT_A_NODE}, without allocating.
     */
    int lookupNode(int variable, int low, int high) {
        hashLookupLow = low;
        hashLookupHigh = high;
        return findNode(variable, HashUtil.hash(variable, low, high));
    }

    @Override
    public int low(int node) {
        assert isNodeValid(node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        assert isNodeValid(node);
        return tree[2 * node + 1];
    }

    // Variables

    @Override
    public int numberOfVariables() {
        return numberOfVariables;
    }

    @Override
    public int variableNode(int variable) {
        return makeNode(variable, FALSE_NODE, TRUE_NODE);
    }

    // Reading

    @Override
    public boolean evaluate(int node, boolean[] assignment) {
        checkArgument(assignment.length >= numberOfVariables,
                "Assignment of length %d for %d variables", assignment.length, numberOfVariables);
        int current = node;
        while (current >= FIRST_NODE) {
            assert isNodeValid(current);
            current = assignment[variableOf(current)] ? high(current) : low(current);
        }
        assert isLeaf(current);
        return current == TRUE_NODE;
    }

    // Construction

    @Override
    public int buildFromTruthTable(boolean[] values) {
        checkArgument(numberOfVariables <= MAXIMAL_TABLE_VARIABLES,
                "Truth tables over %d variables are not supported", numberOfVariables);
        int expectedLength = 1 << numberOfVariables;
        checkArgument(values.length == expectedLength,
                "Truth table size %d != 2^%d", values.length, numberOfVariables);

        // ones[i] = number of true entries among values[0 .. i - 1]
        int[] ones = new int[values.length + 1];
        for (int i = 0; i < values.length; i++) {
            ones[i + 1] = values[i] ? ones[i] + 1 : ones[i];
        }
        int root = buildRecursive(ones, 0, values.length, 0);
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Built diagram with {0} internal nodes from {1} table entries",
                    new Object[] {reachableNodeCount(root), values.length});
        }
        return root;
    }

    private int buildRecursive(int[] ones, int start, int end, int variable) {
        int count = ones[end] - ones[start];
        if (count == 0) {
            return FALSE_NODE;
        }
        if (count == end - start) {
            return TRUE_NODE;
        }
        assert variable < numberOfVariables;

        int mid = start + (end - start) / 2;
        int lowNode = buildRecursive(ones, start, mid, variable + 1);
        int highNode = buildRecursive(ones, mid, end, variable + 1);
        return createNode(variable, lowNode, highNode);
    }

    @Override
    public int buildFromMinterms(MintermSpecification specification, DontCarePolicy policy) {
        checkArgument(specification.numberOfVariables() == numberOfVariables,
                "Specification over %d variables given to manager over %d variables",
                specification.numberOfVariables(), numberOfVariables);
        return buildFromTruthTable(specification.truthTable(policy));
    }

    // If-then-else

    @Override
    public int ifThenElse(int ifNode, int thenNode, int elseNode) {
        checkArgument(isNodeValidOrLeaf(ifNode) && isNodeValidOrLeaf(thenNode) && isNodeValidOrLeaf(elseNode),
                "Invalid operands %d, %d, %d", ifNode, thenNode, elseNode);
        return iterative
                ? ifThenElseIterative(ifNode, thenNode, elseNode)
                : ifThenElseRecursive(ifNode, thenNode, elseNode);
    }

    private int topVariable(int ifNode, int thenNode, int elseNode) {
        int ifVar = isLeaf(ifNode) ? Integer.MAX_VALUE : variableOf(ifNode);
        int thenVar = isLeaf(thenNode) ? Integer.MAX_VALUE : variableOf(thenNode);
        int elseVar = isLeaf(elseNode) ? Integer.MAX_VALUE : variableOf(elseNode);
        int minVar = min(ifVar, thenVar, elseVar);
        assert minVar != Integer.MAX_VALUE;
        return minVar;
    }

    private int lowCofactor(int node, int variable) {
        return isLeaf(node) || variableOf(node) != variable ? node : low(node);
    }

    private int highCofactor(int node, int variable) {
        return isLeaf(node) || variableOf(node) != variable ? node : high(node);
    }

    private int ifThenElseRecursive(int ifNode, int thenNode, int elseNode) {
        if (ifNode == TRUE_NODE) {
            return thenNode;
        }
        if (ifNode == FALSE_NODE) {
            return elseNode;
        }
        if (thenNode == elseNode) {
            return thenNode;
        }
        if (thenNode == TRUE_NODE && elseNode == FALSE_NODE) {
            return ifNode;
        }
        if (thenNode == FALSE_NODE && elseNode == TRUE_NODE) {
            return notRecursive(ifNode);
        }
        return ifThenElseGeneral(ifNode, thenNode, elseNode);
    }

    private int notRecursive(int node) {
        assert !isLeaf(node);
        // Re-entering the (f, 0, 1) shortcut would not terminate
        return ifThenElseGeneral(node, FALSE_NODE, TRUE_NODE);
    }

    private int ifThenElseGeneral(int ifNode, int thenNode, int elseNode) {
        if (cache.lookupIfThenElse(ifNode, thenNode, elseNode)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int minVar = topVariable(ifNode, thenNode, elseNode);

        int lowNode = ifThenElseRecursive(
                lowCofactor(ifNode, minVar), lowCofactor(thenNode, minVar), lowCofactor(elseNode, minVar));
        int highNode = ifThenElseRecursive(
                highCofactor(ifNode, minVar), highCofactor(thenNode, minVar), highCofactor(elseNode, minVar));
        int result = createNode(minVar, lowNode, highNode);
        cache.putIfThenElse(hash, ifNode, thenNode, elseNode, result);
        return result;
    }

    private int ifThenElseIterative(int ifNode, int thenNode, int elseNode) {
        int[] cacheStackHash = this.cacheStackHash;
        int[] cacheIfArgStack = this.cacheStackIf;
        int[] cacheThenArgStack = this.cacheStackThen;
        int[] cacheElseArgStack = this.cacheStackElse;
        int[] branchStackVariable = this.branchStackVariable;
        int[] branchStackLowResult = this.branchStackLowResult;
        int[] branchTaskIfStack = this.branchStackIf;
        int[] branchTaskThenStack = this.branchStackThen;
        int[] branchTaskElseStack = this.branchStackElse;

        int stackIndex = 0;
        int currentIf = ifNode;
        int currentThen = thenNode;
        int currentElse = elseNode;

        while (true) {
            int result = NOT_A_NODE;
            do {
                if (currentIf == TRUE_NODE) {
                    result = currentThen;
                } else if (currentIf == FALSE_NODE) {
                    result = currentElse;
                } else if (currentThen == currentElse) {
                    result = currentThen;
                } else if (currentThen == TRUE_NODE && currentElse == FALSE_NODE) {
                    result = currentIf;
                } else if (cache.lookupIfThenElse(currentIf, currentThen, currentElse)) {
                    // (f, 0, 1) deliberately reaches this branch, see notRecursive
                    result = cache.lookupResult();
                } else {
                    int minVar = topVariable(currentIf, currentThen, currentElse);
                    checkState(stackIndex < branchStackVariable.length, "Ite stack overflow at depth %d", stackIndex);

                    cacheStackHash[stackIndex] = cache.lookupHash();
                    cacheIfArgStack[stackIndex] = currentIf;
                    cacheThenArgStack[stackIndex] = currentThen;
                    cacheElseArgStack[stackIndex] = currentElse;

                    branchStackVariable[stackIndex] = minVar;
                    branchStackLowResult[stackIndex] = NOT_A_NODE;
                    branchTaskIfStack[stackIndex] = highCofactor(currentIf, minVar);
                    branchTaskThenStack[stackIndex] = highCofactor(currentThen, minVar);
                    branchTaskElseStack[stackIndex] = highCofactor(currentElse, minVar);

                    currentIf = lowCofactor(currentIf, minVar);
                    currentThen = lowCofactor(currentThen, minVar);
                    currentElse = lowCofactor(currentElse, minVar);
                    stackIndex += 1;
                }
            } while (result == NOT_A_NODE);

            while (true) {
                if (stackIndex == 0) {
                    return result;
                }
                int frame = stackIndex - 1;
                if (branchStackLowResult[frame] == NOT_A_NODE) {
                    // Low branch finished, continue with the high branch of the same frame
                    branchStackLowResult[frame] = result;
                    currentIf = branchTaskIfStack[frame];
                    currentThen = branchTaskThenStack[frame];
                    currentElse = branchTaskElseStack[frame];
                    break;
                }

                result = createNode(branchStackVariable[frame], branchStackLowResult[frame], result);
                cache.putIfThenElse(cacheStackHash[frame], cacheIfArgStack[frame], cacheThenArgStack[frame],
                        cacheElseArgStack[frame], result);
                stackIndex = frame;
            }
        }
    }

    // Diagnostics

    int cacheSize() {
        return cache.size();
    }

    boolean isIterative() {
        return iterative;
    }

    /**
     * Checks reduction, ordering and canonicity of all allocated nodes.
     */
    void check() {
        for (int node = FIRST_NODE; node < nodeCount(); node++) {
            int variable = variableOf(node);
            int low = low(node);
            int high = high(node);
            checkState(low != high, "Node %d is redundant", node);
            checkState(0 <= variable && variable < numberOfVariables, "Node %d has invalid variable", node);
            checkState(isLeaf(low) || variable < variableOf(low), "Node %d violates ordering", node);
            checkState(isLeaf(high) || variable < variableOf(high), "Node %d violates ordering", node);

            int lookup = lookupNode(variable, low, high);
            checkState(lookup == node, "Node %d duplicated by %d", node, lookup);
        }
    }

    @Override
    public String statistics() {
        return getStatistics() + System.lineSeparator() + cache.getStatistics();
    }

    @Override
    public String toString() {
        return String.format("Bdd[%d variables, %d nodes, %s]", numberOfVariables, nodeCount(), cache);
    }
}
