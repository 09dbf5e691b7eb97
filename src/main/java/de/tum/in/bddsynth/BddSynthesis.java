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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the complete flow from a minterm specification over a fresh manager to a netlist.
 */
public final class BddSynthesis {
    private static final Logger logger = Logger.getLogger(BddSynthesis.class.getName());
    private static final int PRINT_STRUCTURE_LIMIT = 10;

    private BddSynthesis() {}

    public static SynthesisResult synthesize(
            MintermSpecification specification, List<String> variableNames, String outputLabel) {
        return synthesize(specification, variableNames, outputLabel, DontCarePolicy.ZERO,
                ImmutableBddConfiguration.builder().build());
    }

    public static SynthesisResult synthesize(
            MintermSpecification specification,
            List<String> variableNames,
            String outputLabel,
            DontCarePolicy policy,
            BddConfiguration configuration) {
        Bdd bdd = BddFactory.buildBdd(specification.numberOfVariables(), configuration);
        int root = bdd.buildFromMinterms(specification, policy);

        logger.log(Level.FINE, "{0}: ON-set {1}, DC-set {2}, {3} diagram nodes ({4} non-terminal)",
                new Object[] {
                    outputLabel,
                    specification.onSet(),
                    specification.dcSet(),
                    bdd.nodeCount(),
                    bdd.nonTerminalNodeCount()
                });
        if (logger.isLoggable(Level.FINEST) && bdd.nonTerminalNodeCount() <= PRINT_STRUCTURE_LIMIT) {
            logger.log(Level.FINEST, "Diagram of {0}:\n{1}", new Object[] {outputLabel, bdd.treeToString(root)});
        }

        Netlist netlist = NetlistBuilder.build(bdd, root, variableNames, outputLabel);
        if (configuration.logStatistics()) {
            logger.log(Level.INFO, "{0}: {1} gates {2}\n{3}",
                    new Object[] {outputLabel, netlist.gates().size(), netlist.gateCounts(), bdd.statistics()});
        }

        return ImmutableSynthesisResult.builder()
                .outputLabel(outputLabel)
                .root(root)
                .totalNodeCount(bdd.nodeCount())
                .nonTerminalNodeCount(bdd.nonTerminalNodeCount())
                .netlist(netlist)
                .build();
    }

    /**
     * Synthesizes every output with all don't-cares resolved to {@code 0}.
     *
     * @see #synthesizeAll(Map, List, DontCarePolicy, BddConfiguration)
     */
    public static Map<String, SynthesisResult> synthesizeAll(
            Map<String, MintermSpecification> outputs, List<String> variableNames, BddConfiguration configuration) {
        return synthesizeAll(outputs, variableNames, DontCarePolicy.ZERO, configuration);
    }

    /**
     * Synthesizes every output independently, each with its own manager. The result preserves the
     * iteration order of {@code outputs}.
     */
    public static Map<String, SynthesisResult> synthesizeAll(
            Map<String, MintermSpecification> outputs,
            List<String> variableNames,
            DontCarePolicy policy,
            BddConfiguration configuration) {
        Map<String, SynthesisResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, MintermSpecification> output : outputs.entrySet()) {
            results.put(output.getKey(), synthesize(output.getValue(), variableNames, output.getKey(),
                    policy, configuration));
        }
        return results;
    }
}
