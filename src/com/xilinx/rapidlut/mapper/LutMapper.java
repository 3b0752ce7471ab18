/*
 * Copyright (c) 2024, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidLUT.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.rapidlut.mapper;

import org.jetbrains.annotations.NotNull;

import com.xilinx.rapidlut.area.AreaFlowAnalyzer;
import com.xilinx.rapidlut.area.AreaRecovery;
import com.xilinx.rapidlut.cut.CutEnumerator;
import com.xilinx.rapidlut.extract.LutExtractor;
import com.xilinx.rapidlut.extract.LutNetwork;
import com.xilinx.rapidlut.network.Network;
import com.xilinx.rapidlut.timing.RequiredTimeAnalyzer;
import com.xilinx.rapidlut.timing.SlackReport;
import com.xilinx.rapidlut.timing.TimingAnalyzer;
import com.xilinx.rapidlut.util.MessageGenerator;
import com.xilinx.rapidlut.util.RuntimeTracker;
import com.xilinx.rapidlut.util.RuntimeTrackerTree;

/**
 * Maps a {@link Network} of two-input gates onto K-input LUTs. A run orders the output cones,
 * enumerates cuts, selects the earliest-arriving cut of every gate, extracts the LUT cover, then
 * estimates area flow and required times on the result. Each pass completes over the whole
 * network before the next one starts.
 */
public class LutMapper {

    public static final String ROOT_TRACKER = "Mapper total";
    public static final String TOPO_ORDER_TRACKER = "Topological order";

    private final Network network;
    private final LutMapperConfig config;
    private NodeObserver observer;
    private AreaRecovery areaRecovery;
    private RuntimeTrackerTree runtimeTrackers;

    /**
     * @param network The network to map.
     * @param config The mapping parameters.
     * @throws ConfigException If the parameters are invalid.
     */
    public LutMapper(@NotNull Network network, @NotNull LutMapperConfig config) {
        config.validate();
        this.network = network;
        this.config = config;
    }

    /**
     * Maps a network with default parameters and the given LUT size.
     * @param network The network to map.
     * @param lutSize The LUT input bound K.
     * @return The result of the run.
     */
    public static MappingResult map(@NotNull Network network, int lutSize) {
        LutMapperConfig config = new LutMapperConfig();
        config.setLutSize(lutSize);
        return new LutMapper(network, config).map();
    }

    /**
     * Sets an observer notified with every node of the output cones after each pass.
     * @param observer The observer, or null for none.
     */
    public void setObserver(NodeObserver observer) {
        this.observer = observer;
    }

    /**
     * Sets the step run after required times are computed.
     * @param areaRecovery The step, or null for none.
     */
    public void setAreaRecovery(AreaRecovery areaRecovery) {
        this.areaRecovery = areaRecovery;
    }

    /**
     * @return The runtime breakdown of the last run, null before the first one.
     */
    public RuntimeTrackerTree getRuntimeTrackers() {
        return runtimeTrackers;
    }

    /**
     * Runs every mapping pass.
     * @return The result of the run.
     * @throws ConfigException If the parameters were changed to invalid values.
     * @throws com.xilinx.rapidlut.network.GraphException If the network contains a cycle.
     */
    public MappingResult map() {
        config.validate();
        boolean verbose = config.isVerbose();
        runtimeTrackers = new RuntimeTrackerTree(ROOT_TRACKER, verbose);
        if (verbose) {
            MessageGenerator.printHeader("RapidLUT");
            MessageGenerator.briefMessage(config.toString());
            MessageGenerator.briefMessage("INFO: Mapping " + network);
        }

        RuntimeTracker tracker = startTracker(TOPO_ORDER_TRACKER);
        MappingGraph graph = new MappingGraph(network, config.getLutSize());
        tracker.stop();

        tracker = startTracker(AnalysisPass.CUT_ENUMERATION);
        CutEnumerator cutEnumerator = new CutEnumerator(graph, config.getMaxCutsPerNode());
        cutEnumerator.enumerateCuts();
        tracker.stop();
        notifyObserver(graph, AnalysisPass.CUT_ENUMERATION);
        if (verbose) {
            MessageGenerator.briefMessage("INFO: " + cutEnumerator.getTotalCutCount() + " cuts on "
                    + graph.getTopoOrder().length + " nodes");
        }

        tracker = startTracker(AnalysisPass.TIMING);
        TimingAnalyzer timingAnalyzer = new TimingAnalyzer(graph);
        timingAnalyzer.computeArrivalTimes();
        tracker.stop();
        notifyObserver(graph, AnalysisPass.TIMING);

        tracker = startTracker(AnalysisPass.LUT_EXTRACTION);
        LutNetwork lutNetwork = new LutExtractor(graph).extract();
        tracker.stop();
        notifyObserver(graph, AnalysisPass.LUT_EXTRACTION);

        tracker = startTracker(AnalysisPass.AREA_FLOW);
        AreaFlowAnalyzer areaFlowAnalyzer = new AreaFlowAnalyzer(graph);
        areaFlowAnalyzer.computeAreaFlow();
        tracker.stop();
        notifyObserver(graph, AnalysisPass.AREA_FLOW);

        tracker = startTracker(AnalysisPass.REQUIRED_TIME);
        RequiredTimeAnalyzer requiredTimeAnalyzer = new RequiredTimeAnalyzer(graph);
        requiredTimeAnalyzer.computeRequiredTimes();
        SlackReport slackReport = requiredTimeAnalyzer.getSlackReport();
        tracker.stop();
        notifyObserver(graph, AnalysisPass.REQUIRED_TIME);

        MappingResult result = new MappingResult(graph, lutNetwork, slackReport,
                timingAnalyzer.getMaxOutputArrival(), areaFlowAnalyzer.getOutputAreaFlow());
        if (areaRecovery != null) {
            areaRecovery.recoverArea(result, slackReport);
        }

        if (verbose) {
            MessageGenerator.briefMessage(result.toString());
            if (config.isPrintSlackReport()) {
                MessageGenerator.briefMessage(slackReport.toString());
            }
            MessageGenerator.briefMessage(runtimeTrackers.toString());
        }
        return result;
    }

    private RuntimeTracker startTracker(AnalysisPass pass) {
        return startTracker(pass.getLabel());
    }

    private RuntimeTracker startTracker(String name) {
        RuntimeTracker tracker = runtimeTrackers.createRuntimeTracker(name, ROOT_TRACKER);
        tracker.start();
        return tracker;
    }

    private void notifyObserver(MappingGraph graph, AnalysisPass pass) {
        if (observer == null) return;
        for (int id : graph.getTopoOrder()) {
            observer.onNode(pass, graph.snapshot(id));
        }
    }
}
