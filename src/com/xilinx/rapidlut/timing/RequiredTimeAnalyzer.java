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

package com.xilinx.rapidlut.timing;

import java.util.ArrayList;
import java.util.List;

import com.xilinx.rapidlut.cut.Cut;
import com.xilinx.rapidlut.mapper.MapNode;
import com.xilinx.rapidlut.mapper.MappingGraph;
import com.xilinx.rapidlut.mapper.MappingInvariantException;
import com.xilinx.rapidlut.mapper.NodeSnapshot;
import com.xilinx.rapidlut.network.Network;

/**
 * Propagates required times backwards from the primary outputs through the selected cuts. Every
 * output must arrive by the latest output arrival time; a LUT leaf must arrive one level before
 * the earliest requirement of the LUTs it feeds. Nodes that no selected cut reaches keep an
 * unbounded required time.
 */
public class RequiredTimeAnalyzer {

    private final MappingGraph graph;
    private int timeMax;

    public RequiredTimeAnalyzer(MappingGraph graph) {
        this.graph = graph;
    }

    /**
     * Computes/recomputes the required time of every node. Requires timing analysis.
     */
    public void computeRequiredTimes() {
        Network network = graph.getNetwork();
        for (int id = 0; id < graph.getNodeCount(); id++) {
            graph.getMapNode(id).resetRequiredTime();
        }
        timeMax = 0;
        for (int i = 0; i < network.getOutputCount(); i++) {
            timeMax = Math.max(timeMax, graph.getMapNode(network.getOutputNode(i)).getArrival());
        }
        for (int i = 0; i < network.getOutputCount(); i++) {
            graph.getMapNode(network.getOutputNode(i)).setMinRequiredTime(timeMax);
        }

        // reverse topological order settles a node's requirement before its leaves are visited
        int[] order = graph.getTopoOrder();
        for (int i = order.length - 1; i >= 0; i--) {
            int id = order[i];
            MapNode node = graph.getMapNode(id);
            if (network.isPrimaryInput(id) || !node.getRequiredTime().isPresent()) continue;
            Cut bestCut = node.getBestCut();
            if (bestCut == null) {
                throw new MappingInvariantException("ERROR: Gate " + id + " has no selected cut");
            }
            int leafRequired = node.getRequiredTime().getAsInt() - 1;
            for (int l = 0; l < bestCut.size(); l++) {
                graph.getMapNode(bestCut.getLeaf(l)).setMinRequiredTime(leafRequired);
            }
        }

        for (int id : order) {
            MapNode node = graph.getMapNode(id);
            if (node.getSlack().isPresent() && node.getSlack().getAsInt() < 0) {
                throw new MappingInvariantException("ERROR: Node " + id + " requires "
                        + node.getRequiredTime().getAsInt() + " but arrives at " + node.getArrival());
            }
        }
    }

    /**
     * @return The requirement placed on every primary output by the last computation.
     */
    public int getTimeMax() {
        return timeMax;
    }

    /**
     * Collects the slack of every node with a bounded required time, in topological order.
     * @return The report.
     */
    public SlackReport getSlackReport() {
        List<NodeSnapshot> entries = new ArrayList<>();
        for (int id : graph.getTopoOrder()) {
            if (graph.getMapNode(id).getRequiredTime().isPresent()) {
                entries.add(graph.snapshot(id));
            }
        }
        return new SlackReport(timeMax, entries);
    }
}
