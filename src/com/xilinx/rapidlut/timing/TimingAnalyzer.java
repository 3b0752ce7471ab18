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

import java.util.List;

import com.xilinx.rapidlut.cut.Cut;
import com.xilinx.rapidlut.mapper.MapNode;
import com.xilinx.rapidlut.mapper.MappingGraph;
import com.xilinx.rapidlut.mapper.MappingInvariantException;
import com.xilinx.rapidlut.network.Network;

/**
 * Delay-driven cut selection. Walking the output cones fanins first, every gate gets the arrival
 * time of each non-trivial cut (one LUT level above its latest leaf) and selects the earliest one,
 * breaking ties by the smaller provisional area and then by cut order.
 */
public class TimingAnalyzer {

    private final MappingGraph graph;

    public TimingAnalyzer(MappingGraph graph) {
        this.graph = graph;
    }

    /**
     * Computes/recomputes the arrival time, provisional area and selected cut of every node in the
     * output cones. Requires cut enumeration.
     */
    public void computeArrivalTimes() {
        Network network = graph.getNetwork();
        for (int id : graph.getTopoOrder()) {
            MapNode node = graph.getMapNode(id);
            List<Cut> cuts = node.getCuts();
            if (cuts.isEmpty() || !cuts.get(0).equals(Cut.trivial(id))) {
                throw new MappingInvariantException("ERROR: First cut of node " + id
                        + " is not its trivial cut: " + cuts);
            }
            if (network.isPrimaryInput(id)) {
                node.setTiming(null, 0, 0f, null);
                continue;
            }
            if (cuts.size() < 2) {
                throw new MappingInvariantException("ERROR: Gate " + network.getNode(id).getName()
                        + " has no non-trivial cut");
            }

            int[] cutArrival = new int[cuts.size()];
            int bestIndex = -1;
            int bestArrival = Integer.MAX_VALUE;
            float bestArea = Float.MAX_VALUE;
            // skip trivial cut
            for (int i = 1; i < cuts.size(); i++) {
                Cut cut = cuts.get(i);
                int maxArrival = -1;
                float area = 1f;
                for (int l = 0; l < cut.size(); l++) {
                    MapNode leaf = graph.getMapNode(cut.getLeaf(l));
                    maxArrival = Math.max(maxArrival, leaf.getArrival());
                    area += leaf.getAreaFlow();
                }
                cutArrival[i] = 1 + maxArrival;
                if (cutArrival[i] < bestArrival || (cutArrival[i] == bestArrival && area < bestArea)) {
                    bestIndex = i;
                    bestArrival = cutArrival[i];
                    bestArea = area;
                }
            }
            if (bestIndex < 0) {
                throw new MappingInvariantException("ERROR: No best cut selected for node " + id);
            }
            node.setTiming(cutArrival, bestArrival, bestArea, cuts.get(bestIndex));
        }
    }

    /**
     * @return The largest arrival time over all primary outputs, 0 if there are none.
     */
    public int getMaxOutputArrival() {
        int max = 0;
        Network network = graph.getNetwork();
        for (int i = 0; i < network.getOutputCount(); i++) {
            max = Math.max(max, graph.getMapNode(network.getOutputNode(i)).getArrival());
        }
        return max;
    }
}
