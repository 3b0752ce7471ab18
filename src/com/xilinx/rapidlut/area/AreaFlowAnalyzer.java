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

package com.xilinx.rapidlut.area;

import java.util.List;

import com.xilinx.rapidlut.cut.Cut;
import com.xilinx.rapidlut.mapper.MapNode;
import com.xilinx.rapidlut.mapper.MappingGraph;
import com.xilinx.rapidlut.mapper.MappingInvariantException;
import com.xilinx.rapidlut.network.Network;

/**
 * Estimates the mapped area of every cut of every gate once LUT extraction has counted the
 * fanouts. The area flow of a cut is one LUT plus the area flow of its gate leaves, shared among
 * the fanouts of the node it is rooted at. Primary inputs cost nothing. The selected cut is left
 * unchanged; its area flow becomes the area flow of the node.
 */
public class AreaFlowAnalyzer {

    private final MappingGraph graph;

    public AreaFlowAnalyzer(MappingGraph graph) {
        this.graph = graph;
    }

    /**
     * Computes/recomputes the area flow of every cut in the output cones, fanins first. Requires
     * LUT extraction.
     */
    public void computeAreaFlow() {
        Network network = graph.getNetwork();
        for (int id : graph.getTopoOrder()) {
            MapNode node = graph.getMapNode(id);
            if (network.isPrimaryInput(id)) {
                node.setAreaFlow(null, 0f);
                continue;
            }
            List<Cut> cuts = node.getCuts();
            Cut bestCut = node.getBestCut();
            int bestIndex = bestCut == null ? -1 : cuts.indexOf(bestCut);
            if (bestIndex < 1) {
                throw new MappingInvariantException("ERROR: Selected cut " + bestCut + " of gate " + id
                        + " is not one of its non-trivial cuts");
            }
            float fanouts = Math.max(node.getNumFanouts(), 1);
            float[] cutAreaFlow = new float[cuts.size()];
            cutAreaFlow[0] = Float.NaN;
            for (int i = 1; i < cuts.size(); i++) {
                Cut cut = cuts.get(i);
                float area = 1f;
                for (int l = 0; l < cut.size(); l++) {
                    int leaf = cut.getLeaf(l);
                    if (network.isPrimaryInput(leaf)) continue;
                    area += graph.getMapNode(leaf).getAreaFlow();
                }
                cutAreaFlow[i] = area / fanouts;
            }
            node.setAreaFlow(cutAreaFlow, cutAreaFlow[bestIndex]);
        }
    }

    /**
     * @return The sum of the area flow of the nodes driving the primary outputs, an estimate of
     * the number of LUTs in the mapped network.
     */
    public float getOutputAreaFlow() {
        Network network = graph.getNetwork();
        float total = 0f;
        for (int i = 0; i < network.getOutputCount(); i++) {
            total += graph.getMapNode(network.getOutputNode(i)).getAreaFlow();
        }
        return total;
    }
}
