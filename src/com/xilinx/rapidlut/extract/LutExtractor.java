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

package com.xilinx.rapidlut.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.xilinx.rapidlut.cut.Cut;
import com.xilinx.rapidlut.mapper.MapNode;
import com.xilinx.rapidlut.mapper.MappingGraph;
import com.xilinx.rapidlut.mapper.MappingInvariantException;
import com.xilinx.rapidlut.network.Network;
import com.xilinx.rapidlut.util.Pair;

/**
 * Covers the network with LUTs, starting from the primary outputs and following the selected cut
 * of each gate. A gate reached through several paths gets a single LUT that all of its readers
 * share. Each LUT input slot adds one to the fanout count of the node it reads.
 */
public class LutExtractor {

    private final MappingGraph graph;
    private int[] lutIdByNode;

    public LutExtractor(MappingGraph graph) {
        this.graph = graph;
    }

    /**
     * Extracts the LUT network and recounts node fanouts. Requires timing analysis.
     * @return The LUT network.
     */
    public LutNetwork extract() {
        Network network = graph.getNetwork();
        for (int id = 0; id < graph.getNodeCount(); id++) {
            graph.getMapNode(id).setNumFanouts(0);
        }
        lutIdByNode = new int[graph.getNodeCount()];
        Arrays.fill(lutIdByNode, -1);
        List<Lut> luts = new ArrayList<>();
        List<Pair<Integer, LutInput>> outputs = new ArrayList<>();

        for (int i = 0; i < network.getOutputCount(); i++) {
            int nodeId = network.getOutputNode(i);
            if (network.isPrimaryInput(nodeId)) {
                outputs.add(new Pair<>(i, LutInput.primaryInput(nodeId)));
                continue;
            }
            extractCone(nodeId, luts);
            outputs.add(new Pair<>(i, LutInput.lut(lutIdByNode[nodeId])));
        }
        return new LutNetwork(luts, outputs);
    }

    private void extractCone(int root, List<Lut> luts) {
        if (lutIdByNode[root] >= 0) return;
        Network network = graph.getNetwork();
        // stackState is the next leaf position to visit for the node at the same depth
        int[] stackNodes = new int[16];
        int[] stackState = new int[16];
        int sp = 0;
        stackNodes[sp] = root;
        stackState[sp] = 0;
        sp++;
        while (sp > 0) {
            int nodeId = stackNodes[sp - 1];
            Cut bestCut = getBestCut(nodeId);
            int state = stackState[sp - 1];
            if (state < bestCut.size()) {
                int leaf = bestCut.getLeaf(state);
                stackState[sp - 1]++;
                if (network.isPrimaryInput(leaf) || lutIdByNode[leaf] >= 0) continue;
                if (sp == stackNodes.length) {
                    stackNodes = Arrays.copyOf(stackNodes, sp * 2);
                    stackState = Arrays.copyOf(stackState, sp * 2);
                }
                stackNodes[sp] = leaf;
                stackState[sp] = 0;
                sp++;
                continue;
            }
            sp--;
            List<LutInput> inputs = new ArrayList<>(bestCut.size());
            for (int l = 0; l < bestCut.size(); l++) {
                int leaf = bestCut.getLeaf(l);
                inputs.add(network.isPrimaryInput(leaf) ? LutInput.primaryInput(leaf) : LutInput.lut(lutIdByNode[leaf]));
                graph.getMapNode(leaf).incrementNumFanouts();
            }
            int lutId = luts.size();
            luts.add(new Lut(lutId, nodeId, inputs));
            lutIdByNode[nodeId] = lutId;
        }
    }

    private Cut getBestCut(int nodeId) {
        MapNode node = graph.getMapNode(nodeId);
        Cut bestCut = node.getBestCut();
        if (bestCut == null) {
            throw new MappingInvariantException("ERROR: Gate " + nodeId + " has no selected cut, "
                    + "timing analysis must run before LUT extraction");
        }
        return bestCut;
    }
}
