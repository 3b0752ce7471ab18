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

package com.xilinx.rapidlut.cut;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.xilinx.rapidlut.mapper.MapNode;
import com.xilinx.rapidlut.mapper.MappingGraph;
import com.xilinx.rapidlut.mapper.MappingInvariantException;
import com.xilinx.rapidlut.network.Network;
import com.xilinx.rapidlut.network.NetworkNode;

/**
 * Computes the K-feasible cuts of every node in the output cones, fanins first. A primary input
 * only has its trivial cut. A gate has its trivial cut followed by every union of a cut of its
 * first fanin with a cut of its second fanin that has at most K leaves, after removing the cuts
 * that contain another cut of the same list.
 */
public class CutEnumerator {

    /** Value of maxCutsPerNode that keeps every non-dominated cut */
    public static final int UNLIMITED = Integer.MAX_VALUE;

    private final MappingGraph graph;
    private final int maxCutsPerNode;
    private long totalCuts;

    public CutEnumerator(MappingGraph graph) {
        this(graph, UNLIMITED);
    }

    /**
     * @param graph The mapping state to fill.
     * @param maxCutsPerNode Number of non-trivial cuts kept per node, smallest first.
     */
    public CutEnumerator(MappingGraph graph, int maxCutsPerNode) {
        if (maxCutsPerNode < 1) {
            throw new IllegalArgumentException("ERROR: maxCutsPerNode must be positive, got " + maxCutsPerNode);
        }
        this.graph = graph;
        this.maxCutsPerNode = maxCutsPerNode;
    }

    /**
     * Replaces the cut list of every node in the output cones.
     */
    public void enumerateCuts() {
        Network network = graph.getNetwork();
        int lutSize = graph.getLutSize();
        totalCuts = 0;
        for (int id : graph.getTopoOrder()) {
            NetworkNode node = network.getNode(id);
            List<Cut> cuts = new ArrayList<>();
            cuts.add(Cut.trivial(id));
            if (!node.isPrimaryInput()) {
                List<Cut> leftCuts = getFaninCuts(node.getLeft(), id);
                List<Cut> rightCuts = getFaninCuts(node.getRight(), id);
                for (Cut u : leftCuts) {
                    for (Cut v : rightCuts) {
                        Cut merged = u.union(v, lutSize);
                        if (merged != null) {
                            cuts.add(merged);
                        }
                    }
                }
                pruneDominatedCuts(cuts);
                limitCuts(cuts);
            }
            graph.getMapNode(id).setCuts(cuts);
            totalCuts += cuts.size();
        }
    }

    /**
     * @return The number of cuts, trivial cuts included, found by the last enumeration.
     */
    public long getTotalCutCount() {
        return totalCuts;
    }

    /**
     * Removes, in place, every cut after the first that has another remaining cut of the list as a
     * subset. Of several equal cuts only the last one survives. The first cut is never removed.
     * @param cuts Candidate cuts, trivial cut first.
     */
    public static void pruneDominatedCuts(List<Cut> cuts) {
        int count = cuts.size();
        boolean[] removed = new boolean[count];
        for (int i = 1; i < count; i++) {
            Cut cut = cuts.get(i);
            for (int j = 0; j < count; j++) {
                if (i == j || removed[j]) continue;
                if (cuts.get(j).isSubsetOf(cut)) {
                    removed[i] = true;
                    break;
                }
            }
        }
        int kept = 0;
        for (int i = 0; i < count; i++) {
            if (!removed[i]) {
                cuts.set(kept++, cuts.get(i));
            }
        }
        cuts.subList(kept, count).clear();
    }

    private void limitCuts(List<Cut> cuts) {
        if (cuts.size() - 1 <= maxCutsPerNode) return;
        List<Cut> candidates = cuts.subList(1, cuts.size());
        Collections.sort(candidates);
        cuts.subList(1 + maxCutsPerNode, cuts.size()).clear();
    }

    private List<Cut> getFaninCuts(int fanin, int gate) {
        MapNode faninNode = graph.getMapNode(fanin);
        List<Cut> cuts = faninNode.getCuts();
        if (cuts.isEmpty()) {
            throw new MappingInvariantException("ERROR: Fanin " + fanin + " of node " + gate
                    + " has no cuts, nodes must be enumerated in topological order");
        }
        if (!cuts.get(0).equals(Cut.trivial(fanin))) {
            throw new MappingInvariantException("ERROR: First cut of node " + fanin
                    + " is not its trivial cut: " + cuts.get(0));
        }
        return cuts;
    }
}
