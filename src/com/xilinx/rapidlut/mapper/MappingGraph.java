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

import com.xilinx.rapidlut.network.Network;
import com.xilinx.rapidlut.network.TopoOrder;

/**
 * The mutable state of one mapping run over an immutable {@link Network}: one {@link MapNode} per
 * network node plus the topological order of the output cones that every pass walks.
 */
public class MappingGraph {

    private final Network network;
    private final int lutSize;
    private final int[] topoOrder;
    private final MapNode[] mapNodes;
    private final boolean[] inCone;

    /**
     * Creates the mapping state for a network and orders its output cones.
     * @param network The network to map.
     * @param lutSize The LUT input bound K.
     * @throws com.xilinx.rapidlut.network.GraphException If the network cannot be ordered.
     */
    public MappingGraph(Network network, int lutSize) {
        this.network = network;
        this.lutSize = lutSize;
        this.topoOrder = TopoOrder.compute(network);
        this.mapNodes = new MapNode[network.getNodeCount()];
        for (int i = 0; i < mapNodes.length; i++) {
            mapNodes[i] = new MapNode(i);
        }
        this.inCone = new boolean[mapNodes.length];
        for (int id : topoOrder) {
            inCone[id] = true;
        }
    }

    public Network getNetwork() {
        return network;
    }

    public int getLutSize() {
        return lutSize;
    }

    /**
     * @return A copy of the node ids of all output cones, fanins first.
     */
    public int[] getTopoOrder() {
        return topoOrder.clone();
    }

    public MapNode getMapNode(int nodeId) {
        return mapNodes[nodeId];
    }

    public int getNodeCount() {
        return mapNodes.length;
    }

    /**
     * @param nodeId A node id.
     * @return True if the node feeds at least one primary output.
     */
    public boolean isInOutputCone(int nodeId) {
        return inCone[nodeId];
    }

    /**
     * Creates a read-only copy of a node's current analysis values.
     * @param nodeId A node id.
     * @return The snapshot.
     */
    public NodeSnapshot snapshot(int nodeId) {
        return new NodeSnapshot(network.getNode(nodeId), mapNodes[nodeId]);
    }
}
