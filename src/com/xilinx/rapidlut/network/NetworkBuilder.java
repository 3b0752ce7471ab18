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

package com.xilinx.rapidlut.network;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Incrementally creates a {@link Network}. Every reference is checked as it is added, so a
 * malformed netlist is rejected at the boundary before any mapping pass runs.
 */
public class NetworkBuilder {

    private final List<NetworkNode> nodes = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private final List<Integer> outputNodes = new ArrayList<>();
    private final List<String> outputNames = new ArrayList<>();

    /**
     * Adds a primary input named after its id.
     * @return The id of the new node.
     */
    public int addInput() {
        return addInput("n" + nodes.size());
    }

    /**
     * Adds a named primary input.
     * @param name Unique node name.
     * @return The id of the new node.
     */
    public int addInput(String name) {
        return addNode(name, NodeKind.PRIMARY_INPUT, -1, -1);
    }

    /**
     * Adds a two-input gate named after its id.
     * @return The id of the new node.
     */
    public int addGate(int left, int right) {
        return addGate("n" + nodes.size(), left, right);
    }

    /**
     * Adds a named two-input gate.
     * @param name Unique node name.
     * @param left Id of the first fanin, must already exist.
     * @param right Id of the second fanin, must already exist.
     * @return The id of the new node.
     */
    public int addGate(String name, int left, int right) {
        int id = nodes.size();
        checkFanin(name, id, left);
        checkFanin(name, id, right);
        return addNode(name, NodeKind.GATE, left, right);
    }

    /**
     * Marks a node as a primary output named after its position.
     * @return The index of the new primary output.
     */
    public int addOutput(int nodeId) {
        return addOutput("po" + outputNodes.size(), nodeId);
    }

    /**
     * Marks a node as a named primary output. A node may drive several outputs.
     * @return The index of the new primary output.
     */
    public int addOutput(String name, int nodeId) {
        if (nodeId < 0 || nodeId >= nodes.size()) {
            throw new GraphException("ERROR: Output " + name + " references unknown node " + nodeId);
        }
        outputNodes.add(nodeId);
        outputNames.add(name);
        return outputNodes.size() - 1;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public Network build() {
        int[] outputs = new int[outputNodes.size()];
        for (int i = 0; i < outputs.length; i++) {
            outputs[i] = outputNodes.get(i);
        }
        return new Network(nodes, outputs, outputNames);
    }

    private void checkFanin(String name, int id, int fanin) {
        if (fanin == id) {
            throw new GraphException("ERROR: Gate " + name + " (" + id + ") references itself");
        }
        if (fanin < 0 || fanin > id) {
            throw new GraphException("ERROR: Gate " + name + " (" + id + ") references node " + fanin
                    + " which is not created before it");
        }
    }

    private int addNode(String name, NodeKind kind, int left, int right) {
        if (!names.add(name)) {
            throw new GraphException("ERROR: Duplicate node name " + name);
        }
        int id = nodes.size();
        nodes.add(new NetworkNode(id, name, kind, left, right));
        return id;
    }
}
