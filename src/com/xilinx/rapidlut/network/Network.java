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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * An immutable structural DAG of primary inputs and two-input gates together with an ordered list
 * of primary outputs. A network carries no analysis state; the mapping passes keep theirs in a
 * {@link com.xilinx.rapidlut.mapper.MappingGraph}.
 */
public final class Network implements NodeSource {

    private final List<NetworkNode> nodes;
    private final int[] outputNodes;
    private final List<String> outputNames;
    private final Map<String, Integer> nodeIdsByName;
    private final int inputCount;

    Network(List<NetworkNode> nodes, int[] outputNodes, List<String> outputNames) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.outputNodes = outputNodes.clone();
        this.outputNames = Collections.unmodifiableList(new ArrayList<>(outputNames));
        this.nodeIdsByName = new HashMap<>();
        int inputs = 0;
        for (NetworkNode node : nodes) {
            if (nodeIdsByName.put(node.getName(), node.getId()) != null) {
                throw new GraphException("ERROR: Duplicate node name " + node.getName());
            }
            if (node.isPrimaryInput()) inputs++;
        }
        this.inputCount = inputs;
    }

    /**
     * Creates a network from an ordered node list, where every gate references two entries at
     * strictly smaller positions. Nodes receive the default names "n&lt;id&gt;" and outputs "po&lt;index&gt;".
     * @param specs The node list, the list position being the node id.
     * @param outputs The node id driving each primary output.
     * @return The new network.
     * @throws GraphException On a forward or self reference, or an output outside the node list.
     */
    public static Network fromNodeList(@NotNull List<NodeSpec> specs, @NotNull int[] outputs) {
        NetworkBuilder builder = new NetworkBuilder();
        for (NodeSpec spec : specs) {
            if (spec.getKind() == NodeKind.PRIMARY_INPUT) {
                builder.addInput();
            } else {
                builder.addGate(spec.getLeft(), spec.getRight());
            }
        }
        for (int output : outputs) {
            builder.addOutput(output);
        }
        return builder.build();
    }

    public NetworkNode getNode(int nodeId) {
        return nodes.get(nodeId);
    }

    public List<NetworkNode> getNodes() {
        return nodes;
    }

    /**
     * Looks up a node by name.
     * @param name Name of the node.
     * @return The node id.
     * @throws IllegalArgumentException If no node has this name.
     */
    public int getNodeId(String name) {
        Integer id = nodeIdsByName.get(name);
        if (id == null) {
            throw new IllegalArgumentException("ERROR: No node named " + name);
        }
        return id;
    }

    public int getInputCount() {
        return inputCount;
    }

    public int getGateCount() {
        return nodes.size() - inputCount;
    }

    public String getOutputName(int outputIndex) {
        return outputNames.get(outputIndex);
    }

    /**
     * @return A copy of the node ids driving the primary outputs, in output order.
     */
    public int[] getOutputNodes() {
        return outputNodes.clone();
    }

    @Override
    public int getNodeCount() {
        return nodes.size();
    }

    @Override
    public boolean isPrimaryInput(int nodeId) {
        return nodes.get(nodeId).isPrimaryInput();
    }

    @Override
    public int getLeft(int nodeId) {
        return nodes.get(nodeId).getLeft();
    }

    @Override
    public int getRight(int nodeId) {
        return nodes.get(nodeId).getRight();
    }

    @Override
    public int getOutputCount() {
        return outputNodes.length;
    }

    @Override
    public int getOutputNode(int outputIndex) {
        return outputNodes[outputIndex];
    }

    @Override
    public String toString() {
        return "Network[" + inputCount + " inputs, " + getGateCount() + " gates, "
                + outputNodes.length + " outputs]";
    }
}
