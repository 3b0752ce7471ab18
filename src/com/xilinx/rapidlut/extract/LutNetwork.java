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
import java.util.Collections;
import java.util.List;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;

import com.xilinx.rapidlut.util.MessageGenerator;
import com.xilinx.rapidlut.util.Pair;

/**
 * The result of LUT extraction: the LUTs in creation order, each one created after the LUTs it
 * reads, and the reference driving each primary output.
 */
public class LutNetwork {

    private final List<Lut> luts;
    private final List<Pair<Integer, LutInput>> outputs;

    public LutNetwork(List<Lut> luts, List<Pair<Integer, LutInput>> outputs) {
        this.luts = Collections.unmodifiableList(new ArrayList<>(luts));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
    }

    public List<Lut> getLuts() {
        return luts;
    }

    public Lut getLut(int lutId) {
        return luts.get(lutId);
    }

    public int getLutCount() {
        return luts.size();
    }

    /**
     * @return (primary output index, driver) pairs in output order.
     */
    public List<Pair<Integer, LutInput>> getOutputs() {
        return outputs;
    }

    /**
     * @return The number of LUT input pins in the network.
     */
    public int getTotalInputs() {
        int total = 0;
        for (Lut lut : luts) {
            total += lut.getInputCount();
        }
        return total;
    }

    /**
     * Builds the LUT-to-LUT connectivity as a graph, with an edge from every LUT to each LUT that
     * reads it.
     * @return The graph over LUT ids.
     */
    public DirectedAcyclicGraph<Integer, DefaultEdge> buildLutGraph() {
        DirectedAcyclicGraph<Integer, DefaultEdge> graph = new DirectedAcyclicGraph<>(DefaultEdge.class);
        for (Lut lut : luts) {
            graph.addVertex(lut.getId());
        }
        for (Lut lut : luts) {
            for (LutInput input : lut.getInputs()) {
                if (input.isLut() && !graph.containsEdge(input.getId(), lut.getId())) {
                    graph.addEdge(input.getId(), lut.getId());
                }
            }
        }
        return graph;
    }

    /**
     * Computes the number of LUT levels on the longest path from a primary input to a primary
     * output.
     * @return The depth, 0 when every output is driven by a primary input.
     */
    public int getDepth() {
        DirectedAcyclicGraph<Integer, DefaultEdge> graph = buildLutGraph();
        int[] levels = new int[luts.size()];
        TopologicalOrderIterator<Integer, DefaultEdge> orderIterator = new TopologicalOrderIterator<>(graph);
        while (orderIterator.hasNext()) {
            int lutId = orderIterator.next();
            int level = 1;
            for (DefaultEdge e : graph.incomingEdgesOf(lutId)) {
                level = Math.max(level, levels[graph.getEdgeSource(e)] + 1);
            }
            levels[lutId] = level;
        }
        int depth = 0;
        for (Pair<Integer, LutInput> output : outputs) {
            if (output.getSecond().isLut()) {
                depth = Math.max(depth, levels[output.getSecond().getId()]);
            }
        }
        return depth;
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        s.append(MessageGenerator.formatString("LUT Network"));
        s.append(MessageGenerator.formatString("LUTs: ", luts.size()));
        s.append(MessageGenerator.formatString("LUT inputs: ", getTotalInputs()));
        s.append(MessageGenerator.formatString("Outputs: ", outputs.size()));
        return s.toString();
    }
}
