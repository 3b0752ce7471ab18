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

import com.xilinx.rapidlut.extract.LutNetwork;
import com.xilinx.rapidlut.network.Network;
import com.xilinx.rapidlut.timing.SlackReport;
import com.xilinx.rapidlut.util.MessageGenerator;

/**
 * Outcome of a {@link LutMapper} run: the LUT network, the slack report and read-only access to
 * the per-node analysis values.
 */
public final class MappingResult implements MappingView {

    private final MappingGraph graph;
    private final LutNetwork lutNetwork;
    private final SlackReport slackReport;
    private final int maxArrival;
    private final float outputAreaFlow;

    MappingResult(MappingGraph graph, LutNetwork lutNetwork, SlackReport slackReport, int maxArrival,
            float outputAreaFlow) {
        this.graph = graph;
        this.lutNetwork = lutNetwork;
        this.slackReport = slackReport;
        this.maxArrival = maxArrival;
        this.outputAreaFlow = outputAreaFlow;
    }

    public LutNetwork getLutNetwork() {
        return lutNetwork;
    }

    public SlackReport getSlackReport() {
        return slackReport;
    }

    /**
     * @return The largest arrival time over all primary outputs, in LUT levels.
     */
    public int getMaxArrival() {
        return maxArrival;
    }

    /**
     * @return The area flow summed over the primary outputs.
     */
    public float getOutputAreaFlow() {
        return outputAreaFlow;
    }

    @Override
    public Network getNetwork() {
        return graph.getNetwork();
    }

    @Override
    public int getLutSize() {
        return graph.getLutSize();
    }

    @Override
    public int[] getTopoOrder() {
        return graph.getTopoOrder();
    }

    @Override
    public NodeSnapshot getSnapshot(int nodeId) {
        return graph.snapshot(nodeId);
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        s.append(MessageGenerator.formatString("Mapping Result"));
        s.append(MessageGenerator.formatString("Network: ", graph.getNetwork()));
        s.append(MessageGenerator.formatString("LUT size: ", graph.getLutSize()));
        s.append(MessageGenerator.formatString("LUTs: ", lutNetwork.getLutCount()));
        s.append(MessageGenerator.formatString("LUT inputs: ", lutNetwork.getTotalInputs()));
        s.append(MessageGenerator.formatString("Max arrival (LUT levels): ", maxArrival));
        s.append(MessageGenerator.formatString("Output area flow: ", String.format("%.2f", outputAreaFlow)));
        return s.toString();
    }
}
