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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import com.xilinx.rapidlut.cut.Cut;
import com.xilinx.rapidlut.network.NetworkNode;

/**
 * An immutable copy of the analysis values of one node at the time it was taken. Reports and
 * observers work on snapshots so they cannot change the state of a mapping run.
 */
public final class NodeSnapshot {

    private final NetworkNode node;
    private final List<Cut> cuts;
    private final OptionalInt[] cutArrival;
    private final float[] cutAreaFlow;
    private final Cut bestCut;
    private final int arrival;
    private final float areaFlow;
    private final int numFanouts;
    private final OptionalInt requiredTime;

    NodeSnapshot(NetworkNode node, MapNode mapNode) {
        this.node = node;
        this.cuts = Collections.unmodifiableList(new ArrayList<>(mapNode.getCuts()));
        this.cutArrival = new OptionalInt[cuts.size()];
        this.cutAreaFlow = new float[cuts.size()];
        for (int i = 0; i < cuts.size(); i++) {
            cutArrival[i] = mapNode.getCutArrival(i);
            cutAreaFlow[i] = mapNode.getCutAreaFlow(i);
        }
        this.bestCut = mapNode.getBestCut();
        this.arrival = mapNode.getArrival();
        this.areaFlow = mapNode.getAreaFlow();
        this.numFanouts = mapNode.getNumFanouts();
        this.requiredTime = mapNode.getRequiredTime();
    }

    public int getNodeId() {
        return node.getId();
    }

    public String getName() {
        return node.getName();
    }

    public boolean isPrimaryInput() {
        return node.isPrimaryInput();
    }

    public List<Cut> getCuts() {
        return cuts;
    }

    /**
     * @param cutIndex Position in the cut list.
     * @return The arrival time through that cut, empty for the trivial cut.
     */
    public OptionalInt getCutArrival(int cutIndex) {
        return cutArrival[cutIndex];
    }

    /**
     * @param cutIndex Position in the cut list.
     * @return The area flow through that cut, NaN for the trivial cut.
     */
    public float getCutAreaFlow(int cutIndex) {
        return cutAreaFlow[cutIndex];
    }

    public Cut getBestCut() {
        return bestCut;
    }

    public int getArrival() {
        return arrival;
    }

    public float getAreaFlow() {
        return areaFlow;
    }

    public int getNumFanouts() {
        return numFanouts;
    }

    public OptionalInt getRequiredTime() {
        return requiredTime;
    }

    public OptionalInt getSlack() {
        return requiredTime.isPresent() ? OptionalInt.of(requiredTime.getAsInt() - arrival) : OptionalInt.empty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(node.getName());
        sb.append("\ncuts = ").append(cuts);
        sb.append("\nnode arrival = ").append(arrival);
        if (bestCut != null) {
            sb.append("\nbest cut = ").append(bestCut);
        }
        sb.append("\narea flow = ").append(areaFlow);
        sb.append("\nfanouts = ").append(numFanouts);
        if (requiredTime.isPresent()) {
            sb.append("\nrequired = ").append(requiredTime.getAsInt());
        }
        return sb.toString();
    }
}
