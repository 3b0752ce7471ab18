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

import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import com.xilinx.rapidlut.cut.Cut;

/**
 * Per-node analysis state of a mapping run: the cut list and the values the timing, extraction,
 * area-flow and required-time passes derive from it. The cost arrays run parallel to the cut list;
 * their first entry belongs to the trivial cut, which has no cost.
 * <p>
 * Instances are owned by a {@link MappingGraph}. Code outside the passes reads them through
 * {@link NodeSnapshot} copies.
 */
public class MapNode {

    private final int id;
    private List<Cut> cuts = Collections.emptyList();
    private int[] cutArrival;
    private float[] cutAreaFlow;
    private Cut bestCut;
    private int arrival;
    private float areaFlow;
    private int numFanouts;
    /** Null while unbounded */
    private Integer requiredTime;

    MapNode(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public List<Cut> getCuts() {
        return cuts;
    }

    /**
     * Replaces the cut list. Costs derived from the previous cut list are discarded.
     * @param cuts The new cut list, trivial cut first.
     */
    public void setCuts(List<Cut> cuts) {
        this.cuts = Collections.unmodifiableList(cuts);
        this.cutArrival = null;
        this.cutAreaFlow = null;
        this.bestCut = null;
    }

    /**
     * @return The first cut of the list, or null before cut enumeration.
     */
    public Cut getTrivialCut() {
        return cuts.isEmpty() ? null : cuts.get(0);
    }

    /**
     * Gets the arrival time of a candidate LUT rooted here using the given cut.
     * @param cutIndex Position in the cut list.
     * @return The arrival time, empty for the trivial cut or before timing analysis.
     */
    public OptionalInt getCutArrival(int cutIndex) {
        if (cutArrival == null || cutIndex == 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(cutArrival[cutIndex]);
    }

    /**
     * Gets the fanout-normalized area flow of a candidate LUT rooted here using the given cut.
     * @param cutIndex Position in the cut list.
     * @return The area flow, or NaN for the trivial cut or before area-flow analysis.
     */
    public float getCutAreaFlow(int cutIndex) {
        if (cutAreaFlow == null || cutIndex == 0) {
            return Float.NaN;
        }
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

    /**
     * Stores the result of timing analysis for this node.
     * @param cutArrival Arrival time per cut, parallel to the cut list (entry 0 is ignored), or
     * null for a primary input.
     * @param arrival Arrival time of the node.
     * @param areaFlow Provisional area of the selected cut.
     * @param bestCut Selected cut, null for a primary input.
     */
    public void setTiming(int[] cutArrival, int arrival, float areaFlow, Cut bestCut) {
        this.cutArrival = cutArrival;
        this.arrival = arrival;
        this.areaFlow = areaFlow;
        this.bestCut = bestCut;
    }

    /**
     * Stores the result of area-flow analysis for this node, leaving the selected cut unchanged.
     * @param cutAreaFlow Area flow per cut, parallel to the cut list (entry 0 is ignored), or null
     * for a primary input.
     * @param areaFlow Area flow of the selected cut.
     */
    public void setAreaFlow(float[] cutAreaFlow, float areaFlow) {
        this.cutAreaFlow = cutAreaFlow;
        this.areaFlow = areaFlow;
    }

    public int getNumFanouts() {
        return numFanouts;
    }

    public void setNumFanouts(int numFanouts) {
        this.numFanouts = numFanouts;
    }

    public void incrementNumFanouts() {
        numFanouts++;
    }

    /**
     * @return The latest arrival time allowed at this node, empty if no output constrains it.
     */
    public OptionalInt getRequiredTime() {
        return requiredTime == null ? OptionalInt.empty() : OptionalInt.of(requiredTime);
    }

    public void resetRequiredTime() {
        requiredTime = null;
    }

    /**
     * Sets the required time WHEN the new value is tighter than the current one.
     * @param candidate A required time implied by one fanout.
     */
    public void setMinRequiredTime(int candidate) {
        if (requiredTime == null || candidate < requiredTime) {
            requiredTime = candidate;
        }
    }

    /**
     * @return Required time minus arrival time, empty while the required time is unbounded.
     */
    public OptionalInt getSlack() {
        return requiredTime == null ? OptionalInt.empty() : OptionalInt.of(requiredTime - arrival);
    }

    @Override
    public String toString() {
        return "MapNode[" + id + ", arrival=" + arrival + ", best=" + bestCut + "]";
    }
}
