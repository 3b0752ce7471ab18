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

package com.xilinx.rapidlut.timing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import com.xilinx.rapidlut.mapper.NodeSnapshot;
import com.xilinx.rapidlut.util.MessageGenerator;

/**
 * Slack of every node constrained by a primary output. Unconstrained nodes are absent rather
 * than reported with zero slack.
 */
public class SlackReport {

    private final int timeMax;
    private final List<NodeSnapshot> entries;
    private final Map<Integer, NodeSnapshot> entriesById;

    public SlackReport(int timeMax, List<NodeSnapshot> entries) {
        this.timeMax = timeMax;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.entriesById = new HashMap<>();
        for (NodeSnapshot entry : entries) {
            entriesById.put(entry.getNodeId(), entry);
        }
    }

    public int getTimeMax() {
        return timeMax;
    }

    public List<NodeSnapshot> getEntries() {
        return entries;
    }

    /**
     * @param nodeId A node id.
     * @return The slack of the node, empty if no output constrains it.
     */
    public OptionalInt getSlack(int nodeId) {
        NodeSnapshot entry = entriesById.get(nodeId);
        return entry == null ? OptionalInt.empty() : entry.getSlack();
    }

    /**
     * @return The smallest slack in the report, empty if the report has no entries.
     */
    public OptionalInt getWorstSlack() {
        OptionalInt worst = OptionalInt.empty();
        for (NodeSnapshot entry : entries) {
            int slack = entry.getSlack().getAsInt();
            if (!worst.isPresent() || slack < worst.getAsInt()) {
                worst = OptionalInt.of(slack);
            }
        }
        return worst;
    }

    /**
     * @return The ids of the nodes with zero slack, in topological order.
     */
    public List<Integer> getCriticalNodes() {
        List<Integer> critical = new ArrayList<>();
        for (NodeSnapshot entry : entries) {
            if (entry.getSlack().getAsInt() == 0) {
                critical.add(entry.getNodeId());
            }
        }
        return critical;
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        s.append(MessageGenerator.formatString("Slack Report"));
        s.append(MessageGenerator.formatString("Required time at outputs: ", timeMax));
        for (NodeSnapshot entry : entries) {
            s.append(MessageGenerator.formatString("  " + entry.getName() + " (arrival "
                    + entry.getArrival() + ", required " + entry.getRequiredTime().getAsInt() + "): ",
                    entry.getSlack().getAsInt()));
        }
        return s.toString();
    }
}
