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
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.xilinx.rapidlut.cut.Cut;
import com.xilinx.rapidlut.extract.Lut;
import com.xilinx.rapidlut.extract.LutInput;
import com.xilinx.rapidlut.extract.LutNetwork;
import com.xilinx.rapidlut.network.GraphException;
import com.xilinx.rapidlut.network.Network;
import com.xilinx.rapidlut.network.NodeSpec;
import com.xilinx.rapidlut.support.NetworkFixtures;
import com.xilinx.rapidlut.timing.SlackReport;
import com.xilinx.rapidlut.util.Pair;
import com.xilinx.rapidlut.util.RuntimeTrackerTree;

public class TestLutMapper {

    @Test
    public void testReconvergentNetwork() {
        MappingResult result = LutMapper.map(NetworkFixtures.reconvergentNetwork(), 4);
        LutNetwork luts = result.getLutNetwork();
        Assertions.assertEquals(1, luts.getLutCount());
        Assertions.assertEquals(Arrays.asList(LutInput.primaryInput(0), LutInput.primaryInput(1),
                LutInput.primaryInput(2)), luts.getLut(0).getInputs());
        Assertions.assertEquals(1, result.getMaxArrival());
        Assertions.assertEquals(1f, result.getOutputAreaFlow(), 1e-6f);

        NodeSnapshot x = result.getSnapshot(6);
        Assertions.assertEquals("x", x.getName());
        Assertions.assertEquals(Cut.of(0, 1, 2), x.getBestCut());
        Assertions.assertEquals(0, x.getSlack().getAsInt());
        Assertions.assertFalse(result.getSnapshot(5).getRequiredTime().isPresent());
    }

    @Test
    public void testChain() {
        Network network = NetworkFixtures.andChain(5);
        MappingResult result = LutMapper.map(network, 4);
        Assertions.assertEquals(2, result.getLutNetwork().getLutCount());
        Assertions.assertTrue(result.getLutNetwork().getLutCount() < network.getGateCount());
        Assertions.assertEquals(2, result.getMaxArrival());
        Assertions.assertEquals(2, result.getSlackReport().getTimeMax());
        Assertions.assertEquals(0, result.getSlackReport().getWorstSlack().getAsInt());
        Assertions.assertArrayEquals(new int[] {0, 1, 6, 2, 7, 3, 8, 4, 9, 5, 10}, result.getTopoOrder());
    }

    @Test
    public void testFromNodeList() {
        List<NodeSpec> nodes = Arrays.asList(NodeSpec.input(), NodeSpec.input(), NodeSpec.gate(0, 1));
        Network network = Network.fromNodeList(nodes, new int[] {2, 0});
        MappingResult result = LutMapper.map(network, 6);
        List<Pair<Integer, LutInput>> outputs = result.getLutNetwork().getOutputs();
        Assertions.assertEquals(LutInput.lut(0), outputs.get(0).getSecond());
        Assertions.assertEquals(LutInput.primaryInput(0), outputs.get(1).getSecond());
        Assertions.assertEquals(1, result.getMaxArrival());
    }

    @Test
    public void testInvalidLutSize() {
        LutMapperConfig config = new LutMapperConfig();
        config.setLutSize(1);
        Network network = NetworkFixtures.andChain(3);
        Assertions.assertThrows(ConfigException.class, () -> new LutMapper(network, config));
        Assertions.assertThrows(ConfigException.class, () -> LutMapper.map(network, 17));
    }

    @Test
    public void testConfigCheckedOnEveryRun() {
        LutMapperConfig config = new LutMapperConfig();
        config.setLutSize(4);
        LutMapper mapper = new LutMapper(NetworkFixtures.andChain(3), config);
        mapper.map();
        config.setMaxCutsPerNode(0);
        Assertions.assertThrows(ConfigException.class, mapper::map);
    }

    @Test
    public void testForwardReferenceRejected() {
        List<NodeSpec> nodes = Arrays.asList(NodeSpec.input(), NodeSpec.gate(0, 2), NodeSpec.gate(1, 0));
        Assertions.assertThrows(GraphException.class, () -> Network.fromNodeList(nodes, new int[] {2}));
    }

    @Test
    public void testObserver() {
        Network network = NetworkFixtures.reconvergentNetwork();
        LutMapperConfig config = new LutMapperConfig();
        config.setLutSize(4);
        LutMapper mapper = new LutMapper(network, config);
        Map<AnalysisPass, List<NodeSnapshot>> seen = new EnumMap<>(AnalysisPass.class);
        mapper.setObserver((pass, snapshot) -> seen.computeIfAbsent(pass, p -> new ArrayList<>()).add(snapshot));
        MappingResult result = mapper.map();

        Assertions.assertEquals(AnalysisPass.values().length, seen.size());
        for (List<NodeSnapshot> snapshots : seen.values()) {
            Assertions.assertEquals(result.getTopoOrder().length, snapshots.size());
        }
        // snapshots keep the values of the pass that produced them
        NodeSnapshot afterCuts = seen.get(AnalysisPass.CUT_ENUMERATION).get(6);
        Assertions.assertEquals(6, afterCuts.getNodeId());
        Assertions.assertNull(afterCuts.getBestCut());
        Assertions.assertFalse(afterCuts.getCutArrival(1).isPresent());
        Assertions.assertEquals(5, afterCuts.getCuts().size());

        NodeSnapshot afterTiming = seen.get(AnalysisPass.TIMING).get(6);
        Assertions.assertEquals(1, afterTiming.getArrival());
        Assertions.assertEquals(0, afterTiming.getNumFanouts());
        Assertions.assertFalse(afterTiming.getRequiredTime().isPresent());

        NodeSnapshot afterExtraction = seen.get(AnalysisPass.LUT_EXTRACTION).get(0);
        Assertions.assertEquals(1, afterExtraction.getNumFanouts());
        Assertions.assertTrue(Float.isNaN(seen.get(AnalysisPass.LUT_EXTRACTION).get(6).getCutAreaFlow(1)));
        Assertions.assertFalse(Float.isNaN(seen.get(AnalysisPass.AREA_FLOW).get(6).getCutAreaFlow(1)));
        Assertions.assertEquals(1, seen.get(AnalysisPass.REQUIRED_TIME).get(6).getRequiredTime().getAsInt());
    }

    @Test
    public void testAreaRecoveryHook() {
        LutMapperConfig config = new LutMapperConfig();
        config.setLutSize(4);
        LutMapper mapper = new LutMapper(NetworkFixtures.andChain(5), config);
        AtomicInteger calls = new AtomicInteger();
        mapper.setAreaRecovery((view, slackReport) -> {
            calls.incrementAndGet();
            Assertions.assertEquals(4, view.getLutSize());
            Assertions.assertEquals(2, slackReport.getTimeMax());
            Assertions.assertEquals(1, view.getSnapshot(4).getSlack().getAsInt());
        });
        mapper.map();
        Assertions.assertEquals(1, calls.get());
    }

    @Test
    public void testRuntimeTrackers() {
        LutMapperConfig config = new LutMapperConfig(new String[] {"--lutSize", "4", "--verbose", "--printSlackReport"});
        LutMapper mapper = new LutMapper(NetworkFixtures.reconvergentNetwork(), config);
        Assertions.assertNull(mapper.getRuntimeTrackers());
        mapper.map();
        RuntimeTrackerTree trackers = mapper.getRuntimeTrackers();
        Assertions.assertEquals(LutMapper.ROOT_TRACKER, trackers.getRootRuntimeTracker());
        Assertions.assertNotNull(trackers.getRuntimeTracker(LutMapper.TOPO_ORDER_TRACKER));
        for (AnalysisPass pass : AnalysisPass.values()) {
            Assertions.assertTrue(trackers.getRuntimeTracker(pass.getLabel()).getTime() >= 0);
        }
        Assertions.assertEquals(AnalysisPass.values().length + 1,
                trackers.getRuntimeTracker(LutMapper.ROOT_TRACKER).getChildren().size());
    }

    @ParameterizedTest
    @CsvSource({"1, 2", "2, 3", "3, 4", "4, 6", "5, 6"})
    public void testRandomNetworks(long seed, int lutSize) {
        Network network = NetworkFixtures.randomNetwork(seed, 8, 50);
        MappingResult result = LutMapper.map(network, lutSize);
        LutNetwork luts = result.getLutNetwork();

        Assertions.assertEquals(result.getMaxArrival(), luts.getDepth());
        Assertions.assertTrue(luts.getLutCount() <= network.getGateCount());
        for (Lut lut : luts.getLuts()) {
            Assertions.assertTrue(lut.getInputCount() <= lutSize);
        }

        SlackReport report = result.getSlackReport();
        Assertions.assertEquals(result.getMaxArrival(), report.getTimeMax());
        Assertions.assertEquals(0, report.getWorstSlack().getAsInt());
        for (NodeSnapshot entry : report.getEntries()) {
            Assertions.assertTrue(entry.getSlack().getAsInt() >= 0);
        }
        for (int i = 0; i < network.getOutputCount(); i++) {
            Assertions.assertEquals(report.getTimeMax(),
                    result.getSnapshot(network.getOutputNode(i)).getRequiredTime().getAsInt());
        }
    }
}
