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
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.xilinx.rapidlut.mapper.MappingGraph;
import com.xilinx.rapidlut.network.Network;
import com.xilinx.rapidlut.support.NetworkFixtures;

public class TestCutEnumerator {

    private static MappingGraph enumerate(Network network, int lutSize) {
        MappingGraph graph = new MappingGraph(network, lutSize);
        new CutEnumerator(graph).enumerateCuts();
        return graph;
    }

    @Test
    public void testReconvergentNetworkCuts() {
        MappingGraph graph = enumerate(NetworkFixtures.reconvergentNetwork(), 4);
        Assertions.assertEquals(Arrays.asList(Cut.of(0)), graph.getMapNode(0).getCuts());
        Assertions.assertEquals(Arrays.asList(Cut.of(3), Cut.of(0, 1)), graph.getMapNode(3).getCuts());
        Assertions.assertEquals(Arrays.asList(Cut.of(5), Cut.of(3, 4), Cut.of(1, 2, 3), Cut.of(0, 1, 4),
                Cut.of(0, 1, 2)), graph.getMapNode(5).getCuts());
        // {a,d,b,c} is dominated by {a,b,c}
        Assertions.assertEquals(Arrays.asList(Cut.of(6), Cut.of(0, 5), Cut.of(0, 3, 4), Cut.of(0, 1, 4),
                Cut.of(0, 1, 2)), graph.getMapNode(6).getCuts());
    }

    @Test
    public void testSmallLutSizeDropsLargeUnions() {
        MappingGraph graph = enumerate(NetworkFixtures.reconvergentNetwork(), 2);
        Assertions.assertEquals(Arrays.asList(Cut.of(5), Cut.of(3, 4)), graph.getMapNode(5).getCuts());
        Assertions.assertEquals(Arrays.asList(Cut.of(6), Cut.of(0, 5)), graph.getMapNode(6).getCuts());
    }

    @Test
    public void testSupersetIsPruned() {
        List<Cut> cuts = new ArrayList<>(Arrays.asList(Cut.of(9), Cut.of(0, 1, 2), Cut.of(0, 1)));
        CutEnumerator.pruneDominatedCuts(cuts);
        Assertions.assertEquals(Arrays.asList(Cut.of(9), Cut.of(0, 1)), cuts);
    }

    @Test
    public void testEqualCutsKeepOne() {
        List<Cut> cuts = new ArrayList<>(Arrays.asList(Cut.of(9), Cut.of(0, 1), Cut.of(2, 3), Cut.of(1, 0)));
        CutEnumerator.pruneDominatedCuts(cuts);
        Assertions.assertEquals(3, cuts.size());
        Assertions.assertEquals(Cut.of(9), cuts.get(0));
        Assertions.assertEquals(1, cuts.stream().filter(c -> c.equals(Cut.of(0, 1))).count());
    }

    @Test
    public void testTrivialCutNeverPruned() {
        List<Cut> cuts = new ArrayList<>(Arrays.asList(Cut.of(4), Cut.of(4, 5)));
        CutEnumerator.pruneDominatedCuts(cuts);
        Assertions.assertEquals(Arrays.asList(Cut.of(4)), cuts);
    }

    @ParameterizedTest
    @CsvSource({
        "1, 1", "2, 2", "3, 3", "4, 4", "5, 5", "6, 6",
        "11, 2", "12, 3", "13, 4", "14, 6",
    })
    public void testCutListInvariants(long seed, int lutSize) {
        Network network = NetworkFixtures.randomNetwork(seed, 4, 30);
        MappingGraph graph = enumerate(network, lutSize);
        for (int id : graph.getTopoOrder()) {
            List<Cut> cuts = graph.getMapNode(id).getCuts();
            Assertions.assertEquals(Cut.trivial(id), cuts.get(0));
            for (int i = 1; i < cuts.size(); i++) {
                Assertions.assertTrue(cuts.get(i).size() <= lutSize);
                Assertions.assertFalse(cuts.get(i).contains(id));
                for (int j = 1; j < cuts.size(); j++) {
                    if (i == j) continue;
                    Assertions.assertFalse(cuts.get(i).isSubsetOf(cuts.get(j)),
                            cuts.get(i) + " and " + cuts.get(j) + " of node " + id);
                }
            }
            if (network.isPrimaryInput(id)) {
                Assertions.assertEquals(1, cuts.size());
            } else if (lutSize >= 2) {
                Assertions.assertTrue(cuts.size() > 1);
            }
        }
    }

    @Test
    public void testLutSizeOneLeavesOnlyTrivialCuts() {
        MappingGraph graph = enumerate(NetworkFixtures.reconvergentNetwork(), 1);
        for (int id : graph.getTopoOrder()) {
            Assertions.assertEquals(Arrays.asList(Cut.trivial(id)), graph.getMapNode(id).getCuts());
        }
    }

    @Test
    public void testIdempotent() {
        Network network = NetworkFixtures.randomNetwork(99, 5, 50);
        MappingGraph graph = new MappingGraph(network, 5);
        CutEnumerator enumerator = new CutEnumerator(graph);
        enumerator.enumerateCuts();
        List<List<Cut>> first = new ArrayList<>();
        for (int id : graph.getTopoOrder()) first.add(graph.getMapNode(id).getCuts());
        long count = enumerator.getTotalCutCount();
        enumerator.enumerateCuts();
        int i = 0;
        for (int id : graph.getTopoOrder()) {
            Assertions.assertEquals(first.get(i++), graph.getMapNode(id).getCuts());
        }
        Assertions.assertEquals(count, enumerator.getTotalCutCount());
    }

    @Test
    public void testCutLimitKeepsSmallestCuts() {
        Network network = NetworkFixtures.reconvergentNetwork();
        MappingGraph graph = new MappingGraph(network, 4);
        new CutEnumerator(graph, 2).enumerateCuts();
        Assertions.assertEquals(Arrays.asList(Cut.of(5), Cut.of(3, 4), Cut.of(0, 1, 2)), graph.getMapNode(5).getCuts());
        for (int id : graph.getTopoOrder()) {
            Assertions.assertTrue(graph.getMapNode(id).getCuts().size() <= 3);
        }
        Assertions.assertThrows(IllegalArgumentException.class, () -> new CutEnumerator(graph, 0));
    }
}
