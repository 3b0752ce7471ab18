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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.rapidlut.support.NetworkFixtures;

public class TestTopoOrder {

    /** A hand-written graph that may contain cycles, which a {@link Network} cannot express */
    private static class ArrayNodeSource implements NodeSource {
        private final int[] left;
        private final int[] right;
        private final int[] outputs;

        ArrayNodeSource(int[] left, int[] right, int... outputs) {
            this.left = left;
            this.right = right;
            this.outputs = outputs;
        }

        @Override
        public int getNodeCount() {
            return left.length;
        }

        @Override
        public boolean isPrimaryInput(int nodeId) {
            return left[nodeId] < 0;
        }

        @Override
        public int getLeft(int nodeId) {
            return left[nodeId];
        }

        @Override
        public int getRight(int nodeId) {
            return right[nodeId];
        }

        @Override
        public int getOutputCount() {
            return outputs.length;
        }

        @Override
        public int getOutputNode(int outputIndex) {
            return outputs[outputIndex];
        }
    }

    @Test
    public void testPostOrder() {
        Network network = NetworkFixtures.reconvergentNetwork();
        // a, b, d, c, e, f, x: left cone first, shared b emitted once at its first discovery
        Assertions.assertArrayEquals(new int[] {0, 1, 3, 2, 4, 5, 6}, TopoOrder.compute(network));
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 42, 1234})
    public void testFaninsBeforeFanouts(long seed) {
        Network network = NetworkFixtures.randomNetwork(seed, 5, 40);
        int[] order = TopoOrder.compute(network);
        int[] position = new int[network.getNodeCount()];
        Arrays.fill(position, -1);
        for (int i = 0; i < order.length; i++) {
            Assertions.assertEquals(-1, position[order[i]], "node emitted twice");
            position[order[i]] = i;
        }
        for (int id : order) {
            NetworkNode node = network.getNode(id);
            if (node.isPrimaryInput()) continue;
            Assertions.assertTrue(position[node.getLeft()] >= 0 && position[node.getLeft()] < position[id]);
            Assertions.assertTrue(position[node.getRight()] >= 0 && position[node.getRight()] < position[id]);
        }
        for (int i = 0; i < network.getOutputCount(); i++) {
            Assertions.assertTrue(position[network.getOutputNode(i)] >= 0);
        }
    }

    @Test
    public void testOnlyOutputConesAreOrdered() {
        NetworkBuilder builder = new NetworkBuilder();
        int a = builder.addInput("a");
        int b = builder.addInput("b");
        int c = builder.addInput("c");
        int used = builder.addGate("used", a, b);
        builder.addGate("dangling", b, c);
        builder.addOutput(used);
        int[] order = TopoOrder.compute(builder.build());
        Assertions.assertArrayEquals(new int[] {a, b, used}, order);
    }

    @Test
    public void testReentrant() {
        Network network = NetworkFixtures.randomNetwork(7, 4, 30);
        int[] first = TopoOrder.compute(network);
        int[] second = TopoOrder.compute(network);
        Assertions.assertArrayEquals(first, second);

        int[] subCone = TopoOrder.compute(network, new int[] {network.getNodeCount() - 1});
        Set<Integer> full = new HashSet<>();
        for (int id : first) full.add(id);
        for (int id : subCone) Assertions.assertTrue(full.contains(id));
    }

    @Test
    public void testDeepChainDoesNotOverflow() {
        Network network = NetworkFixtures.andChain(200_000);
        int[] order = TopoOrder.compute(network);
        Assertions.assertEquals(network.getNodeCount(), order.length);
        Assertions.assertEquals(network.getNodeCount() - 1, order[order.length - 1]);
    }

    @Test
    public void testCycleDetected() {
        // 0, 1 inputs; 2 = 0 & 3; 3 = 2 & 1
        NodeSource cyclic = new ArrayNodeSource(new int[] {-1, -1, 0, 2}, new int[] {-1, -1, 3, 1}, 3);
        GraphException e = Assertions.assertThrows(GraphException.class, () -> TopoOrder.compute(cyclic));
        Assertions.assertTrue(e.getMessage().contains("Cycle"));
    }

    @Test
    public void testSelfLoopDetected() {
        NodeSource cyclic = new ArrayNodeSource(new int[] {-1, 1}, new int[] {-1, 0}, 1);
        Assertions.assertThrows(GraphException.class, () -> TopoOrder.compute(cyclic));
    }

    @Test
    public void testUnknownNodeReference() {
        NodeSource broken = new ArrayNodeSource(new int[] {-1, 0}, new int[] {-1, 5}, 1);
        Assertions.assertThrows(GraphException.class, () -> TopoOrder.compute(broken));
    }
}
